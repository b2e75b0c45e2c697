package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;

import java.time.Instant;

/**
 * A timed transit.
 *
 * @param target natal point for aspects, the sign entered for ingresses, {@code null} for stations
 * @param aspect aspect perfected, {@code null} unless {@code type} is {@code ASPECT}
 */
public record TransitEvent(TransitEventType type, Body body, String target, AspectType aspect,
                           double julianDay, Instant instant, double longitude) {
}
