package io.github.jakubt4.astrolabe.client;

import io.github.jakubt4.astrolabe.model.GeoLocation;

import java.time.ZoneId;

public record GeocodedPlace(String name, GeoLocation location, ZoneId zone) {
}
