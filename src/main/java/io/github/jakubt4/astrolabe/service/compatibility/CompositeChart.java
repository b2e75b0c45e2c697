package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.model.BodyPosition;

import java.util.List;

/**
 * Shorter-arc midpoints of two charts' bodies, cusps and angles.
 */
public record CompositeChart(List<BodyPosition> positions, List<Double> cusps, double ascendant, double midheaven) {

    public CompositeChart {
        positions = List.copyOf(positions);
        cusps = List.copyOf(cusps);
    }
}
