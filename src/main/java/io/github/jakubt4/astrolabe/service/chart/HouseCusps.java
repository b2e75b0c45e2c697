package io.github.jakubt4.astrolabe.service.chart;

import java.util.List;

/**
 * Twelve cusps from the first house, with the two angles, in the zodiac they were requested in.
 */
public record HouseCusps(List<Double> cusps, double ascendant, double midheaven) {

    public HouseCusps {
        cusps = List.copyOf(cusps);
    }
}
