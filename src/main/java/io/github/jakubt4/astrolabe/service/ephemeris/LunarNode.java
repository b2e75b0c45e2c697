package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;

/**
 * Mean longitude of the Moon's ascending node (Meeus eq. 47.7).
 */
public final class LunarNode {

    private LunarNode() {
    }

    public static double meanAscending(final double julianDayTt) {
        final var t = JulianDay.centuries(julianDayTt);
        return Angles.normalize(125.0445479 - 1934.1362891 * t + 0.0020754 * t * t
                + t * t * t / 467441.0 - t * t * t * t / 60616000.0);
    }
}
