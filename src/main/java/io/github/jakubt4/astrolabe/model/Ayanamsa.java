package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;
import io.github.jakubt4.astrolabe.util.JulianDay;

/**
 * Sidereal offsets, each defined by its value at J2000.0 carried forward with the
 * general precession in longitude.
 */
public enum Ayanamsa {

    LAHIRI(23.857092),
    RAMAN(22.410791),
    KRISHNAMURTI(23.760237),
    FAGAN_BRADLEY(24.740300);

    private final double valueAtJ2000;

    Ayanamsa(final double valueAtJ2000) {
        this.valueAtJ2000 = valueAtJ2000;
    }

    /**
     * Offset in degrees to subtract from a tropical longitude at the given Julian Day.
     */
    public double valueAt(final double julianDay) {
        final var t = JulianDay.centuries(julianDay);
        return valueAtJ2000 + (5028.796195 * t + 1.1054348 * t * t) / 3600.0;
    }

    public static Ayanamsa parse(final String value) {
        for (final var ayanamsa : values()) {
            if (ayanamsa.name().equalsIgnoreCase(value.trim().replace('-', '_'))) {
                return ayanamsa;
            }
        }
        throw new UnsupportedParameterException("ayanamsa", value);
    }
}
