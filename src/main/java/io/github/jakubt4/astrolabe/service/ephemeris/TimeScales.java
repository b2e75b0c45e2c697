package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.util.JulianDay;

/**
 * UT to TT conversion using the Espenak-Meeus polynomial fits for ΔT.
 */
public final class TimeScales {

    private static final double SECONDS_PER_DAY = 86_400.0;

    private TimeScales() {
    }

    /**
     * ΔT = TT - UT in seconds for a decimal year.
     */
    public static double deltaT(final double year) {
        if (year < 1900) {
            final var u = (year - 1820) / 100;
            return -20 + 32 * u * u;
        }
        if (year < 1920) {
            final var t = year - 1900;
            return -2.79 + 1.494119 * t - 0.0598939 * t * t + 0.0061966 * t * t * t - 0.000197 * t * t * t * t;
        }
        if (year < 1941) {
            final var t = year - 1920;
            return 21.20 + 0.84493 * t - 0.076100 * t * t + 0.0020936 * t * t * t;
        }
        if (year < 1961) {
            final var t = year - 1950;
            return 29.07 + 0.407 * t - t * t / 233 + t * t * t / 2547;
        }
        if (year < 1986) {
            final var t = year - 1975;
            return 45.45 + 1.067 * t - t * t / 260 - t * t * t / 718;
        }
        if (year < 2005) {
            final var t = year - 2000;
            return 63.86 + 0.3345 * t - 0.060374 * t * t + 0.0017275 * t * t * t
                    + 0.000651814 * t * t * t * t + 0.00002373599 * t * t * t * t * t;
        }
        if (year < 2050) {
            final var t = year - 2000;
            return 62.92 + 0.32217 * t + 0.005589 * t * t;
        }
        if (year < 2150) {
            final var u = (year - 1820) / 100;
            return -20 + 32 * u * u - 0.5628 * (2150 - year);
        }
        final var u = (year - 1820) / 100;
        return -20 + 32 * u * u;
    }

    public static double toTerrestrial(final double julianDayUt) {
        return julianDayUt + deltaT(JulianDay.decimalYear(julianDayUt)) / SECONDS_PER_DAY;
    }
}
