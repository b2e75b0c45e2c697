package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.util.JulianDay;

import static io.github.jakubt4.astrolabe.util.Angles.cosDeg;
import static io.github.jakubt4.astrolabe.util.Angles.sinDeg;

/**
 * Low-precision nutation (Meeus ch. 22, accurate to about 0.5") and the obliquity of the ecliptic.
 */
public final class Nutation {

    private Nutation() {
    }

    /**
     * Nutation in longitude, degrees.
     */
    public static double deltaPsi(final double julianDayTt) {
        final var t = JulianDay.centuries(julianDayTt);
        final var omega = lunarNodeArgument(t);
        final var sunMean = 280.4665 + 36000.7698 * t;
        final var moonMean = 218.3165 + 481267.8813 * t;
        return (-17.20 * sinDeg(omega) - 1.32 * sinDeg(2 * sunMean)
                - 0.23 * sinDeg(2 * moonMean) + 0.21 * sinDeg(2 * omega)) / 3600.0;
    }

    /**
     * Nutation in obliquity, degrees.
     */
    public static double deltaEpsilon(final double julianDayTt) {
        final var t = JulianDay.centuries(julianDayTt);
        final var omega = lunarNodeArgument(t);
        final var sunMean = 280.4665 + 36000.7698 * t;
        final var moonMean = 218.3165 + 481267.8813 * t;
        return (9.20 * cosDeg(omega) + 0.57 * cosDeg(2 * sunMean)
                + 0.10 * cosDeg(2 * moonMean) - 0.09 * cosDeg(2 * omega)) / 3600.0;
    }

    public static double meanObliquity(final double julianDayTt) {
        final var t = JulianDay.centuries(julianDayTt);
        return 23.0 + 26.0 / 60.0 + 21.448 / 3600.0
                - (46.8150 * t + 0.00059 * t * t - 0.001813 * t * t * t) / 3600.0;
    }

    public static double trueObliquity(final double julianDayTt) {
        return meanObliquity(julianDayTt) + deltaEpsilon(julianDayTt);
    }

    private static double lunarNodeArgument(final double t) {
        return 125.04452 - 1934.136261 * t + 0.0020708 * t * t + t * t * t / 450000.0;
    }
}
