package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;

/**
 * Greenwich and local sidereal time in degrees (Meeus eq. 12.4).
 */
public final class SiderealTime {

    private SiderealTime() {
    }

    public static double greenwichMean(final double julianDayUt) {
        final var t = JulianDay.centuries(julianDayUt);
        return Angles.normalize(280.46061837 + 360.98564736629 * (julianDayUt - JulianDay.J2000)
                + 0.000387933 * t * t - t * t * t / 38_710_000.0);
    }

    /**
     * Mean sidereal time corrected by the equation of the equinoxes.
     */
    public static double greenwichApparent(final double julianDayUt) {
        final var jdTt = TimeScales.toTerrestrial(julianDayUt);
        return Angles.normalize(greenwichMean(julianDayUt)
                + Nutation.deltaPsi(jdTt) * Angles.cosDeg(Nutation.trueObliquity(jdTt)));
    }

    /**
     * Right ascension of the meridian (RAMC) at an east-positive longitude.
     */
    public static double localApparent(final double julianDayUt, final double longitude) {
        return Angles.normalize(greenwichApparent(julianDayUt) + longitude);
    }
}
