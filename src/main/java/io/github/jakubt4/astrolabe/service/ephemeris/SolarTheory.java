package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;

import static io.github.jakubt4.astrolabe.util.Angles.cosDeg;
import static io.github.jakubt4.astrolabe.util.Angles.sinDeg;

/**
 * Geocentric Sun from the equation of centre (Meeus ch. 25), accurate to about 0.01°.
 */
final class SolarTheory {

    private static final double ABERRATION_ARCSEC = 20.4898;

    private SolarTheory() {
    }

    /**
     * True geometric longitude referred to the mean equinox of date, with the radius vector in AU.
     */
    static EclipticCoordinates meanOfDate(final double julianDayTt) {
        final var t = JulianDay.centuries(julianDayTt);
        final var meanLongitude = 280.46646 + 36000.76983 * t + 0.0003032 * t * t;
        final var meanAnomaly = 357.52911 + 35999.05029 * t - 0.0001537 * t * t;
        final var eccentricity = 0.016708634 - 0.000042037 * t - 0.0000001267 * t * t;
        final var centre = (1.914602 - 0.004817 * t - 0.000014 * t * t) * sinDeg(meanAnomaly)
                + (0.019993 - 0.000101 * t) * sinDeg(2 * meanAnomaly)
                + 0.000289 * sinDeg(3 * meanAnomaly);
        final var trueAnomaly = meanAnomaly + centre;
        final var radius = 1.000001018 * (1 - eccentricity * eccentricity)
                / (1 + eccentricity * cosDeg(trueAnomaly));
        return new EclipticCoordinates(Angles.normalize(meanLongitude + centre), 0.0, radius);
    }

    /**
     * Annual aberration in longitude for a given radius vector, degrees.
     */
    static double aberration(final double radius) {
        return -ABERRATION_ARCSEC / 3600.0 / radius;
    }
}
