package io.github.jakubt4.astrolabe.util;

import org.hipparchus.util.FastMath;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Conversions between {@link Instant} and Julian Day numbers on the UT scale.
 */
public final class JulianDay {

    public static final double J2000 = 2451545.0;
    public static final double DAYS_PER_CENTURY = 36525.0;
    public static final double DAYS_PER_YEAR = 365.25;

    private static final double UNIX_EPOCH = 2440587.5;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private JulianDay() {
    }

    public static double fromInstant(final Instant instant) {
        return UNIX_EPOCH + instant.toEpochMilli() / MILLIS_PER_DAY;
    }

    /**
     * Inverse of {@link #fromInstant}, rounded to the millisecond.
     */
    public static Instant toInstant(final double julianDay) {
        return Instant.ofEpochMilli(FastMath.round((julianDay - UNIX_EPOCH) * MILLIS_PER_DAY));
    }

    /**
     * Julian Day of 00:00 UT on the given civil date.
     */
    public static double atMidnight(final LocalDate date) {
        return fromInstant(date.atStartOfDay().toInstant(ZoneOffset.UTC));
    }

    /**
     * Julian centuries since J2000.0.
     */
    public static double centuries(final double julianDay) {
        return (julianDay - J2000) / DAYS_PER_CENTURY;
    }

    /**
     * Decimal Gregorian year, good enough for year-indexed polynomials and bounds checks.
     */
    public static double decimalYear(final double julianDay) {
        final var date = toInstant(julianDay).atOffset(ZoneOffset.UTC);
        final var start = atMidnight(LocalDate.of(date.getYear(), 1, 1));
        final var end = atMidnight(LocalDate.of(date.getYear() + 1, 1, 1));
        return date.getYear() + (julianDay - start) / (end - start);
    }
}
