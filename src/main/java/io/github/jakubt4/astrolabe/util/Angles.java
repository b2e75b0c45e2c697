package io.github.jakubt4.astrolabe.util;

import org.hipparchus.util.FastMath;

/**
 * Degree-based angle helpers shared by every engine.
 *
 * <p>All results are produced with {@link FastMath} so that repeated evaluations of the
 * same inputs return bit-identical values on every JVM.
 */
public final class Angles {

    public static final double FULL_CIRCLE = 360.0;
    public static final double SIGN_SPAN = 30.0;

    private Angles() {
    }

    /**
     * Normalizes an angle into {@code [0, 360)}.
     */
    public static double normalize(final double degrees) {
        var result = degrees - FULL_CIRCLE * FastMath.floor(degrees / FULL_CIRCLE);
        // floor rounding can leave exactly 360 for tiny negative inputs
        if (result >= FULL_CIRCLE) {
            result -= FULL_CIRCLE;
        }
        return result;
    }

    /**
     * Signed difference {@code to - from} folded into {@code [-180, 180)}.
     */
    public static double signedDelta(final double from, final double to) {
        final var delta = normalize(to - from);
        return delta >= 180.0 ? delta - FULL_CIRCLE : delta;
    }

    /**
     * Minimal angular separation in {@code [0, 180]}, symmetric to the last bit.
     */
    public static double separation(final double a, final double b) {
        final var first = FastMath.min(normalize(a), normalize(b));
        final var second = FastMath.max(normalize(a), normalize(b));
        final var arc = second - first;
        return arc > 180.0 ? FULL_CIRCLE - arc : arc;
    }

    /**
     * Midpoint on the shorter arc between two longitudes.
     *
     * <p>The operands are put in a canonical order first, so {@code midpoint(a, b)} and
     * {@code midpoint(b, a)} are bit-identical. When the longitudes are exactly opposite
     * the smaller of the two candidate midpoints is returned.
     */
    public static double midpoint(final double a, final double b) {
        final var first = FastMath.min(normalize(a), normalize(b));
        final var second = FastMath.max(normalize(a), normalize(b));
        final var arc = second - first;
        if (arc < 180.0) {
            return normalize(first + arc / 2.0);
        }
        if (arc > 180.0) {
            return normalize(second + (FULL_CIRCLE - arc) / 2.0);
        }
        return FastMath.min(normalize(first + 90.0), normalize(second + 90.0));
    }

    /**
     * Zero-based sign index (0 = Aries) of a longitude.
     */
    public static int signIndex(final double longitude) {
        return (int) FastMath.floor(normalize(longitude) / SIGN_SPAN) % 12;
    }

    /**
     * Degrees travelled inside the current sign, in {@code [0, 30)}.
     */
    public static double degreeInSign(final double longitude) {
        final var normalized = normalize(longitude);
        return normalized - SIGN_SPAN * signIndex(normalized);
    }

    public static double sinDeg(final double degrees) {
        return FastMath.sin(FastMath.toRadians(degrees));
    }

    public static double cosDeg(final double degrees) {
        return FastMath.cos(FastMath.toRadians(degrees));
    }

    public static double tanDeg(final double degrees) {
        return FastMath.tan(FastMath.toRadians(degrees));
    }

    public static double atan2Deg(final double y, final double x) {
        return FastMath.toDegrees(FastMath.atan2(y, x));
    }

    public static double asinDeg(final double value) {
        return FastMath.toDegrees(FastMath.asin(value));
    }
}
