package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.util.Angles;
import org.hipparchus.util.FastMath;

/**
 * The 27 lunar mansions of 13°20' each, measured on the sidereal zodiac.
 *
 * <p>Lords repeat the Vimshottari sequence Ketu, Venus, Sun, Moon, Mars, Rahu, Jupiter,
 * Saturn, Mercury starting from Ashwini.
 */
public enum Nakshatra {

    ASHWINI, BHARANI, KRITTIKA, ROHINI, MRIGASHIRA, ARDRA, PUNARVASU, PUSHYA, ASHLESHA,
    MAGHA, PURVA_PHALGUNI, UTTARA_PHALGUNI, HASTA, CHITRA, SWATI, VISHAKHA, ANURADHA, JYESHTHA,
    MULA, PURVA_ASHADHA, UTTARA_ASHADHA, SHRAVANA, DHANISHTA, SHATABHISHA, PURVA_BHADRAPADA,
    UTTARA_BHADRAPADA, REVATI;

    public static final double SPAN = 360.0 / 27.0;
    public static final double PADA_SPAN = SPAN / 4.0;

    private static final Nakshatra[] VALUES = values();
    private static final Body[] LORDS = {
            Body.KETU, Body.VENUS, Body.SUN, Body.MOON, Body.MARS,
            Body.RAHU, Body.JUPITER, Body.SATURN, Body.MERCURY
    };

    public Body lord() {
        return LORDS[ordinal() % LORDS.length];
    }

    public double startLongitude() {
        return ordinal() * SPAN;
    }

    public static Nakshatra ofLongitude(final double siderealLongitude) {
        final var index = (int) FastMath.floor(Angles.normalize(siderealLongitude) / SPAN);
        return VALUES[FastMath.min(index, VALUES.length - 1)];
    }

    /**
     * Share of the mansion already traversed, in {@code [0, 1)}.
     */
    public static double elapsedFraction(final double siderealLongitude) {
        final var normalized = Angles.normalize(siderealLongitude);
        final var fraction = (normalized - ofLongitude(normalized).startLongitude()) / SPAN;
        return FastMath.min(FastMath.max(fraction, 0.0), FastMath.nextDown(1.0));
    }

    /**
     * Quarter (1-4) of the mansion.
     */
    public static int pada(final double siderealLongitude) {
        return (int) FastMath.floor(elapsedFraction(siderealLongitude) * 4.0) + 1;
    }
}
