package io.github.jakubt4.astrolabe.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Celestial bodies and calculated points that appear in a chart.
 *
 * <p>{@code meanDailyMotion} is the typical geocentric speed in degrees per day (negative
 * for the retrograde-moving lunar nodes), {@code returnPeriodDays} the mean interval
 * between two geocentric passages over the same longitude, and {@code naturalStrength}
 * the classical naisargika value in virupas (zero for bodies outside the seven planets).
 */
public enum Body {

    SUN("Sun", 0.985647, 365.2564, 60.0, Nature.MALEFIC),
    MOON("Moon", 13.176358, 27.3217, 51.43, Nature.VARIABLE),
    MERCURY("Mercury", 1.383, 365.2564, 25.71, Nature.VARIABLE),
    VENUS("Venus", 1.2, 365.2564, 42.86, Nature.BENEFIC),
    MARS("Mars", 0.524, 686.98, 17.14, Nature.MALEFIC),
    JUPITER("Jupiter", 0.083, 4332.59, 34.29, Nature.BENEFIC),
    SATURN("Saturn", 0.0335, 10759.22, 8.57, Nature.MALEFIC),
    URANUS("Uranus", 0.0117, 30688.5, 0.0, Nature.MALEFIC),
    NEPTUNE("Neptune", 0.006, 60182.0, 0.0, Nature.MALEFIC),
    PLUTO("Pluto", 0.004, 90560.0, 0.0, Nature.MALEFIC),
    RAHU("Rahu", -0.052954, 6793.48, 0.0, Nature.MALEFIC),
    KETU("Ketu", -0.052954, 6793.48, 0.0, Nature.MALEFIC);

    public enum Nature {
        BENEFIC, MALEFIC, VARIABLE
    }

    private static final Set<Body> CLASSICAL = EnumSet.of(SUN, MOON, MERCURY, VENUS, MARS, JUPITER, SATURN);
    private static final Set<Body> NODES = EnumSet.of(RAHU, KETU);

    private final String displayName;
    private final double meanDailyMotion;
    private final double returnPeriodDays;
    private final double naturalStrength;
    private final Nature nature;

    Body(final String displayName, final double meanDailyMotion, final double returnPeriodDays,
         final double naturalStrength, final Nature nature) {
        this.displayName = displayName;
        this.meanDailyMotion = meanDailyMotion;
        this.returnPeriodDays = returnPeriodDays;
        this.naturalStrength = naturalStrength;
        this.nature = nature;
    }

    public String displayName() {
        return displayName;
    }

    public double meanDailyMotion() {
        return meanDailyMotion;
    }

    public double returnPeriodDays() {
        return returnPeriodDays;
    }

    public double naturalStrength() {
        return naturalStrength;
    }

    public Nature nature() {
        return nature;
    }

    /**
     * The seven planets used by sign-based techniques (dignity, strength, doshas).
     */
    public boolean isClassical() {
        return CLASSICAL.contains(this);
    }

    public boolean isNode() {
        return NODES.contains(this);
    }

    public static Set<Body> classical() {
        return EnumSet.copyOf(CLASSICAL);
    }

    /**
     * Looks a body up by enum name or display name, ignoring case.
     *
     * @throws IllegalArgumentException if nothing matches
     */
    public static Body parse(final String value) {
        for (final var body : values()) {
            if (body.name().equalsIgnoreCase(value) || body.displayName.equalsIgnoreCase(value)) {
                return body;
            }
        }
        throw new IllegalArgumentException("Unknown body: " + value);
    }
}
