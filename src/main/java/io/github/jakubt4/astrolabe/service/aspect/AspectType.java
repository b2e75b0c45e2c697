package io.github.jakubt4.astrolabe.service.aspect;

import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;

/**
 * Angular relationships, each with its exact angle and a default maximum orb in degrees.
 *
 * <p>Minor aspects are only matched when enabled in configuration.
 */
public enum AspectType {

    CONJUNCTION(0.0, 8.0, Nature.NEUTRAL, false),
    SEMI_SEXTILE(30.0, 2.0, Nature.HARMONIOUS, false),
    SEMI_SQUARE(45.0, 2.0, Nature.TENSE, false),
    SEXTILE(60.0, 6.0, Nature.HARMONIOUS, false),
    SQUARE(90.0, 7.0, Nature.TENSE, false),
    TRINE(120.0, 8.0, Nature.HARMONIOUS, false),
    SESQUIQUADRATE(135.0, 2.0, Nature.TENSE, false),
    QUINCUNX(150.0, 3.0, Nature.TENSE, false),
    OPPOSITION(180.0, 8.0, Nature.TENSE, false),
    NOVILE(40.0, 1.0, Nature.HARMONIOUS, true),
    SEPTILE(360.0 / 7.0, 1.5, Nature.NEUTRAL, true),
    QUINTILE(72.0, 2.0, Nature.HARMONIOUS, true),
    BIQUINTILE(144.0, 2.0, Nature.HARMONIOUS, true);

    public enum Nature {
        HARMONIOUS, TENSE, NEUTRAL
    }

    private final double angle;
    private final double defaultOrb;
    private final Nature nature;
    private final boolean minor;

    AspectType(final double angle, final double defaultOrb, final Nature nature, final boolean minor) {
        this.angle = angle;
        this.defaultOrb = defaultOrb;
        this.nature = nature;
        this.minor = minor;
    }

    public double angle() {
        return angle;
    }

    public double defaultOrb() {
        return defaultOrb;
    }

    public Nature nature() {
        return nature;
    }

    public boolean isMinor() {
        return minor;
    }

    /**
     * Conjunction, sextile, square, trine and opposition.
     */
    public boolean isPtolemaic() {
        return this == CONJUNCTION || this == SEXTILE || this == SQUARE || this == TRINE || this == OPPOSITION;
    }

    public static AspectType parse(final String value) {
        for (final var type : values()) {
            if (type.name().equalsIgnoreCase(value.trim().replace('-', '_'))) {
                return type;
            }
        }
        throw new UnsupportedParameterException("aspect", value);
    }
}
