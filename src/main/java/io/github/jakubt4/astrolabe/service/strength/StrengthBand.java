package io.github.jakubt4.astrolabe.service.strength;

public enum StrengthBand {

    VERY_STRONG(480), STRONG(390), AVERAGE(300), WEAK(210), VERY_WEAK(Double.NEGATIVE_INFINITY);

    private final double threshold;

    StrengthBand(final double threshold) {
        this.threshold = threshold;
    }

    public static StrengthBand of(final double points) {
        for (final var band : values()) {
            if (points >= band.threshold) {
                return band;
            }
        }
        return VERY_WEAK;
    }
}
