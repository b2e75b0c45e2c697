package io.github.jakubt4.astrolabe.service.strength;

import org.hipparchus.util.FastMath;

/**
 * Speed of a planet relative to its mean motion, with the motional strength each class earns.
 */
public enum MotionClass {

    RETROGRADE(1.0),
    STATIONARY(0.75),
    SLOW(0.5),
    AVERAGE(0.25),
    FAST(0.5);

    private final double score;

    MotionClass(final double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }

    public static MotionClass of(final double dailyMotion, final double meanDailyMotion) {
        final var ratio = FastMath.abs(dailyMotion) / FastMath.abs(meanDailyMotion);
        if (ratio < 0.1) {
            return STATIONARY;
        }
        if (dailyMotion < 0) {
            return RETROGRADE;
        }
        if (ratio < 0.7) {
            return SLOW;
        }
        return ratio <= 1.3 ? AVERAGE : FAST;
    }
}
