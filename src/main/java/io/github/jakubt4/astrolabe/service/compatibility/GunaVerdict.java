package io.github.jakubt4.astrolabe.service.compatibility;

public enum GunaVerdict {

    EXCELLENT(32), GOOD(25), AVERAGE(18), NOT_RECOMMENDED(Double.NEGATIVE_INFINITY);

    private final double threshold;

    GunaVerdict(final double threshold) {
        this.threshold = threshold;
    }

    public static GunaVerdict of(final double points) {
        for (final var verdict : values()) {
            if (points >= verdict.threshold) {
                return verdict;
            }
        }
        return NOT_RECOMMENDED;
    }
}
