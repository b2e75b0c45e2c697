package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;

/**
 * Ways of moving a natal chart forward in time.
 *
 * <p>{@code degreesPerYear} applies to the uniform-arc techniques only.
 */
public enum ProgressionTechnique {

    SECONDARY(Double.NaN),
    DAY_FOR_A_YEAR(1.0),
    NAIBOD(0.98564733),
    SOLAR_ARC(Double.NaN);

    private final double degreesPerYear;

    ProgressionTechnique(final double degreesPerYear) {
        this.degreesPerYear = degreesPerYear;
    }

    public double degreesPerYear() {
        return degreesPerYear;
    }

    public static ProgressionTechnique parse(final String value) {
        for (final var technique : values()) {
            if (technique.name().equalsIgnoreCase(value.trim().replace('-', '_'))) {
                return technique;
            }
        }
        throw new UnsupportedParameterException("progression technique", value);
    }
}
