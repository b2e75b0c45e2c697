package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.model.Body;

/**
 * Six sub-scores, each in [0, 1], their sum and the derived strength points (sum × 100).
 */
public record StrengthScore(Body body, Dignity dignity, double positional, double directional, double temporal,
                            double motional, double natural, double aspectual, double total, double points,
                            StrengthBand band) {

    public static StrengthScore of(final Body body, final Dignity dignity, final double positional,
                                   final double directional, final double temporal, final double motional,
                                   final double natural, final double aspectual) {
        final var total = positional + directional + temporal + motional + natural + aspectual;
        final var points = total * 100.0;
        return new StrengthScore(body, dignity, positional, directional, temporal, motional, natural, aspectual,
                total, points, StrengthBand.of(points));
    }
}
