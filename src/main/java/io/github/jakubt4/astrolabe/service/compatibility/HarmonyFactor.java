package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.model.Body;

import java.util.List;

import static io.github.jakubt4.astrolabe.model.Body.JUPITER;
import static io.github.jakubt4.astrolabe.model.Body.MARS;
import static io.github.jakubt4.astrolabe.model.Body.MOON;
import static io.github.jakubt4.astrolabe.model.Body.SATURN;
import static io.github.jakubt4.astrolabe.model.Body.SUN;
import static io.github.jakubt4.astrolabe.model.Body.VENUS;

/**
 * Groups of cross-chart body pairs that make up the compatibility score, with their weights.
 * Each pair list is closed under swapping, so the score does not depend on which chart is first.
 */
public enum HarmonyFactor {

    LUMINARY(0.40, List.of(
            pair(SUN, SUN), pair(MOON, MOON), pair(SUN, MOON), pair(MOON, SUN))),
    AFFECTION(0.35, List.of(
            pair(VENUS, VENUS), pair(MARS, MARS), pair(VENUS, MARS), pair(MARS, VENUS))),
    STRUCTURAL(0.25, List.of(
            pair(SATURN, SATURN), pair(JUPITER, JUPITER), pair(SATURN, SUN), pair(SUN, SATURN),
            pair(SATURN, MOON), pair(MOON, SATURN)));

    public record Pair(Body row, Body column) {
    }

    private final double weight;
    private final List<Pair> pairs;

    HarmonyFactor(final double weight, final List<Pair> pairs) {
        this.weight = weight;
        this.pairs = pairs;
    }

    public double weight() {
        return weight;
    }

    public List<Pair> pairs() {
        return pairs;
    }

    private static Pair pair(final Body row, final Body column) {
        return new Pair(row, column);
    }
}
