package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.ZodiacSign;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bindu tables of a chart. Sign-indexed lists run from Aries to Pisces.
 *
 * @param bhinna       per-planet bindus (0-8) in each sign
 * @param sarva        sum of the seven planet tables in each sign (0-56)
 * @param total        sum of {@code sarva}, always 337
 * @param strongHouses houses, counted from the ascendant sign, holding at least 28 bindus
 * @param weakHouses   houses holding fewer than 25 bindus
 */
public record Ashtakavarga(ZodiacSign ascendantSign, Map<Body, List<Integer>> bhinna, List<Integer> sarva,
                           int total, List<Integer> strongHouses, List<Integer> weakHouses) {

    public Ashtakavarga {
        final var copy = new LinkedHashMap<Body, List<Integer>>();
        bhinna.forEach((body, bindus) -> copy.put(body, List.copyOf(bindus)));
        bhinna = Collections.unmodifiableMap(copy);
        sarva = List.copyOf(sarva);
        strongHouses = List.copyOf(strongHouses);
        weakHouses = List.copyOf(weakHouses);
    }

    public int bindus(final Body planet, final ZodiacSign sign) {
        final var table = bhinna.get(planet);
        if (table == null) {
            throw new IllegalArgumentException("No ashtakavarga for " + planet);
        }
        return table.get(sign.ordinal());
    }

    public int sarva(final ZodiacSign sign) {
        return sarva.get(sign.ordinal());
    }

    /**
     * Sarvashtakavarga bindus of a whole-sign house (1-12).
     */
    public int houseBindus(final int house) {
        if (house < 1 || house > 12) {
            throw new IllegalArgumentException("House must be between 1 and 12, got: " + house);
        }
        return sarva(ascendantSign.plus(house - 1));
    }
}
