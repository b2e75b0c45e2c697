package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.model.Body;

import java.util.EnumMap;
import java.util.Map;

import static io.github.jakubt4.astrolabe.model.Body.JUPITER;
import static io.github.jakubt4.astrolabe.model.Body.MARS;
import static io.github.jakubt4.astrolabe.model.Body.MERCURY;
import static io.github.jakubt4.astrolabe.model.Body.MOON;
import static io.github.jakubt4.astrolabe.model.Body.SATURN;
import static io.github.jakubt4.astrolabe.model.Body.SUN;
import static io.github.jakubt4.astrolabe.model.Body.VENUS;

/**
 * Benefic places of the Parashari ashtakavarga: for each classical planet, the houses counted
 * from each of the eight contributors (seven planets and the ascendant) that earn it a bindu.
 *
 * <p>Per-planet totals are fixed (Sun 48, Moon 49, Mars 39, Mercury 54, Jupiter 56, Venus 52,
 * Saturn 39), so every sarvashtakavarga sums to 337.
 */
final class BinduTable {

    static final int SARVA_TOTAL = 337;

    private static final Map<Body, Map<Body, int[]>> FROM_PLANETS = new EnumMap<>(Body.class);
    private static final Map<Body, int[]> FROM_ASCENDANT = new EnumMap<>(Body.class);

    static {
        planet(SUN,
                new int[]{1, 2, 4, 7, 8, 9, 10, 11},
                new int[]{3, 6, 10, 11},
                new int[]{1, 2, 4, 7, 8, 9, 10, 11},
                new int[]{3, 5, 6, 9, 10, 11, 12},
                new int[]{5, 6, 9, 11},
                new int[]{6, 7, 12},
                new int[]{1, 2, 4, 7, 8, 9, 10, 11},
                new int[]{3, 4, 6, 10, 11, 12});
        planet(MOON,
                new int[]{3, 6, 7, 8, 10, 11},
                new int[]{1, 3, 6, 7, 10, 11},
                new int[]{2, 3, 5, 6, 9, 10, 11},
                new int[]{1, 3, 4, 5, 7, 8, 10, 11},
                new int[]{1, 4, 7, 8, 10, 11, 12},
                new int[]{3, 4, 5, 7, 9, 10, 11},
                new int[]{3, 5, 6, 11},
                new int[]{3, 6, 10, 11});
        planet(MARS,
                new int[]{3, 5, 6, 10, 11},
                new int[]{3, 6, 11},
                new int[]{1, 2, 4, 7, 8, 10, 11},
                new int[]{3, 5, 6, 11},
                new int[]{6, 10, 11, 12},
                new int[]{6, 8, 11, 12},
                new int[]{1, 4, 7, 8, 9, 10, 11},
                new int[]{1, 3, 6, 10, 11});
        planet(MERCURY,
                new int[]{5, 6, 9, 11, 12},
                new int[]{2, 4, 6, 8, 10, 11},
                new int[]{1, 2, 4, 7, 8, 9, 10, 11},
                new int[]{1, 3, 5, 6, 9, 10, 11, 12},
                new int[]{6, 8, 11, 12},
                new int[]{1, 2, 3, 4, 5, 8, 9, 11},
                new int[]{1, 2, 4, 7, 8, 9, 10, 11},
                new int[]{1, 2, 4, 6, 8, 10, 11});
        planet(JUPITER,
                new int[]{1, 2, 3, 4, 7, 8, 9, 10, 11},
                new int[]{2, 5, 7, 9, 11},
                new int[]{1, 2, 4, 7, 8, 10, 11},
                new int[]{1, 2, 4, 5, 6, 9, 10, 11},
                new int[]{1, 2, 3, 4, 7, 8, 10, 11},
                new int[]{2, 5, 6, 9, 10, 11},
                new int[]{3, 5, 6, 12},
                new int[]{1, 2, 4, 5, 6, 7, 9, 10, 11});
        planet(VENUS,
                new int[]{8, 11, 12},
                new int[]{1, 2, 3, 4, 5, 8, 9, 11, 12},
                new int[]{3, 5, 6, 9, 11, 12},
                new int[]{3, 5, 6, 9, 11},
                new int[]{5, 8, 9, 10, 11},
                new int[]{1, 2, 3, 4, 5, 8, 9, 10, 11},
                new int[]{3, 4, 5, 8, 9, 10, 11},
                new int[]{1, 2, 3, 4, 5, 8, 9, 11});
        planet(SATURN,
                new int[]{1, 2, 4, 7, 8, 10, 11},
                new int[]{3, 6, 11},
                new int[]{3, 5, 6, 10, 11, 12},
                new int[]{6, 8, 9, 10, 11, 12},
                new int[]{5, 6, 11, 12},
                new int[]{6, 11, 12},
                new int[]{3, 5, 6, 11},
                new int[]{1, 3, 4, 6, 10, 11});
    }

    private BinduTable() {
    }

    /**
     * Houses (1-12) counted from {@code contributor} that give {@code planet} a bindu.
     */
    static int[] fromPlanet(final Body planet, final Body contributor) {
        return FROM_PLANETS.get(planet).get(contributor);
    }

    static int[] fromAscendant(final Body planet) {
        return FROM_ASCENDANT.get(planet);
    }

    // contributors in order Sun, Moon, Mars, Mercury, Jupiter, Venus, Saturn, then the ascendant
    private static void planet(final Body planet, final int[]... places) {
        final var contributors = new Body[]{SUN, MOON, MARS, MERCURY, JUPITER, VENUS, SATURN};
        final var byContributor = new EnumMap<Body, int[]>(Body.class);
        for (var i = 0; i < contributors.length; i++) {
            byContributor.put(contributors[i], places[i]);
        }
        FROM_PLANETS.put(planet, byContributor);
        FROM_ASCENDANT.put(planet, places[contributors.length]);
    }
}
