package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Parashari ashtakavarga: bindus each classical planet receives in every sign from the seven
 * planets and the ascendant, and their sum, the sarvashtakavarga.
 *
 * <p>Expects a sidereal chart; signs are taken from the chart's longitudes as they are.
 */
@Slf4j
@Service
public class AshtakavargaEngine {

    static final int STRONG_HOUSE = 28;
    static final int WEAK_HOUSE = 25;
    static final int FAVOURABLE_BINDUS = 4;

    public Ashtakavarga compute(final Chart chart) {
        final var ascendantSign = ZodiacSign.ofLongitude(chart.ascendant());
        final var bhinna = new LinkedHashMap<Body, List<Integer>>();
        final var sarva = new int[12];
        for (final var planet : Body.classical()) {
            final var bindus = new int[12];
            for (final var contributor : Body.classical()) {
                award(bindus, chart.position(contributor).sign(), BinduTable.fromPlanet(planet, contributor));
            }
            award(bindus, ascendantSign, BinduTable.fromAscendant(planet));
            final var row = new ArrayList<Integer>(12);
            for (var sign = 0; sign < 12; sign++) {
                row.add(bindus[sign]);
                sarva[sign] += bindus[sign];
            }
            bhinna.put(planet, row);
        }

        final var sarvaList = new ArrayList<Integer>(12);
        var total = 0;
        for (final var value : sarva) {
            sarvaList.add(value);
            total += value;
        }
        final var strong = new ArrayList<Integer>();
        final var weak = new ArrayList<Integer>();
        for (var house = 1; house <= 12; house++) {
            final var value = sarva[ascendantSign.plus(house - 1).ordinal()];
            if (value >= STRONG_HOUSE) {
                strong.add(house);
            } else if (value < WEAK_HOUSE) {
                weak.add(house);
            }
        }
        log.debug("Ashtakavarga for ascendant {}: {} bindus, strong houses {}", ascendantSign, total, strong);
        return new Ashtakavarga(ascendantSign, bhinna, sarvaList, total, strong, weak);
    }

    /**
     * A transit through {@code sign} is favourable for {@code planet} when its own table holds
     * at least four bindus there.
     */
    public boolean favourableTransit(final Ashtakavarga ashtakavarga, final Body planet, final ZodiacSign sign) {
        return ashtakavarga.bindus(planet, sign) >= FAVOURABLE_BINDUS;
    }

    private static void award(final int[] bindus, final ZodiacSign from, final int[] places) {
        for (final var place : places) {
            bindus[from.plus(place - 1).ordinal()]++;
        }
    }
}
