package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.BodyPosition;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AshtakavargaEngineTest {

    private final TestContexts context = TestContexts.standard();
    private final AshtakavargaEngine engine = context.ashtakavargaEngine;

    @Test
    void planetTotalsAreFixedWhateverTheChart() {
        final var chart = context.chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(),
                ChartOptions.sidereal(HouseSystem.WHOLE_SIGN, Ayanamsa.LAHIRI));

        final var result = engine.compute(chart);

        assertThat(result.bhinna().keySet()).containsExactlyInAnyOrderElementsOf(Body.classical());
        final var expected = Map.of(Body.SUN, 48, Body.MOON, 49, Body.MARS, 39, Body.MERCURY, 54,
                Body.JUPITER, 56, Body.VENUS, 52, Body.SATURN, 39);
        expected.forEach((planet, total) -> assertThat(sum(result.bhinna().get(planet))).as("%s", planet)
                .isEqualTo(total));
        assertThat(result.total()).isEqualTo(337);
        assertThat(sum(result.sarva())).isEqualTo(337);
        result.bhinna().values().forEach(row -> assertThat(row).hasSize(12).allSatisfy(
                bindus -> assertThat(bindus).isBetween(0, 8)));
    }

    @Test
    void everyContributorInAriesGivesTheSunItsBeneficPlacesFromAries() {
        final var result = engine.compute(chart(5.0, 0.0));

        final var sun = IntStream.range(0, 12)
                .mapToObj(i -> result.bindus(Body.SUN, ZodiacSign.of(i)))
                .toList();
        assertThat(sun).containsExactly(3, 3, 3, 4, 2, 5, 4, 3, 5, 6, 7, 3);
    }

    @Test
    void tablesRotateWithTheContributors() {
        final var aries = engine.compute(chart(5.0, 0.0));
        final var leo = engine.compute(chart(125.0, 120.0));

        for (var i = 0; i < 12; i++) {
            for (final var planet : Body.classical()) {
                assertThat(leo.bindus(planet, ZodiacSign.LEO.plus(i)))
                        .isEqualTo(aries.bindus(planet, ZodiacSign.ARIES.plus(i)));
            }
            assertThat(leo.houseBindus(i + 1)).isEqualTo(aries.houseBindus(i + 1));
        }
        assertThat(leo.ascendantSign()).isEqualTo(ZodiacSign.LEO);
    }

    @Test
    void strongAndWeakHousesFollowTheSarvaThresholds() {
        final var result = engine.compute(chart(5.0, 0.0));

        for (var house = 1; house <= 12; house++) {
            final var bindus = result.houseBindus(house);
            assertThat(result.strongHouses().contains(house)).as("house %d", house)
                    .isEqualTo(bindus >= AshtakavargaEngine.STRONG_HOUSE);
            assertThat(result.weakHouses().contains(house)).as("house %d", house)
                    .isEqualTo(bindus < AshtakavargaEngine.WEAK_HOUSE);
        }
        assertThatThrownBy(() -> result.houseBindus(13)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void favourableTransitNeedsFourBindus() {
        final var result = engine.compute(chart(5.0, 0.0));

        assertThat(engine.favourableTransit(result, Body.SUN, ZodiacSign.AQUARIUS)).isTrue();
        assertThat(engine.favourableTransit(result, Body.SUN, ZodiacSign.LEO)).isFalse();
        assertThatThrownBy(() -> result.bindus(Body.RAHU, ZodiacSign.ARIES))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resultCannotBeModified() {
        final var result = engine.compute(chart(5.0, 0.0));

        assertThatThrownBy(() -> result.bhinna().remove(Body.SUN)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.sarva().set(0, 99)).isInstanceOf(UnsupportedOperationException.class);
    }

    private static int sum(final List<Integer> values) {
        return values.stream().mapToInt(Integer::intValue).sum();
    }

    private static Chart chart(final double ascendant, final double everyBody) {
        final var positions = new ArrayList<BodyPosition>();
        for (final var body : Body.values()) {
            positions.add(BodyPosition.of(body, everyBody, 0.0, 1.0, 1.0));
        }
        final var cusps = IntStream.range(0, 12).mapToObj(i -> Angles.normalize(ascendant + 30.0 * i)).toList();
        return new Chart(null, JulianDay.J2000, TestContexts.LONDON, HouseSystem.EQUAL, ZodiacType.SIDEREAL,
                Ayanamsa.LAHIRI, Ayanamsa.LAHIRI.valueAt(JulianDay.J2000), positions, cusps, ascendant,
                Angles.normalize(ascendant + 270.0));
    }
}
