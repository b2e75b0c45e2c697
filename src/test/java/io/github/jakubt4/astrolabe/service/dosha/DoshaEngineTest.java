package io.github.jakubt4.astrolabe.service.dosha;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.BodyPosition;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ChartPoint;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.Nakshatra;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class DoshaEngineTest {

    private final TestContexts context = TestContexts.standard();
    private final DoshaEngine doshaEngine = context.doshaEngine;

    @Test
    void planetsHemmedBetweenRahuAndKetuFormKaalSarp() {
        final var chart = chart(0.0, Map.of(Body.SUN, 20.0, Body.MOON, 45.0, Body.MERCURY, 30.0, Body.VENUS, 60.0,
                Body.MARS, 100.0, Body.JUPITER, 140.0, Body.SATURN, 175.0), 10.0);

        final var result = doshaEngine.kaalSarp(chart);

        assertThat(result.present()).isTrue();
        assertThat(result.ascending()).isTrue();
        assertThat(result.outside()).isEmpty();
        assertThat(result.rahuHouse()).isEqualTo(1);
        assertThat(result.type()).isEqualTo(KaalSarpType.ANANT);
    }

    @Test
    void planetsOnTheReverseArcFormKaalAmrit() {
        final var chart = chart(0.0, Map.of(Body.SUN, 320.0, Body.MOON, 340.0, Body.MERCURY, 5.0, Body.VENUS, 20.0,
                Body.MARS, 50.0, Body.JUPITER, 90.0, Body.SATURN, 120.0), 130.0);

        final var result = doshaEngine.kaalSarp(chart);

        assertThat(result.present()).isTrue();
        assertThat(result.ascending()).isFalse();
        assertThat(result.rahuHouse()).isEqualTo(5);
        assertThat(result.type()).isEqualTo(KaalSarpType.PADMA);
    }

    @Test
    void singlePlanetAcrossTheAxisBreaksKaalSarp() {
        final var chart = chart(0.0, Map.of(Body.SUN, 20.0, Body.MOON, 45.0, Body.MERCURY, 30.0, Body.VENUS, 60.0,
                Body.MARS, 100.0, Body.JUPITER, 140.0, Body.SATURN, 250.0), 10.0);

        final var result = doshaEngine.kaalSarp(chart);

        assertThat(result.present()).isFalse();
        assertThat(result.partial()).isTrue();
        assertThat(result.outside()).containsExactly(Body.SATURN);
    }

    @Test
    void marsCountsHousesFromAscendantAndMoon() {
        final var chart = chart(5.0, Map.of(Body.MARS, 95.0, Body.MOON, 100.0), 10.0);

        final var result = doshaEngine.manglik(chart);

        assertThat(result.houseFromAscendant()).isEqualTo(4);
        assertThat(result.houseFromMoon()).isEqualTo(1);
        assertThat(result.fromAscendant()).isTrue();
        assertThat(result.fromMoon()).isTrue();
        assertThat(result.present()).isTrue();
        assertThat(result.cancelled()).isFalse();
    }

    @Test
    void marsInAFifthHouseIsNotManglik() {
        final var chart = chart(5.0, Map.of(Body.MARS, 125.0, Body.MOON, 10.0), 10.0);

        final var result = doshaEngine.manglik(chart);

        assertThat(result.houseFromAscendant()).isEqualTo(5);
        assertThat(result.houseFromMoon()).isEqualTo(5);
        assertThat(result.present()).isFalse();
    }

    @Test
    void marsInOwnOrExaltationSignCancelsManglik() {
        final var own = doshaEngine.manglik(chart(5.0, Map.of(Body.MARS, 215.0, Body.MOON, 10.0), 10.0));
        final var exalted = doshaEngine.manglik(chart(5.0, Map.of(Body.MARS, 275.0, Body.MOON, 10.0), 10.0));

        assertThat(own.houseFromAscendant()).isEqualTo(8);
        assertThat(own.present()).isTrue();
        assertThat(own.cancelled()).isTrue();
        assertThat(exalted.houseFromAscendant()).isEqualTo(10);
        assertThat(exalted.cancelled()).isTrue();
    }

    @Test
    void nakshatraPlacementsCoverBodiesAndAscendant() {
        final var chart = chart(0.0, Map.of(), 10.0);

        final var placements = doshaEngine.nakshatras(chart);

        assertThat(placements).hasSize(Body.values().length + 1);
        assertThat(placements).extracting(NakshatraPlacement::point)
                .contains(ChartPoint.ASCENDANT)
                .doesNotContain(ChartPoint.MIDHEAVEN);
        final var ascendant = placements.stream().filter(p -> ChartPoint.ASCENDANT.equals(p.point()))
                .findFirst().orElseThrow();
        assertThat(ascendant.nakshatra()).isEqualTo(Nakshatra.values()[0]);
        assertThat(ascendant.pada()).isEqualTo(1);
        assertThat(ascendant.lord()).isEqualTo(Body.KETU);
    }

    @Test
    void sadeSatiPhasesAreOrderedAndFollowSaturnFromTheMoon() {
        final var natal = context.chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(),
                ChartOptions.sidereal(HouseSystem.WHOLE_SIGN, Ayanamsa.LAHIRI));
        final var asOf = JulianDay.atMidnight(LocalDate.of(2000, 1, 1));

        final var report = doshaEngine.sadeSati(natal, asOf);

        assertThat(report.moonSign()).isEqualTo(natal.position(Body.MOON).sign());
        assertThat(report.phases()).isNotEmpty();
        for (var i = 0; i < report.phases().size(); i++) {
            final var phase = report.phases().get(i);
            assertThat(phase.endJd()).isGreaterThan(phase.startJd());
            final var distance = ZodiacSign.houseDistance(report.moonSign(), phase.sign());
            final var expected = switch (phase.phase()) {
                case RISING -> 12;
                case PEAK -> 1;
                case SETTING -> 2;
            };
            assertThat(distance).isEqualTo(expected);
            if (i > 0) {
                assertThat(phase.startJd()).isGreaterThanOrEqualTo(report.phases().get(i - 1).endJd());
            }
        }
        assertThat(report.phases()).extracting(SadeSatiPhase::phase)
                .contains(SadeSatiPhase.Phase.RISING, SadeSatiPhase.Phase.PEAK, SadeSatiPhase.Phase.SETTING);
        assertThat(report.active()).isEqualTo(report.current() != null);
        assertThat(report.active()).isEqualTo(report.phases().stream().anyMatch(p -> p.contains(asOf)));
    }

    @Test
    void sadeSatiWindowIsClampedToTheEphemerisRange() {
        final var natal = context.chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(),
                ChartOptions.sidereal(HouseSystem.WHOLE_SIGN, Ayanamsa.LAHIRI));
        final var min = context.gateway.minJulianDay();

        final var report = doshaEngine.sadeSati(natal, min + 100, min - 500, min + 40 * JulianDay.DAYS_PER_YEAR);

        assertThat(report.phases()).allSatisfy(p -> assertThat(p.startJd()).isGreaterThanOrEqualTo(min));
    }

    private static Chart chart(final double ascendant, final Map<Body, Double> longitudes, final double rahu) {
        final var positions = new ArrayList<BodyPosition>();
        final var all = new EnumMap<Body, Double>(Body.class);
        for (final var body : Body.values()) {
            all.put(body, 0.0);
        }
        all.putAll(longitudes);
        all.put(Body.RAHU, rahu);
        all.put(Body.KETU, Angles.normalize(rahu + 180.0));
        all.forEach((body, lon) -> positions.add(BodyPosition.of(body, lon, 0.0, 1.0, 1.0)));
        final var cusps = IntStream.range(0, 12).mapToObj(i -> Angles.normalize(ascendant + 30.0 * i)).toList();
        return new Chart(null, JulianDay.J2000, TestContexts.LONDON, HouseSystem.EQUAL, ZodiacType.SIDEREAL,
                Ayanamsa.LAHIRI, Ayanamsa.LAHIRI.valueAt(JulianDay.J2000), positions, cusps, ascendant,
                Angles.normalize(ascendant + 270.0));
    }
}
