package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.service.aspect.Aspect;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.util.Angles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CompatibilityEngineTest {

    private final TestContexts context = TestContexts.standard();
    private final CompatibilityEngine compatibilityEngine = context.compatibilityEngine;

    private Chart first;
    private Chart second;

    @BeforeEach
    void setUp() {
        final var options = ChartOptions.tropical(HouseSystem.PLACIDUS);
        first = context.chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(), options);
        second = context.chartBuilder.build(TestContexts.PARTNER, TestContexts.PARTNER.julianDayUt(), options);
    }

    @Test
    void chartComparedWithItselfScoresFullHarmony() {
        final var report = compatibilityEngine.compare(first, first);

        assertThat(report.score()).isCloseTo(100.0, within(1e-9));
        assertThat(report.factors()).allSatisfy((factor, value) -> assertThat(value).isCloseTo(1.0, within(1e-9)));
        assertThat(report.matrix().cell("SUN", "SUN")).get()
                .extracting(Aspect::type)
                .isEqualTo(AspectType.CONJUNCTION);
    }

    @Test
    void compositeAndDavisonOfIdenticalChartsReproduceTheChart() {
        final var composite = compatibilityEngine.composite(first, first);
        final var davison = compatibilityEngine.davison(first, first);

        for (final var position : composite.positions()) {
            assertThat(position.longitude()).isCloseTo(first.position(position.body()).longitude(), within(1e-9));
            assertThat(davison.position(position.body()).longitude())
                    .isCloseTo(first.position(position.body()).longitude(), within(1e-9));
        }
        assertThat(composite.ascendant()).isCloseTo(first.ascendant(), within(1e-9));
        assertThat(davison.julianDay()).isEqualTo(first.julianDay());
        assertThat(davison.location().latitude()).isCloseTo(first.location().latitude(), within(1e-9));
        assertThat(davison.location().longitude()).isCloseTo(first.location().longitude(), within(1e-9));
    }

    @Test
    void swappingTheChartsTransposesTheMatrixAndKeepsTheScore() {
        final var forward = compatibilityEngine.compare(first, second);
        final var backward = compatibilityEngine.compare(second, first);

        assertThat(backward.score()).isEqualTo(forward.score());
        assertThat(backward.tension()).isEqualTo(forward.tension());
        assertThat(backward.factors()).isEqualTo(forward.factors());
        final var transposed = forward.matrix().transpose();
        assertThat(transposed.rows()).isEqualTo(backward.matrix().rows());
        assertThat(transposed.columns()).isEqualTo(backward.matrix().columns());
        assertThat(transposed.aspects()).hasSameSizeAs(backward.matrix().aspects());
        for (final var aspect : transposed.aspects()) {
            final var mirrored = backward.matrix().cell(aspect.first(), aspect.second());
            assertThat(mirrored).isPresent();
            assertThat(mirrored.get().type()).isEqualTo(aspect.type());
            assertThat(mirrored.get().orb()).isEqualTo(aspect.orb());
        }
    }

    @Test
    void compositeUsesShorterArcMidpoints() {
        final var composite = compatibilityEngine.composite(first, second);

        assertThat(composite.positions()).hasSize(Body.values().length);
        assertThat(composite.cusps()).hasSize(12);
        for (final var position : composite.positions()) {
            final var a = first.position(position.body()).longitude();
            final var b = second.position(position.body()).longitude();
            assertThat(Angles.separation(position.longitude(), a))
                    .isCloseTo(Angles.separation(a, b) / 2, within(1e-9));
            assertThat(Angles.separation(position.longitude(), b))
                    .isCloseTo(Angles.separation(a, b) / 2, within(1e-9));
        }
    }

    @Test
    void davisonChartIsCastForTheMidpointInTime() {
        final var davison = compatibilityEngine.davison(first, second);

        assertThat(davison.julianDay()).isCloseTo((first.julianDay() + second.julianDay()) / 2, within(1e-9));
        assertThat(davison.houseSystem()).isEqualTo(HouseSystem.PLACIDUS);
        assertThat(davison.location().latitude()).isBetween(TestContexts.NEW_DELHI.latitude(),
                TestContexts.LONDON.latitude() + 10);
    }

    @Test
    void sphericalMidpointFollowsTheGreatCircle() {
        final var midpoint = CompatibilityEngine.sphericalMidpoint(GeoLocation.of(0.0, 0.0), GeoLocation.of(0.0, 90.0));
        final var acrossDateLine = CompatibilityEngine.sphericalMidpoint(GeoLocation.of(10.0, 170.0),
                GeoLocation.of(10.0, -170.0));

        assertThat(midpoint.latitude()).isCloseTo(0.0, within(1e-9));
        assertThat(midpoint.longitude()).isCloseTo(45.0, within(1e-9));
        assertThat(Math.abs(acrossDateLine.longitude())).isCloseTo(180.0, within(1e-9));
        assertThat(acrossDateLine.latitude()).isGreaterThan(10.0);
    }

    @Test
    void scoreAndTensionStayInRange() {
        final var report = compatibilityEngine.compare(first, second);

        assertThat(report.score()).isBetween(0.0, 100.0);
        assertThat(report.tension()).isBetween(0.0, 100.0);
        assertThat(report.factors()).containsOnlyKeys(HarmonyFactor.values());
        assertThat(report.matrix().rows()).hasSize(first.points().size());
    }

    @Test
    void harmonyWeightsFavourConjunctionAndTrine() {
        assertThat(CompatibilityEngine.harmonyWeight(AspectType.TRINE)).isEqualTo(1.0);
        assertThat(CompatibilityEngine.harmonyWeight(AspectType.SEXTILE)).isEqualTo(0.8);
        assertThat(CompatibilityEngine.harmonyWeight(AspectType.SEMI_SEXTILE)).isEqualTo(0.3);
    }
}
