package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.error.EphemerisUnavailableException;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.error.NoConvergenceException;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.service.ephemeris.EclipticCoordinates;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisSource;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PredictiveTimingEngineTest {

    private final TestContexts context = TestContexts.standard();
    private final PredictiveTimingEngine engine = context.predictiveTimingEngine;

    private Chart natal;

    @BeforeEach
    void setUp() {
        natal = context.chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(),
                ChartOptions.tropical(HouseSystem.PLACIDUS));
    }

    @Test
    void progressionBeforeBirthIsRejected() {
        assertThatThrownBy(() -> engine.progress(natal, natal.julianDay() - 1, ProgressionTechnique.SECONDARY))
                .isInstanceOf(InputValidationException.class);
    }

    @Test
    void naibodDirectionMovesEveryPointByTheSameArc() {
        final var target = natal.julianDay() + 30 * JulianDay.DAYS_PER_YEAR;

        final var directed = engine.progress(natal, target, ProgressionTechnique.NAIBOD);

        assertThat(directed.ageYears()).isCloseTo(30.0, within(1e-9));
        assertThat(directed.arc()).isCloseTo(30 * 0.98564733, within(1e-6));
        for (final var body : Body.values()) {
            assertThat(Angles.signedDelta(natal.position(body).longitude(),
                    directed.chart().position(body).longitude())).isCloseTo(directed.arc(), within(1e-9));
        }
        assertThat(Angles.signedDelta(natal.midheaven(), directed.chart().midheaven()))
                .isCloseTo(directed.arc(), within(1e-9));
        assertThat(directed.aspectsToNatal()).allSatisfy(aspect -> {
            assertThat(aspect.orb()).isLessThanOrEqualTo(1.0);
            assertThat(aspect.type().isPtolemaic()).isTrue();
        });
    }

    @Test
    void secondaryProgressionUsesOneDayPerYear() {
        final var target = natal.julianDay() + 30 * JulianDay.DAYS_PER_YEAR;

        final var secondary = engine.progress(natal, target, ProgressionTechnique.SECONDARY);
        final var solarArc = engine.progress(natal, target, ProgressionTechnique.SOLAR_ARC);

        assertThat(secondary.chart().julianDay()).isCloseTo(natal.julianDay() + 30, within(1e-9));
        assertThat(secondary.arc()).isBetween(27.5, 29.5);
        assertThat(solarArc.arc()).isCloseTo(secondary.arc(), within(1e-6));
        assertThat(Angles.signedDelta(natal.position(Body.MOON).longitude(),
                solarArc.chart().position(Body.MOON).longitude())).isCloseTo(solarArc.arc(), within(1e-9));
    }

    @Test
    void solarReturnLandsNearTheBirthdayOnTheNatalLongitude() {
        final var solarReturn = engine.returnChart(natal, Body.SUN, 2000);

        final var birthday = JulianDay.atMidnight(LocalDate.of(2000, 6, 15));
        assertThat(solarReturn.julianDay()).isBetween(birthday - 1.5, birthday + 1.5);
        assertThat(solarReturn.residual()).isLessThan(1e-3);
        assertThat(solarReturn.natalLongitude()).isEqualTo(natal.position(Body.SUN).longitude());
        assertThat(solarReturn.chart().position(Body.SUN).longitude())
                .isCloseTo(natal.position(Body.SUN).longitude(), within(1e-3));
        assertThat(solarReturn.iterations()).isPositive();
    }

    @Test
    void lunarReturnFallsWithinOneSiderealMonth() {
        final var seed = JulianDay.atMidnight(LocalDate.of(2001, 1, 1));

        final var lunarReturn = engine.returnChart(natal, Body.MOON, 2001);

        assertThat(lunarReturn.julianDay()).isBetween(seed, seed + 28.0);
        assertThat(lunarReturn.residual()).isLessThan(1e-2);
    }

    @Test
    void solarReturnSeedFallsBackToTheTwentyEighthForLeapDayBirths() {
        final var leapling = Subject.of("leap", LocalDateTime.of(1992, 2, 29, 12, 0).toInstant(ZoneOffset.UTC),
                TestContexts.LONDON, ZoneOffset.UTC);
        final var chart = context.chartBuilder.build(leapling, leapling.julianDayUt(),
                ChartOptions.tropical(HouseSystem.EQUAL));

        final var seed = PredictiveTimingEngine.seedFor(chart, Body.SUN, 2001);

        final var expected = JulianDay.fromInstant(LocalDateTime.of(2001, 2, 28, 12, 0).toInstant(ZoneOffset.UTC));
        assertThat(seed).isCloseTo(expected - 3.0, within(1e-6));
    }

    @Test
    void ingressIsRefinedOntoTheSignBoundary() {
        final var options = new TransitScanOptions(EnumSet.of(Body.SUN), Set.of(), true, false, false, null);
        final var start = JulianDay.atMidnight(LocalDate.of(1990, 6, 15));
        final var end = JulianDay.atMidnight(LocalDate.of(1990, 7, 31));

        final var events = engine.transitScan(natal, start, end, options);

        assertThat(events).hasSize(2);
        final var cancer = events.get(0);
        assertThat(cancer.type()).isEqualTo(TransitEventType.INGRESS);
        assertThat(cancer.target()).isEqualTo("CANCER");
        assertThat(cancer.julianDay()).isBetween(JulianDay.atMidnight(LocalDate.of(1990, 6, 21)),
                JulianDay.atMidnight(LocalDate.of(1990, 6, 22)));
        final var longitude = context.gateway.getLongitude(Body.SUN, cancer.julianDay());
        assertThat(Angles.signedDelta(90.0, longitude)).isCloseTo(0.0, within(2e-4));
        assertThat(events.get(1).target()).isEqualTo("LEO");
    }

    @Test
    void transitConjunctionToNatalSunMatchesTheSolarReturn() {
        final var options = new TransitScanOptions(EnumSet.of(Body.SUN), Set.of(AspectType.CONJUNCTION),
                false, true, false, null);
        final var start = JulianDay.atMidnight(LocalDate.of(1991, 6, 1));
        final var end = JulianDay.atMidnight(LocalDate.of(1991, 7, 1));

        final var events = engine.transitScan(natal, start, end, options);
        final var solarReturn = engine.returnChart(natal, Body.SUN, 1991);

        assertThat(events).filteredOn(e -> "SUN".equals(e.target()))
                .singleElement()
                .satisfies(event -> {
                    assertThat(event.aspect()).isEqualTo(AspectType.CONJUNCTION);
                    assertThat(event.julianDay()).isCloseTo(solarReturn.julianDay(), within(1e-3));
                });
        assertThat(events).isSortedAccordingTo((a, b) -> Double.compare(a.julianDay(), b.julianDay()));
    }

    @Test
    void mercuryStationsAlternateThroughTheYear() {
        final var options = new TransitScanOptions(EnumSet.of(Body.MERCURY), Set.of(), false, false, true, 1.0);
        final var start = JulianDay.atMidnight(LocalDate.of(1990, 1, 10));
        final var end = JulianDay.atMidnight(LocalDate.of(1990, 12, 1));

        final var events = engine.transitScan(natal, start, end, options);

        assertThat(events).extracting(TransitEvent::type)
                .contains(TransitEventType.STATION_RETROGRADE, TransitEventType.STATION_DIRECT);
        for (var i = 1; i < events.size(); i++) {
            assertThat(events.get(i).type()).isNotEqualTo(events.get(i - 1).type());
        }
        events.forEach(event -> {
            final var motion = context.gateway.getPositions(Set.of(Body.MERCURY), event.julianDay()).get(0)
                    .dailyMotion();
            assertThat(motion).isCloseTo(0.0, within(0.1));
        });
    }

    @Test
    void scanWindowMustBeOrderedAndInsideTheEphemerisRange() {
        final var jd = natal.julianDay();

        assertThatThrownBy(() -> engine.transitScan(natal, jd, jd))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> engine.transitScan(natal, context.gateway.minJulianDay() - 10, jd))
                .isInstanceOf(EphemerisUnavailableException.class);
    }

    @Test
    void bodyThatNeverMovesGivesNoConvergence() {
        final var source = mock(EphemerisSource.class);
        when(source.name()).thenReturn("frozen");
        when(source.positions(anySet(), anyDouble())).thenAnswer(invocation -> {
            final Set<Body> bodies = invocation.getArgument(0);
            final var result = new EnumMap<Body, EclipticCoordinates>(Body.class);
            bodies.forEach(body -> result.put(body, new EclipticCoordinates(200.0, 0.0, 1.0)));
            return result;
        });
        final var frozen = TestContexts.withSource(source).predictiveTimingEngine;

        assertThatThrownBy(() -> frozen.returnChart(natal, Body.SUN, 2000))
                .isInstanceOf(NoConvergenceException.class);
    }
}
