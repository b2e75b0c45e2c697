package io.github.jakubt4.astrolabe.service.chart;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.error.InvalidLatitudeException;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.util.Angles;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ChartBuilderTest {

    private final TestContexts context = TestContexts.standard();
    private final ChartBuilder chartBuilder = context.chartBuilder;

    @Test
    void tropicalNatalChartHasAllBodiesAndTwelveCusps() {
        final var chart = chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(),
                ChartOptions.tropical(HouseSystem.PLACIDUS));

        assertThat(chart.positions()).hasSize(Body.values().length);
        assertThat(chart.cusps()).hasSize(12);
        assertThat(chart.ayanamsa()).isNull();
        assertThat(chart.ayanamsaValue()).isZero();
        assertThat(chart.position(Body.SUN).longitude()).isCloseTo(84.132, within(0.01));
        assertThat(chart.ascendant()).isEqualTo(chart.cusps().get(0));
        for (final var body : Body.values()) {
            assertThat(chart.houseOf(body)).isBetween(1, 12);
        }
    }

    @Test
    void siderealChartSubtractsAyanamsaFromBodiesAndAngles() {
        final var jd = TestContexts.SUBJECT.julianDayUt();
        final var tropical = chartBuilder.build(TestContexts.SUBJECT, jd, ChartOptions.tropical(HouseSystem.EQUAL));
        final var sidereal = chartBuilder.build(TestContexts.SUBJECT, jd,
                ChartOptions.sidereal(HouseSystem.EQUAL, Ayanamsa.LAHIRI));

        final var ayanamsa = Ayanamsa.LAHIRI.valueAt(jd);
        assertThat(ayanamsa).isCloseTo(23.72, within(0.02));
        assertThat(sidereal.zodiac()).isEqualTo(ZodiacType.SIDEREAL);
        assertThat(sidereal.ayanamsaValue()).isEqualTo(ayanamsa);
        for (final var body : Body.values()) {
            assertThat(Angles.signedDelta(sidereal.position(body).longitude(), tropical.position(body).longitude()))
                    .isCloseTo(ayanamsa, within(1e-9));
        }
        assertThat(Angles.signedDelta(sidereal.ascendant(), tropical.ascendant())).isCloseTo(ayanamsa, within(1e-9));
        assertThat(Angles.signedDelta(sidereal.cusps().get(4), tropical.cusps().get(4))).isCloseTo(ayanamsa,
                within(1e-9));
    }

    @Test
    void houseAssignmentFollowsCuspContainment() {
        final var chart = chartBuilder.build(TestContexts.SUBJECT, HouseSystem.PLACIDUS);

        for (final var position : chart.positions()) {
            final var house = chart.houseOf(position.body());
            final var start = chart.cusps().get(house - 1);
            final var end = chart.cusps().get(house % 12);
            assertThat(Angles.normalize(position.longitude() - start))
                    .isLessThan(Angles.normalize(end - start));
        }
    }

    @Test
    void identicalInputsGiveEqualCharts() {
        final var first = chartBuilder.build(TestContexts.SUBJECT, HouseSystem.PLACIDUS);
        final var second = context.chartBuilder.build(TestContexts.SUBJECT, HouseSystem.PLACIDUS);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void placidusFailsAbovePolarLimitWhileWholeSignWorks() {
        final var tromso = Subject.of(Instant.parse("1995-01-10T08:00:00Z"), GeoLocation.of(69.65, 18.96));

        assertThatThrownBy(() -> chartBuilder.build(tromso, HouseSystem.PLACIDUS))
                .isInstanceOf(InvalidLatitudeException.class);
        assertThat(chartBuilder.build(tromso, HouseSystem.WHOLE_SIGN).cusps()).hasSize(12);
    }
}
