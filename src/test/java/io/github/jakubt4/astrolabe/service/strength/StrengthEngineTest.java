package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StrengthEngineTest {

    private final TestContexts context = TestContexts.standard();
    private final StrengthEngine strengthEngine = context.strengthEngine;

    private Chart chart;

    @BeforeEach
    void setUp() {
        chart = context.chartBuilder.build(TestContexts.SUBJECT, TestContexts.SUBJECT.julianDayUt(),
                ChartOptions.sidereal(HouseSystem.WHOLE_SIGN, Ayanamsa.LAHIRI));
    }

    @Test
    void scoresExactlyTheSevenClassicalPlanets() {
        final var scores = strengthEngine.score(chart);

        assertThat(scores.keySet()).containsExactlyInAnyOrderElementsOf(Body.classical());
    }

    @Test
    void returnedScoresCannotBeModified() {
        final var scores = strengthEngine.score(chart);

        assertThatThrownBy(() -> scores.remove(Body.SUN)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> scores.put(Body.SUN, scores.get(Body.MOON)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void everyComponentIsNormalizedAndSummedIntoPoints() {
        strengthEngine.score(chart).values().forEach(score -> {
            assertThat(score.positional()).isBetween(0.0, 1.0);
            assertThat(score.directional()).isBetween(0.0, 1.0);
            assertThat(score.temporal()).isBetween(0.0, 1.0);
            assertThat(score.motional()).isBetween(0.0, 1.0);
            assertThat(score.natural()).isBetween(0.0, 1.0);
            assertThat(score.aspectual()).isBetween(0.0, 1.0);
            final var sum = score.positional() + score.directional() + score.temporal() + score.motional()
                    + score.natural() + score.aspectual();
            assertThat(score.total()).isCloseTo(sum, within(1e-12));
            assertThat(score.points()).isCloseTo(sum * 100.0, within(1e-9));
            assertThat(score.band()).isEqualTo(StrengthBand.of(score.points()));
            assertThat(score.positional()).isEqualTo(score.dignity().virupas() / 60.0);
        });
    }

    @Test
    void sunIsStrongestByNatureAndSaturnWeakest() {
        final var scores = strengthEngine.score(chart);

        assertThat(scores.get(Body.SUN).natural()).isEqualTo(1.0);
        assertThat(scores.get(Body.SATURN).natural()).isCloseTo(8.57 / 60.0, within(1e-9));
    }

    @Test
    void noonBirthOnAFridayFavoursDayPlanetsAndVenus() {
        final var scores = strengthEngine.score(chart);

        assertThat(scores.get(Body.VENUS).temporal()).isEqualTo(1.0);
        assertThat(scores.get(Body.SUN).temporal()).isCloseTo(2.0 / 3.0, within(1e-12));
        assertThat(scores.get(Body.MOON).temporal()).isZero();
        assertThat(scores.get(Body.SATURN).temporal()).isZero();
    }

    @Test
    void sunNearTheSolsticeHasHighMotionalStrength() {
        assertThat(strengthEngine.score(chart).get(Body.SUN).motional()).isGreaterThan(0.95);
    }

    @Test
    void exaltationAndDebilitationAreOppositeSigns() {
        assertThat(DignityTable.dignity(Body.SUN, ZodiacSign.ARIES, 10)).isEqualTo(Dignity.EXALTED);
        assertThat(DignityTable.dignity(Body.SUN, ZodiacSign.LIBRA, 10)).isEqualTo(Dignity.DEBILITATED);
        assertThat(DignityTable.dignity(Body.SATURN, ZodiacSign.LIBRA, 20)).isEqualTo(Dignity.EXALTED);
        assertThat(DignityTable.dignity(Body.SATURN, ZodiacSign.ARIES, 20)).isEqualTo(Dignity.DEBILITATED);
    }

    @Test
    void moolatrikonaDependsOnDegreeWithinTheSign() {
        assertThat(DignityTable.dignity(Body.SUN, ZodiacSign.LEO, 10)).isEqualTo(Dignity.MOOLATRIKONA);
        assertThat(DignityTable.dignity(Body.SUN, ZodiacSign.LEO, 25)).isEqualTo(Dignity.OWN);
        assertThat(DignityTable.dignity(Body.MOON, ZodiacSign.TAURUS, 2)).isEqualTo(Dignity.EXALTED);
        assertThat(DignityTable.dignity(Body.MOON, ZodiacSign.TAURUS, 5)).isEqualTo(Dignity.MOOLATRIKONA);
        assertThat(DignityTable.dignity(Body.MERCURY, ZodiacSign.VIRGO, 10)).isEqualTo(Dignity.EXALTED);
        assertThat(DignityTable.dignity(Body.MERCURY, ZodiacSign.VIRGO, 16)).isEqualTo(Dignity.MOOLATRIKONA);
        assertThat(DignityTable.dignity(Body.MERCURY, ZodiacSign.VIRGO, 25)).isEqualTo(Dignity.OWN);
    }

    @Test
    void otherSignsFollowTheNaturalRelationshipToTheirRuler() {
        assertThat(DignityTable.dignity(Body.SATURN, ZodiacSign.LEO, 5)).isEqualTo(Dignity.ENEMY);
        assertThat(DignityTable.dignity(Body.JUPITER, ZodiacSign.SCORPIO, 5)).isEqualTo(Dignity.FRIEND);
        assertThat(DignityTable.dignity(Body.MARS, ZodiacSign.LIBRA, 5)).isEqualTo(Dignity.NEUTRAL);
    }

    @Test
    void shadowPlanetsHaveNoDignity() {
        assertThatThrownBy(() -> DignityTable.dignity(Body.RAHU, ZodiacSign.GEMINI, 5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void specialSignAspectsOfMarsJupiterAndSaturn() {
        assertThat(StrengthEngine.aspects(Body.VENUS, ZodiacSign.ARIES, ZodiacSign.LIBRA)).isTrue();
        assertThat(StrengthEngine.aspects(Body.VENUS, ZodiacSign.ARIES, ZodiacSign.CANCER)).isFalse();
        assertThat(StrengthEngine.aspects(Body.MARS, ZodiacSign.ARIES, ZodiacSign.CANCER)).isTrue();
        assertThat(StrengthEngine.aspects(Body.MARS, ZodiacSign.ARIES, ZodiacSign.SCORPIO)).isTrue();
        assertThat(StrengthEngine.aspects(Body.JUPITER, ZodiacSign.ARIES, ZodiacSign.LEO)).isTrue();
        assertThat(StrengthEngine.aspects(Body.JUPITER, ZodiacSign.ARIES, ZodiacSign.SAGITTARIUS)).isTrue();
        assertThat(StrengthEngine.aspects(Body.SATURN, ZodiacSign.ARIES, ZodiacSign.GEMINI)).isTrue();
        assertThat(StrengthEngine.aspects(Body.SATURN, ZodiacSign.ARIES, ZodiacSign.CAPRICORN)).isTrue();
        assertThat(StrengthEngine.aspects(Body.SATURN, ZodiacSign.ARIES, ZodiacSign.LEO)).isFalse();
    }

    @Test
    void motionClassesRelativeToMeanMotion() {
        assertThat(MotionClass.of(-0.2, 0.524)).isEqualTo(MotionClass.RETROGRADE);
        assertThat(MotionClass.of(0.01, 0.524)).isEqualTo(MotionClass.STATIONARY);
        assertThat(MotionClass.of(0.2, 0.524)).isEqualTo(MotionClass.SLOW);
        assertThat(MotionClass.of(0.5, 0.524)).isEqualTo(MotionClass.AVERAGE);
        assertThat(MotionClass.of(0.8, 0.524)).isEqualTo(MotionClass.FAST);
    }

    @Test
    void bandsFollowPointThresholds() {
        assertThat(StrengthBand.of(500)).isEqualTo(StrengthBand.VERY_STRONG);
        assertThat(StrengthBand.of(480)).isEqualTo(StrengthBand.VERY_STRONG);
        assertThat(StrengthBand.of(400)).isEqualTo(StrengthBand.STRONG);
        assertThat(StrengthBand.of(300)).isEqualTo(StrengthBand.AVERAGE);
        assertThat(StrengthBand.of(250)).isEqualTo(StrengthBand.WEAK);
        assertThat(StrengthBand.of(10)).isEqualTo(StrengthBand.VERY_WEAK);
    }
}
