package io.github.jakubt4.astrolabe.service.period;

import io.github.jakubt4.astrolabe.TestContexts;
import io.github.jakubt4.astrolabe.error.OutOfRangeInstantException;
import io.github.jakubt4.astrolabe.model.Ayanamsa;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.Nakshatra;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.util.JulianDay;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PeriodEngineTest {

    private static final double BIRTH_JD = 2451545.0;

    private final TestContexts context = TestContexts.standard();
    private final PeriodEngine periodEngine = context.periodEngine;

    @Test
    void moonAtTheStartOfAshwiniBeginsAFullKetuPeriod() {
        final var tree = periodEngine.buildTree(BIRTH_JD, 0.0, 3);

        assertThat(tree.nakshatra()).isEqualTo(Nakshatra.values()[0]);
        assertThat(tree.startingLord()).isEqualTo(Body.KETU);
        assertThat(tree.balanceYears()).isCloseTo(7.0, within(1e-9));
        assertThat(tree.root().startJd()).isEqualTo(BIRTH_JD);
        assertThat(tree.root().durationDays()).isCloseTo(120 * JulianDay.DAYS_PER_YEAR, within(1e-6));
        assertThat(tree.root().children()).extracting(Period::lord).containsExactly(
                Body.KETU, Body.VENUS, Body.SUN, Body.MOON, Body.MARS,
                Body.RAHU, Body.JUPITER, Body.SATURN, Body.MERCURY);
    }

    @Test
    void halfElapsedNakshatraLeavesHalfTheLordsPeriod() {
        final var moon = Nakshatra.SPAN + Nakshatra.SPAN / 2;
        final var tree = periodEngine.buildTree(BIRTH_JD, moon, 3);

        assertThat(tree.startingLord()).isEqualTo(Body.VENUS);
        assertThat(tree.elapsedFraction()).isCloseTo(0.5, within(1e-9));
        assertThat(tree.balanceYears()).isCloseTo(10.0, within(1e-9));

        final var first = tree.root().children().get(0);
        assertThat(first.startJd()).isCloseTo(BIRTH_JD - 10 * JulianDay.DAYS_PER_YEAR, within(1e-6));
        assertThat(first.endJd()).isCloseTo(BIRTH_JD + 10 * JulianDay.DAYS_PER_YEAR, within(1e-6));
    }

    @Test
    void childrenTileTheirParentAtEveryLevel() {
        final var tree = periodEngine.buildTree(BIRTH_JD, 123.4, 3);

        assertTiles(tree.root());
    }

    @Test
    void subPeriodsStartFromTheParentLordInProportion() {
        final var tree = periodEngine.buildTree(BIRTH_JD, 0.0, 3);
        final var venus = tree.root().children().get(1);

        assertThat(venus.lord()).isEqualTo(Body.VENUS);
        assertThat(venus.children()).hasSize(9);
        final var first = venus.children().get(0);
        assertThat(first.lord()).isEqualTo(Body.VENUS);
        assertThat(first.parentLord()).isEqualTo(Body.VENUS);
        assertThat(first.level()).isEqualTo(2);
        assertThat(first.durationDays()).isCloseTo(venus.durationDays() * 20 / 120, within(1e-6));
        assertThat(venus.children().get(1).lord()).isEqualTo(Body.SUN);
    }

    @Test
    void queryReturnsTheContainingPathFromMajorToDeepest() {
        final var tree = periodEngine.buildTree(BIRTH_JD, 200.0, 3);
        final var instant = BIRTH_JD + 4000.5;

        final var path = periodEngine.query(tree, instant);

        assertThat(path).hasSize(3);
        assertThat(path).extracting(Period::level).containsExactly(1, 2, 3);
        assertThat(path).allSatisfy(period -> assertThat(period.contains(instant)).isTrue());
        assertThat(path.get(1).parentLord()).isEqualTo(path.get(0).lord());
        assertThat(path.get(2).parentLord()).isEqualTo(path.get(1).lord());
    }

    @Test
    void queryOutsideTheCycleIsRejected() {
        final var tree = periodEngine.buildTree(BIRTH_JD, 0.0, 3);

        assertThatThrownBy(() -> periodEngine.query(tree, BIRTH_JD - 1))
                .isInstanceOf(OutOfRangeInstantException.class);
        assertThatThrownBy(() -> periodEngine.query(tree, tree.root().endJd()))
                .isInstanceOf(OutOfRangeInstantException.class);
    }

    @Test
    void upcomingListsTheNextPeriodsAtALevel() {
        final var tree = periodEngine.buildTree(BIRTH_JD, 0.0, 3);

        final var majors = periodEngine.upcoming(tree, BIRTH_JD, 1, 2);
        final var subs = periodEngine.upcoming(tree, BIRTH_JD, 2, 3);

        assertThat(majors).extracting(Period::lord).containsExactly(Body.VENUS, Body.SUN);
        assertThat(subs).extracting(Period::lord).containsExactly(Body.VENUS, Body.SUN, Body.MOON);
        assertThat(subs).allSatisfy(p -> assertThat(p.startJd()).isGreaterThan(BIRTH_JD));
    }

    @Test
    void depthAndLevelAreBounded() {
        assertThatThrownBy(() -> periodEngine.buildTree(BIRTH_JD, 0.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> periodEngine.buildTree(BIRTH_JD, 0.0, PeriodEngine.MIN_DEPTH - 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("between 3 and 5");
        assertThatThrownBy(() -> periodEngine.buildTree(BIRTH_JD, 0.0, PeriodEngine.MAX_DEPTH + 1))
                .isInstanceOf(IllegalArgumentException.class);

        final var tree = periodEngine.buildTree(BIRTH_JD, 0.0, 3);
        assertThatThrownBy(() -> periodEngine.upcoming(tree, BIRTH_JD, 4, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void subjectAndSiderealChartGiveTheSameTree() {
        final var subject = TestContexts.SUBJECT;
        final var chart = context.chartBuilder.build(subject, subject.julianDayUt(),
                ChartOptions.sidereal(HouseSystem.WHOLE_SIGN, Ayanamsa.LAHIRI));

        final var fromSubject = periodEngine.buildTree(subject);
        final var fromChart = periodEngine.buildTree(chart);

        assertThat(fromChart.startingLord()).isEqualTo(fromSubject.startingLord());
        assertThat(fromChart.moonLongitude()).isCloseTo(fromSubject.moonLongitude(), within(1e-6));
        assertThat(fromChart.root().startJd()).isCloseTo(fromSubject.root().startJd(), within(1e-3));
    }

    private static void assertTiles(final Period parent) {
        if (parent.children().isEmpty()) {
            return;
        }
        final var children = parent.children();
        assertThat(children.get(0).startJd()).isEqualTo(parent.startJd());
        assertThat(children.get(children.size() - 1).endJd()).isEqualTo(parent.endJd());
        for (var i = 1; i < children.size(); i++) {
            assertThat(children.get(i).startJd()).isEqualTo(children.get(i - 1).endJd());
        }
        final var total = children.stream().mapToDouble(Period::durationDays).sum();
        assertThat(total).isCloseTo(parent.durationDays(), within(1e-6));
        children.forEach(PeriodEngineTest::assertTiles);
    }
}
