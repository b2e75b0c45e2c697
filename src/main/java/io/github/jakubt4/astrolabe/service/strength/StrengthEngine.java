package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.service.ephemeris.Nutation;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.time.DayOfWeek;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static io.github.jakubt4.astrolabe.model.Body.JUPITER;
import static io.github.jakubt4.astrolabe.model.Body.MARS;
import static io.github.jakubt4.astrolabe.model.Body.MERCURY;
import static io.github.jakubt4.astrolabe.model.Body.MOON;
import static io.github.jakubt4.astrolabe.model.Body.SATURN;
import static io.github.jakubt4.astrolabe.model.Body.SUN;
import static io.github.jakubt4.astrolabe.model.Body.VENUS;

/**
 * Six-fold planetary strength for the seven classical planets.
 *
 * <p>Every component is looked up or computed in closed form from the chart and
 * normalized to [0, 1]:
 * <ul>
 *   <li>positional: sign dignity in virupas / 60</li>
 *   <li>directional: 1 at the cusp of the planet's strongest house, 0 opposite it</li>
 *   <li>temporal: day/night strength (weight 2) and weekday lord (weight 1)</li>
 *   <li>motional: Sun by declination, Moon by elongation, others by motion class</li>
 *   <li>natural: fixed naisargika values</li>
 *   <li>aspectual: net benefic minus malefic sign aspects received</li>
 * </ul>
 */
@Slf4j
@Service
public class StrengthEngine {

    private static final Map<Body, Integer> STRONGEST_HOUSE = new EnumMap<>(Body.class);
    private static final Map<DayOfWeek, Body> WEEKDAY_LORD = new EnumMap<>(DayOfWeek.class);
    private static final Set<Body> DAY_STRONG = EnumSet.of(SUN, JUPITER, VENUS, MERCURY);
    private static final Set<Body> NIGHT_STRONG = EnumSet.of(MOON, MARS, SATURN, MERCURY);

    static {
        STRONGEST_HOUSE.put(SUN, 10);
        STRONGEST_HOUSE.put(MARS, 10);
        STRONGEST_HOUSE.put(JUPITER, 1);
        STRONGEST_HOUSE.put(MERCURY, 1);
        STRONGEST_HOUSE.put(MOON, 4);
        STRONGEST_HOUSE.put(VENUS, 4);
        STRONGEST_HOUSE.put(SATURN, 7);

        WEEKDAY_LORD.put(DayOfWeek.SUNDAY, SUN);
        WEEKDAY_LORD.put(DayOfWeek.MONDAY, MOON);
        WEEKDAY_LORD.put(DayOfWeek.TUESDAY, MARS);
        WEEKDAY_LORD.put(DayOfWeek.WEDNESDAY, MERCURY);
        WEEKDAY_LORD.put(DayOfWeek.THURSDAY, JUPITER);
        WEEKDAY_LORD.put(DayOfWeek.FRIDAY, VENUS);
        WEEKDAY_LORD.put(DayOfWeek.SATURDAY, SATURN);
    }

    public Map<Body, StrengthScore> score(final Chart chart) {
        final var result = new EnumMap<Body, StrengthScore>(Body.class);
        final var daytime = chart.houseOf(SUN) >= 7;
        final var weekdayLord = weekdayLord(chart);
        for (final var planet : Body.classical()) {
            final var position = chart.position(planet);
            final var dignity = DignityTable.dignity(planet, position.sign(), Angles.degreeInSign(position.longitude()));
            result.put(planet, StrengthScore.of(planet, dignity,
                    dignity.virupas() / 60.0,
                    directional(chart, planet),
                    temporal(planet, daytime, weekdayLord),
                    motional(chart, planet),
                    planet.naturalStrength() / 60.0,
                    aspectual(chart, planet)));
        }
        log.debug("Strength scored for {} planets, day birth: {}", result.size(), daytime);
        return Collections.unmodifiableMap(result);
    }

    static double directional(final Chart chart, final Body planet) {
        final var strongestPoint = chart.cusps().get(STRONGEST_HOUSE.get(planet) - 1);
        return 1.0 - Angles.separation(chart.position(planet).longitude(), strongestPoint) / 180.0;
    }

    static double temporal(final Body planet, final boolean daytime, final Body weekdayLord) {
        final var dayNight = (daytime ? DAY_STRONG : NIGHT_STRONG).contains(planet) ? 1.0 : 0.0;
        final var weekday = planet == weekdayLord ? 1.0 : 0.0;
        return (2 * dayNight + weekday) / 3.0;
    }

    static double motional(final Chart chart, final Body planet) {
        final var position = chart.position(planet);
        if (planet == SUN) {
            final var tropical = position.longitude() + chart.ayanamsaValue();
            final var obliquity = Nutation.meanObliquity(chart.julianDay());
            final var declination = Angles.asinDeg(Angles.sinDeg(obliquity) * Angles.sinDeg(tropical));
            return clamp((declination + 24.0) / 48.0);
        }
        if (planet == MOON) {
            return Angles.separation(position.longitude(), chart.position(SUN).longitude()) / 180.0;
        }
        return MotionClass.of(position.dailyMotion(), planet.meanDailyMotion()).score();
    }

    /**
     * Vedic sign aspects: every planet aspects the 7th sign from itself, Mars also the 4th
     * and 8th, Jupiter the 5th and 9th, Saturn the 3rd and 10th.
     */
    static double aspectual(final Chart chart, final Body planet) {
        final var target = chart.position(planet).sign();
        final var waxing = Angles.normalize(chart.position(MOON).longitude() - chart.position(SUN).longitude()) < 180;
        var net = 0;
        for (final var other : Body.classical()) {
            if (other == planet || !aspects(other, chart.position(other).sign(), target)) {
                continue;
            }
            net += benefic(other, waxing) ? 1 : -1;
        }
        return clamp(0.5 + net / 12.0);
    }

    public static boolean aspects(final Body planet, final ZodiacSign from, final ZodiacSign to) {
        final var distance = ZodiacSign.houseDistance(from, to);
        if (distance == 7) {
            return true;
        }
        return switch (planet) {
            case MARS -> distance == 4 || distance == 8;
            case JUPITER -> distance == 5 || distance == 9;
            case SATURN -> distance == 3 || distance == 10;
            default -> false;
        };
    }

    private static boolean benefic(final Body planet, final boolean waxingMoon) {
        return switch (planet) {
            case JUPITER, VENUS, MERCURY -> true;
            case MOON -> waxingMoon;
            default -> false;
        };
    }

    private static Body weekdayLord(final Chart chart) {
        final var offset = chart.subject() == null ? ZoneOffset.UTC : chart.subject().utcOffset();
        final var local = JulianDay.toInstant(chart.julianDay()).atOffset(offset);
        return WEEKDAY_LORD.get(local.getDayOfWeek());
    }

    private static double clamp(final double value) {
        return FastMath.max(0.0, FastMath.min(1.0, value));
    }
}
