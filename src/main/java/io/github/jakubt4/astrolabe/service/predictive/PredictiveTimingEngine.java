package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.error.NoConvergenceException;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.aspect.AspectEngine;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;
import io.github.jakubt4.astrolabe.service.aspect.OrbTable;
import io.github.jakubt4.astrolabe.service.chart.ChartBuilder;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

/**
 * Progressions, directions, planetary returns and transit timing.
 *
 * <p>Searches run on an iteration budget ({@code astrolabe.search.max-iterations}) and never on
 * wall-clock time; running out raises {@link NoConvergenceException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictiveTimingEngine {

    private static final double SOLAR_RETURN_LEAD_DAYS = 3.0;
    private static final double STATION_HALF_WINDOW = 0.05;

    private final ChartBuilder chartBuilder;
    private final EphemerisGateway gateway;
    private final AspectEngine aspectEngine;
    private final AstrolabeProperties properties;

    // -- progressions -----------------------------------------------------------------------

    public Progression progress(final Chart natal, final double targetJd, final ProgressionTechnique technique) {
        if (targetJd < natal.julianDay()) {
            throw new InputValidationException("Progression target precedes the birth");
        }
        final var age = (targetJd - natal.julianDay()) / JulianDay.DAYS_PER_YEAR;
        final var progressedJd = natal.julianDay() + age;
        final var options = ChartOptions.of(natal);

        final Chart moved;
        final double arc;
        switch (technique) {
            case SECONDARY -> {
                moved = chartBuilder.build(natal.subject(), progressedJd, natal.location(), options);
                arc = Angles.normalize(moved.position(Body.SUN).longitude() - natal.position(Body.SUN).longitude());
            }
            case SOLAR_ARC -> {
                arc = Angles.normalize(tracker(natal).longitude(Body.SUN, progressedJd)
                        - natal.position(Body.SUN).longitude());
                moved = shifted(natal, targetJd, arc);
            }
            default -> {
                arc = age * technique.degreesPerYear();
                moved = shifted(natal, targetJd, arc);
            }
        }

        final var orbs = OrbTable.uniform(properties.aspects().progressionOrb(), ptolemaic());
        final var aspects = aspectEngine.crossAspects(moved.points(), natal.points(), orbs);
        log.debug("{} progression to JD {}: age {} years, arc {}", technique, targetJd, age, arc);
        return new Progression(technique, targetJd, age, arc, moved, aspects);
    }

    /**
     * Natal chart with every body, cusp and angle advanced by the same arc.
     */
    private static Chart shifted(final Chart natal, final double targetJd, final double arc) {
        final var positions = natal.positions().stream()
                .map(p -> p.withLongitude(p.longitude() + arc))
                .toList();
        final var cusps = natal.cusps().stream()
                .map(c -> Angles.normalize(c + arc))
                .toList();
        return new Chart(natal.subject(), targetJd, natal.location(), natal.houseSystem(), natal.zodiac(),
                natal.ayanamsa(), natal.ayanamsaValue(), positions, cusps,
                Angles.normalize(natal.ascendant() + arc), Angles.normalize(natal.midheaven() + arc));
    }

    // -- returns ----------------------------------------------------------------------------

    /**
     * Return in a calendar year: the Sun is searched from three days before the birthday,
     * every other body from 1 January.
     */
    public ReturnChart returnChart(final Chart natal, final Body body, final int targetYear) {
        return returnChart(natal, body, seedFor(natal, body, targetYear));
    }

    public ReturnChart returnChart(final Chart natal, final Body body, final double seedJd) {
        final var tracker = tracker(natal);
        final var target = natal.position(body).longitude();
        final var search = properties.search();
        final var budget = search.maxIterations();
        final var step = FastMath.max(0.25, FastMath.min(5.0, 5.0 / FastMath.abs(body.meanDailyMotion())));
        final var limit = FastMath.min(seedJd + search.spanFactor() * body.returnPeriodDays(),
                gateway.maxJulianDay() - step);

        var iterations = 1;
        var previousJd = seedJd;
        var previous = tracker.offset(body, target, seedJd);
        if (previous == 0.0) {
            return finish(natal, body, target, seedJd, iterations, 0.0);
        }
        while (previousJd < limit) {
            if (iterations >= budget) {
                throw new NoConvergenceException(body + " return", iterations, FastMath.abs(previous), previousJd);
            }
            final var jd = FastMath.min(previousJd + step, limit);
            final var current = tracker.offset(body, target, jd);
            iterations++;
            if (crosses(previous, current)) {
                final var exact = tracker.refineCrossing(body, target, previousJd, jd, budget - iterations);
                return finish(natal, body, target, exact, iterations, FastMath.abs(tracker.offset(body, target, exact)));
            }
            previousJd = jd;
            previous = current;
        }
        log.warn("{} return not found within {} days of JD {}", body, limit - seedJd, seedJd);
        throw new NoConvergenceException(body + " return", iterations, FastMath.abs(previous), previousJd);
    }

    private ReturnChart finish(final Chart natal, final Body body, final double target, final double jd,
                               final int iterations, final double residual) {
        final var chart = chartBuilder.build(natal.subject(), jd, natal.location(), ChartOptions.of(natal));
        log.debug("{} return at JD {} after {} iterations (residual {})", body, jd, iterations, residual);
        return new ReturnChart(body, target, jd, iterations, residual, chart);
    }

    static double seedFor(final Chart natal, final Body body, final int targetYear) {
        if (body != Body.SUN) {
            return JulianDay.atMidnight(LocalDate.of(targetYear, 1, 1));
        }
        final var birth = JulianDay.toInstant(natal.julianDay()).atOffset(ZoneOffset.UTC);
        final var day = birth.getMonthValue() == 2 && birth.getDayOfMonth() == 29 ? 28 : birth.getDayOfMonth();
        final var birthday = LocalDate.of(targetYear, birth.getMonthValue(), day)
                .atTime(birth.toLocalTime())
                .toInstant(ZoneOffset.UTC);
        return JulianDay.fromInstant(birthday) - SOLAR_RETURN_LEAD_DAYS;
    }

    // -- transits ---------------------------------------------------------------------------

    public List<TransitEvent> transitScan(final Chart natal, final double startJd, final double endJd) {
        return transitScan(natal, startJd, endJd, TransitScanOptions.defaults());
    }

    public List<TransitEvent> transitScan(final Chart natal, final double startJd, final double endJd,
                                          final TransitScanOptions options) {
        if (endJd <= startJd) {
            throw new InputValidationException("Transit scan end must be after its start");
        }
        gateway.checkRange(startJd);
        gateway.checkRange(endJd);
        final var tracker = tracker(natal);
        final var step = options.effectiveStep();
        final var budget = properties.search().maxIterations();
        final var targets = aspectTargets(natal, options);
        final var events = new ArrayList<TransitEvent>();

        var previousJd = startJd;
        var previous = tracker.longitudes(options.bodies(), startJd);
        Map<Body, Double> previousMotion = null;
        while (previousJd < endJd) {
            final var jd = FastMath.min(previousJd + step, endJd);
            final var current = tracker.longitudes(options.bodies(), jd);
            final var motion = new EnumMap<Body, Double>(Body.class);
            for (final var body : options.bodies()) {
                final var before = previous.get(body);
                final var after = current.get(body);
                final var moved = Angles.signedDelta(before, after);
                motion.put(body, moved);

                if (options.ingresses() && Angles.signIndex(before) != Angles.signIndex(after)) {
                    final var boundary = moved >= 0
                            ? ZodiacSign.ofLongitude(after).startLongitude()
                            : ZodiacSign.ofLongitude(before).startLongitude();
                    final var exact = tracker.refineCrossing(body, boundary, previousJd, jd, budget);
                    events.add(event(TransitEventType.INGRESS, body, ZodiacSign.ofLongitude(after).name(), null,
                            exact, boundary));
                }
                if (options.aspectEvents()) {
                    for (final var target : targets) {
                        final var from = Angles.signedDelta(target.longitude(), before);
                        final var to = Angles.signedDelta(target.longitude(), after);
                        if (crosses(from, to)) {
                            final var exact = tracker.refineCrossing(body, target.longitude(), previousJd, jd, budget);
                            events.add(event(TransitEventType.ASPECT, body, target.point(), target.aspect(), exact,
                                    target.longitude()));
                        }
                    }
                }
                if (options.stations() && previousMotion != null && !body.isNode()) {
                    final var earlier = previousMotion.get(body);
                    if (earlier > 0 && moved < 0 || earlier < 0 && moved > 0) {
                        events.add(station(tracker, body, previousJd - step, jd, earlier > 0, budget));
                    }
                }
            }
            previousMotion = motion;
            previousJd = jd;
            previous = current;
        }
        events.sort(Comparator.comparingDouble(TransitEvent::julianDay));
        log.debug("Transit scan JD {} - {}: {} events", startJd, endJd, events.size());
        return events;
    }

    private TransitEvent station(final LongitudeTracker tracker, final Body body, final double from, final double to,
                                 final boolean turningRetrograde, final int budget) {
        final var lo = FastMath.max(from, gateway.minJulianDay() + STATION_HALF_WINDOW);
        final var hi = FastMath.min(to, gateway.maxJulianDay() - STATION_HALF_WINDOW);
        final var speedLo = tracker.speed(body, lo, STATION_HALF_WINDOW);
        final var speedHi = tracker.speed(body, hi, STATION_HALF_WINDOW);
        final var exact = speedLo * speedHi < 0
                ? tracker.refineStation(body, lo, hi, STATION_HALF_WINDOW, budget)
                : (lo + hi) / 2;
        final var type = turningRetrograde ? TransitEventType.STATION_RETROGRADE : TransitEventType.STATION_DIRECT;
        return event(type, body, null, null, exact, tracker.longitude(body, exact));
    }

    private record AspectTarget(String point, AspectType aspect, double longitude) {
    }

    private static List<AspectTarget> aspectTargets(final Chart natal, final TransitScanOptions options) {
        final var targets = new ArrayList<AspectTarget>();
        for (final var point : natal.points()) {
            for (final var aspect : options.aspects()) {
                targets.add(new AspectTarget(point.id(), aspect,
                        Angles.normalize(point.longitude() + aspect.angle())));
                if (aspect.angle() > 0 && aspect.angle() < 180) {
                    targets.add(new AspectTarget(point.id(), aspect,
                            Angles.normalize(point.longitude() - aspect.angle())));
                }
            }
        }
        return targets;
    }

    private static TransitEvent event(final TransitEventType type, final Body body, final String target,
                                      final AspectType aspect, final double jd, final double longitude) {
        return new TransitEvent(type, body, target, aspect, jd, JulianDay.toInstant(jd), Angles.normalize(longitude));
    }

    // -- shared -----------------------------------------------------------------------------

    /**
     * Sign change of a signed offset, excluding the jump at ±180.
     */
    private static boolean crosses(final double before, final double after) {
        if (FastMath.abs(before) >= 90 || FastMath.abs(after) >= 90) {
            return false;
        }
        return before < 0 && after >= 0 || before > 0 && after <= 0;
    }

    private LongitudeTracker tracker(final Chart chart) {
        return new LongitudeTracker(gateway, chart.zodiac() == ZodiacType.SIDEREAL ? chart.ayanamsa() : null,
                properties.search().refineToleranceDays() / 10.0);
    }

    private static EnumSet<AspectType> ptolemaic() {
        return EnumSet.of(AspectType.CONJUNCTION, AspectType.SEXTILE, AspectType.SQUARE,
                AspectType.TRINE, AspectType.OPPOSITION);
    }
}
