package io.github.jakubt4.astrolabe.service.dosha;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ChartPoint;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.service.predictive.PredictiveTimingEngine;
import io.github.jakubt4.astrolabe.service.predictive.TransitEventType;
import io.github.jakubt4.astrolabe.service.predictive.TransitScanOptions;
import io.github.jakubt4.astrolabe.service.strength.DignityTable;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Sign-based afflictions read from a sidereal chart: Kaal Sarp, Manglik and Sade Sati.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DoshaEngine {

    private static final Set<Integer> MANGLIK_HOUSES = Set.of(1, 2, 4, 7, 8, 12);
    private static final double SATURN_STEP_DAYS = 2.0;

    private final PredictiveTimingEngine predictiveTimingEngine;
    private final EphemerisGateway gateway;

    /**
     * Mansion, pada and lord of every body and the ascendant of a sidereal chart.
     */
    public List<NakshatraPlacement> nakshatras(final Chart chart) {
        return chart.points().stream()
                .filter(p -> !ChartPoint.MIDHEAVEN.equals(p.id()))
                .map(p -> NakshatraPlacement.of(p.id(), p.longitude()))
                .toList();
    }

    /**
     * All seven planets on one side of the Rahu-Ketu axis.
     */
    public KaalSarpResult kaalSarp(final Chart chart) {
        final var rahu = chart.position(Body.RAHU).longitude();
        final var forward = new ArrayList<Body>();
        final var backward = new ArrayList<Body>();
        for (final var planet : Body.classical()) {
            final var fromRahu = Angles.normalize(chart.position(planet).longitude() - rahu);
            (fromRahu < 180.0 ? forward : backward).add(planet);
        }
        final var ascending = forward.size() >= backward.size();
        final var outside = ascending ? backward : forward;
        final var rahuHouse = ZodiacSign.houseDistance(ZodiacSign.ofLongitude(chart.ascendant()),
                chart.position(Body.RAHU).sign());
        return new KaalSarpResult(outside.isEmpty(), KaalSarpType.ofRahuHouse(rahuHouse), ascending, rahuHouse,
                outside);
    }

    /**
     * Mars in the 1st, 2nd, 4th, 7th, 8th or 12th sign from the ascendant or from the Moon.
     */
    public ManglikResult manglik(final Chart chart) {
        final var mars = chart.position(Body.MARS).sign();
        final var fromAscendant = ZodiacSign.houseDistance(ZodiacSign.ofLongitude(chart.ascendant()), mars);
        final var fromMoon = ZodiacSign.houseDistance(chart.position(Body.MOON).sign(), mars);
        final var byAscendant = MANGLIK_HOUSES.contains(fromAscendant);
        final var byMoon = MANGLIK_HOUSES.contains(fromMoon);
        final var cancelled = mars.ruler() == Body.MARS || mars == DignityTable.exaltation(Body.MARS);
        return new ManglikResult(byAscendant || byMoon, byAscendant, byMoon, fromAscendant, fromMoon, cancelled);
    }

    /**
     * Saturn's stays in the 12th, 1st and 2nd signs from the natal Moon between {@code fromJd}
     * and {@code toJd}, timed from its sign ingresses.
     */
    public SadeSatiReport sadeSati(final Chart natal, final double asOfJd, final double fromJd, final double toJd) {
        final var start = FastMath.max(fromJd, gateway.minJulianDay());
        final var end = FastMath.min(toJd, gateway.maxJulianDay() - SATURN_STEP_DAYS);
        final var moonSign = natal.position(Body.MOON).sign();

        final var options = new TransitScanOptions(EnumSet.of(Body.SATURN), Set.of(), true, false, false,
                SATURN_STEP_DAYS);
        final var ingresses = predictiveTimingEngine.transitScan(natal, start, end, options).stream()
                .filter(e -> e.type() == TransitEventType.INGRESS)
                .toList();

        final var phases = new ArrayList<SadeSatiPhase>();
        var sign = saturnSign(natal, start);
        var segmentStart = start;
        for (final var ingress : ingresses) {
            addPhase(phases, moonSign, sign, segmentStart, ingress.julianDay());
            sign = ZodiacSign.valueOf(ingress.target());
            segmentStart = ingress.julianDay();
        }
        addPhase(phases, moonSign, sign, segmentStart, end);

        final var current = phases.stream().filter(p -> p.contains(asOfJd)).findFirst().orElse(null);
        log.debug("Sade Sati for Moon in {}: {} phases, active: {}", moonSign, phases.size(), current != null);
        return new SadeSatiReport(moonSign, asOfJd, current != null, current, phases);
    }

    /**
     * Window of 15 years either side of the as-of date.
     */
    public SadeSatiReport sadeSati(final Chart natal, final double asOfJd) {
        final var halfWindow = 15 * JulianDay.DAYS_PER_YEAR;
        return sadeSati(natal, asOfJd, asOfJd - halfWindow, asOfJd + halfWindow);
    }

    private ZodiacSign saturnSign(final Chart natal, final double julianDay) {
        final var tropical = gateway.getLongitude(Body.SATURN, julianDay);
        final var offset = natal.ayanamsa() == null ? 0.0 : natal.ayanamsa().valueAt(julianDay);
        return ZodiacSign.ofLongitude(tropical - offset);
    }

    private static void addPhase(final List<SadeSatiPhase> phases, final ZodiacSign moonSign, final ZodiacSign sign,
                                 final double start, final double end) {
        if (end <= start) {
            return;
        }
        final var distance = ZodiacSign.houseDistance(moonSign, sign);
        final SadeSatiPhase.Phase phase;
        if (distance == 12) {
            phase = SadeSatiPhase.Phase.RISING;
        } else if (distance == 1) {
            phase = SadeSatiPhase.Phase.PEAK;
        } else if (distance == 2) {
            phase = SadeSatiPhase.Phase.SETTING;
        } else {
            return;
        }
        phases.add(new SadeSatiPhase(phase, sign, start, end));
    }
}
