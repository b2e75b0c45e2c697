package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.error.EphemerisUnavailableException;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.BodyPosition;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Single entry point for body positions.
 *
 * <p>Converts UT to TT, enforces the supported date range, and derives daily motion from
 * a central difference over one day: one batched source read per sample instant.
 */
@Slf4j
@Service
public class EphemerisGateway {

    private static final double HALF_DAY = 0.5;

    private final EphemerisReader reader;
    private final double minJulianDay;
    private final double maxJulianDay;

    public EphemerisGateway(final EphemerisReader reader, final AstrolabeProperties properties) {
        this.reader = reader;
        this.minJulianDay = JulianDay.atMidnight(LocalDate.of(properties.ephemeris().minYear(), 1, 1));
        this.maxJulianDay = JulianDay.atMidnight(LocalDate.of(properties.ephemeris().maxYear() + 1, 1, 1));
        log.info("Ephemeris gateway ready: source [{}], range JD {} - {}",
                reader.sourceName(), minJulianDay, maxJulianDay);
    }

    /**
     * Positions with daily motion for the requested bodies, in request order.
     *
     * @throws EphemerisUnavailableException outside the supported range or when the source keeps failing
     */
    public List<BodyPosition> getPositions(final Collection<Body> bodies, final double julianDayUt) {
        checkRange(julianDayUt);
        if (bodies.isEmpty()) {
            return List.of();
        }
        final var requested = EnumSet.copyOf(bodies);
        final var jdTt = TimeScales.toTerrestrial(julianDayUt);

        final var before = reader.read(requested, jdTt - HALF_DAY);
        final var now = reader.read(requested, jdTt);
        final var after = reader.read(requested, jdTt + HALF_DAY);

        final var positions = new ArrayList<BodyPosition>(requested.size());
        for (final var body : bodies) {
            final var current = now.get(body);
            final var motion = Angles.signedDelta(before.get(body).longitude(), after.get(body).longitude())
                    / (2 * HALF_DAY);
            positions.add(BodyPosition.of(body, current.longitude(), current.latitude(), current.distance(), motion));
        }
        log.debug("Positions for {} bodies at JD(UT) {}", positions.size(), julianDayUt);
        return positions;
    }

    /**
     * Longitudes only, from a single source read. Used by searches that sample many instants.
     */
    public Map<Body, Double> getLongitudes(final Collection<Body> bodies, final double julianDayUt) {
        checkRange(julianDayUt);
        final var longitudes = new EnumMap<Body, Double>(Body.class);
        if (bodies.isEmpty()) {
            return longitudes;
        }
        final var coordinates = reader.read(EnumSet.copyOf(bodies), TimeScales.toTerrestrial(julianDayUt));
        coordinates.forEach((body, c) -> longitudes.put(body, c.longitude()));
        return longitudes;
    }

    public double getLongitude(final Body body, final double julianDayUt) {
        return getLongitudes(EnumSet.of(body), julianDayUt).get(body);
    }

    public void checkRange(final double julianDayUt) {
        if (Double.isNaN(julianDayUt) || julianDayUt < minJulianDay || julianDayUt >= maxJulianDay) {
            throw new EphemerisUnavailableException(String.format(Locale.ROOT,
                    "JD %.5f is outside the supported ephemeris range [%.1f, %.1f)",
                    julianDayUt, minJulianDay, maxJulianDay));
        }
    }

    public boolean inRange(final double julianDayUt) {
        return julianDayUt >= minJulianDay && julianDayUt < maxJulianDay;
    }

    public double minJulianDay() {
        return minJulianDay;
    }

    public double maxJulianDay() {
        return maxJulianDay;
    }
}
