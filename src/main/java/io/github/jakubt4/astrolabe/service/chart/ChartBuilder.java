package io.github.jakubt4.astrolabe.service.chart;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import io.github.jakubt4.astrolabe.model.HouseSystem;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway;
import io.github.jakubt4.astrolabe.service.ephemeris.Nutation;
import io.github.jakubt4.astrolabe.service.ephemeris.SiderealTime;
import io.github.jakubt4.astrolabe.service.ephemeris.TimeScales;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Casts charts: one batched position query, then angles and cusps for the place.
 *
 * <p>Sidereal charts have the ayanamsa removed from bodies, cusps and angles alike.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChartBuilder {

    private static final List<Body> ALL_BODIES = Arrays.asList(Body.values());

    private final EphemerisGateway gateway;
    private final HouseCalculator houseCalculator;
    private final AstrolabeProperties properties;

    public ChartOptions defaultOptions() {
        final var chart = properties.chart();
        return new ChartOptions(chart.houseSystem(), chart.zodiac(), chart.ayanamsa());
    }

    /**
     * Natal chart: positions at the birth instant.
     */
    public Chart build(final Subject subject, final HouseSystem houseSystem) {
        return build(subject, subject.julianDayUt(), houseSystem);
    }

    public Chart build(final Subject subject, final double julianDayUt, final HouseSystem houseSystem) {
        return build(subject, julianDayUt, defaultOptions().withHouseSystem(houseSystem));
    }

    public Chart build(final Subject subject, final double julianDayUt, final ChartOptions options) {
        return build(subject, julianDayUt, subject.location(), options);
    }

    /**
     * Chart for an arbitrary instant and place; the subject is carried along for identification.
     */
    public Chart build(final Subject subject, final double julianDayUt, final GeoLocation location,
                       final ChartOptions options) {
        final var sidereal = options.zodiac() == ZodiacType.SIDEREAL;
        final var ayanamsaValue = sidereal ? options.ayanamsa().valueAt(julianDayUt) : 0.0;

        final var positions = gateway.getPositions(ALL_BODIES, julianDayUt).stream()
                .map(p -> sidereal ? p.withLongitude(p.longitude() - ayanamsaValue) : p)
                .toList();

        final var obliquity = Nutation.trueObliquity(TimeScales.toTerrestrial(julianDayUt));
        final var ramc = SiderealTime.localApparent(julianDayUt, location.longitude());
        final var houses = houseCalculator.calculate(options.houseSystem(), ramc, location.latitude(),
                obliquity, ayanamsaValue);

        log.debug("Chart cast for JD {} at ({}, {}): {} {}", julianDayUt, location.latitude(),
                location.longitude(), options.zodiac(), options.houseSystem());
        return new Chart(subject, julianDayUt, location, options.houseSystem(), options.zodiac(),
                sidereal ? options.ayanamsa() : null, ayanamsaValue, positions,
                houses.cusps(), houses.ascendant(), houses.midheaven());
    }
}
