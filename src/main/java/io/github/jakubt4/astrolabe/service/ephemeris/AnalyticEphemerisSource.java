package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.util.Angles;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Self-contained ephemeris built from published series: Meeus for the Sun and Moon,
 * Standish elements for the planets, the mean node for Rahu and Ketu.
 *
 * <p>Needs no data files, which makes it the default source.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "astrolabe.ephemeris", name = "source", havingValue = "analytic", matchIfMissing = true)
public class AnalyticEphemerisSource implements EphemerisSource {

    @Override
    public Map<Body, EclipticCoordinates> positions(final Set<Body> bodies, final double julianDayTt) {
        final var nutation = Nutation.deltaPsi(julianDayTt);
        final var result = new EnumMap<Body, EclipticCoordinates>(Body.class);
        for (final var body : bodies) {
            result.put(body, apparent(body, julianDayTt, nutation));
        }
        log.debug("Analytic positions computed for {} bodies at JD(TT) {}", result.size(), julianDayTt);
        return result;
    }

    @Override
    public String name() {
        return "analytic";
    }

    private static EclipticCoordinates apparent(final Body body, final double julianDayTt, final double nutation) {
        switch (body) {
            case SUN -> {
                final var sun = SolarTheory.meanOfDate(julianDayTt);
                return shifted(sun, nutation + SolarTheory.aberration(sun.distance()));
            }
            case MOON -> {
                return shifted(LunarTheory.meanOfDate(julianDayTt), nutation);
            }
            case RAHU -> {
                return new EclipticCoordinates(Angles.normalize(LunarNode.meanAscending(julianDayTt) + nutation), 0.0, 0.0);
            }
            case KETU -> {
                return new EclipticCoordinates(
                        Angles.normalize(LunarNode.meanAscending(julianDayTt) + 180.0 + nutation), 0.0, 0.0);
            }
            default -> {
                return shifted(PlanetaryTheory.meanOfDate(body, julianDayTt), nutation);
            }
        }
    }

    private static EclipticCoordinates shifted(final EclipticCoordinates coordinates, final double delta) {
        return new EclipticCoordinates(Angles.normalize(coordinates.longitude() + delta),
                coordinates.latitude(), coordinates.distance());
    }
}
