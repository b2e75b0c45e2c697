package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.BodyPosition;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ChartPoint;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.service.aspect.Aspect;
import io.github.jakubt4.astrolabe.service.aspect.AspectEngine;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;
import io.github.jakubt4.astrolabe.service.chart.ChartBuilder;
import io.github.jakubt4.astrolabe.service.chart.ChartOptions;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Relationship analysis between two charts: cross aspects, composite and Davison charts,
 * and a weighted harmony score.
 *
 * <p>Every combination step is order independent (sums and sorted products), so
 * {@code compare(a, b)} and {@code compare(b, a)} agree bit for bit apart from the
 * transposed matrix.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CompatibilityEngine {

    private final AspectEngine aspectEngine;
    private final ChartBuilder chartBuilder;
    private final AstrolabeProperties properties;

    public CompatibilityReport compare(final Chart first, final Chart second) {
        final var matrix = crossAspects(first, second);
        final var composite = composite(first, second);
        final var davison = davison(first, second);

        final var factors = new EnumMap<HarmonyFactor, Double>(HarmonyFactor.class);
        var weighted = 0.0;
        var weights = 0.0;
        for (final var factor : HarmonyFactor.values()) {
            final var value = factorValue(matrix, factor);
            factors.put(factor, value);
            weighted += factor.weight() * value;
            weights += factor.weight();
        }
        final var score = 100.0 * weighted / weights;
        final var tension = tension(matrix);
        log.debug("Compatibility score {} (tension {}) from {} cross aspects", score, tension,
                matrix.aspects().size());
        return new CompatibilityReport(matrix, composite, davison, factors, score, tension);
    }

    public CrossAspectMatrix crossAspects(final Chart rows, final Chart columns) {
        final var rowPoints = rows.points();
        final var columnPoints = columns.points();
        final var aspects = aspectEngine.crossAspects(rowPoints, columnPoints, properties.aspects().orbTable());
        return new CrossAspectMatrix(ids(rowPoints), ids(columnPoints), aspects);
    }

    public CompositeChart composite(final Chart first, final Chart second) {
        final var positions = new ArrayList<BodyPosition>();
        for (final var a : first.positions()) {
            if (!second.contains(a.body())) {
                continue;
            }
            final var b = second.position(a.body());
            positions.add(BodyPosition.of(a.body(), Angles.midpoint(a.longitude(), b.longitude()),
                    (a.latitude() + b.latitude()) / 2, (a.distance() + b.distance()) / 2,
                    (a.dailyMotion() + b.dailyMotion()) / 2));
        }
        final var cusps = IntStream.range(0, 12)
                .mapToObj(i -> Angles.midpoint(first.cusps().get(i), second.cusps().get(i)))
                .toList();
        return new CompositeChart(positions, cusps, Angles.midpoint(first.ascendant(), second.ascendant()),
                Angles.midpoint(first.midheaven(), second.midheaven()));
    }

    /**
     * Chart for the midpoint in time and the great-circle midpoint in space.
     */
    public Chart davison(final Chart first, final Chart second) {
        final var jd = (first.julianDay() + second.julianDay()) / 2;
        final var place = sphericalMidpoint(first.location(), second.location());
        final var subject = Subject.of("davison", JulianDay.toInstant(jd), place, ZoneOffset.UTC);
        return chartBuilder.build(subject, jd, place, ChartOptions.of(first));
    }

    static GeoLocation sphericalMidpoint(final GeoLocation a, final GeoLocation b) {
        final var sum = unit(a).add(unit(b));
        final var elevation = (a.elevation() + b.elevation()) / 2;
        if (sum.getNorm() < 1e-12) {
            return new GeoLocation(0.0, Angles.signedDelta(0.0, Angles.midpoint(a.longitude(), b.longitude())),
                    elevation);
        }
        final var latitude = FastMath.toDegrees(FastMath.asin(FastMath.max(-1.0, FastMath.min(1.0,
                sum.getZ() / sum.getNorm()))));
        final var longitude = FastMath.toDegrees(FastMath.atan2(sum.getY(), sum.getX()));
        return new GeoLocation(latitude, FastMath.max(-180.0, FastMath.min(180.0, longitude)), elevation);
    }

    private static Vector3D unit(final GeoLocation location) {
        return new Vector3D(FastMath.toRadians(location.longitude()), FastMath.toRadians(location.latitude()));
    }

    /**
     * 1 - Π(1 - h) over the factor's pairs, h = exactness × aspect weight for harmonious
     * aspects and conjunctions. Products run in sorted order.
     */
    private static double factorValue(final CrossAspectMatrix matrix, final HarmonyFactor factor) {
        final var contributions = new ArrayList<Double>();
        for (final var pair : factor.pairs()) {
            matrix.cell(pair.row().name(), pair.column().name())
                    .filter(a -> a.type().nature() != AspectType.Nature.TENSE)
                    .ifPresent(a -> contributions.add(a.exactness() * harmonyWeight(a.type())));
        }
        return 1.0 - product(contributions);
    }

    private static double tension(final CrossAspectMatrix matrix) {
        final var contributions = new ArrayList<Double>();
        for (final Aspect aspect : matrix.aspects()) {
            if (aspect.type().nature() == AspectType.Nature.TENSE && isClassical(aspect.first())
                    && isClassical(aspect.second())) {
                contributions.add(aspect.exactness() * 0.5);
            }
        }
        return 100.0 * (1.0 - product(contributions));
    }

    private static double product(final List<Double> contributions) {
        contributions.sort(Double::compare);
        var remaining = 1.0;
        for (final var h : contributions) {
            remaining *= 1.0 - FastMath.min(1.0, h);
        }
        return remaining;
    }

    static double harmonyWeight(final AspectType type) {
        return switch (type) {
            case CONJUNCTION, TRINE -> 1.0;
            case SEXTILE -> 0.8;
            default -> 0.3;
        };
    }

    private static boolean isClassical(final String id) {
        for (final var body : Body.values()) {
            if (body.name().equals(id)) {
                return body.isClassical();
            }
        }
        return false;
    }

    private static List<String> ids(final List<ChartPoint> points) {
        return points.stream().map(ChartPoint::id).toList();
    }
}
