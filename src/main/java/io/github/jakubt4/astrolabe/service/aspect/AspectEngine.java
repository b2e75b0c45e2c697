package io.github.jakubt4.astrolabe.service.aspect;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.ChartPoint;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.util.Angles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.util.FastMath;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds aspects between chart points and the patterns they form.
 *
 * <p>Pairs are always reported in canonical order (bodies by enum order, then ASC, then MC),
 * so the result does not depend on the order the points were supplied in.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AspectEngine {

    private static final double APPLYING_STEP_DAYS = 0.01;

    private final AstrolabeProperties properties;

    public List<Aspect> findAspects(final Chart chart) {
        return findAspects(chart.points(), properties.aspects().orbTable());
    }

    public List<Aspect> findAspects(final List<ChartPoint> points, final OrbTable orbTable) {
        final var sorted = new ArrayList<>(points);
        sorted.sort(Comparator.comparingInt(ChartPoint::rank).thenComparing(ChartPoint::id));

        final var aspects = new ArrayList<Aspect>();
        for (var i = 0; i < sorted.size(); i++) {
            for (var j = i + 1; j < sorted.size(); j++) {
                match(sorted.get(i), sorted.get(j), orbTable).ifPresent(aspects::add);
            }
        }
        log.debug("Found {} aspects among {} points", aspects.size(), sorted.size());
        return aspects;
    }

    /**
     * Aspects from every row point to every column point, rows first in each pair.
     */
    public List<Aspect> crossAspects(final List<ChartPoint> rows, final List<ChartPoint> columns,
                                     final OrbTable orbTable) {
        final var aspects = new ArrayList<Aspect>();
        for (final var row : rows) {
            for (final var column : columns) {
                match(row, column, orbTable).ifPresent(aspects::add);
            }
        }
        return aspects;
    }

    /**
     * Best-fitting aspect between two points, if any lies within its allowed orb.
     */
    public Optional<Aspect> match(final ChartPoint first, final ChartPoint second, final OrbTable orbTable) {
        final var separation = Angles.separation(first.longitude(), second.longitude());
        Aspect best = null;
        for (final var type : orbTable.enabled()) {
            final var orb = FastMath.abs(separation - type.angle());
            final var allowed = orbTable.allowedOrb(type, first.id(), second.id());
            if (orb <= allowed && (best == null || orb < best.orb())) {
                final var exactness = allowed == 0 ? 1.0 : 1.0 - orb / allowed;
                best = new Aspect(first.id(), second.id(), type, separation, orb, allowed, exactness,
                        applying(first, second, type, orb));
            }
        }
        return Optional.ofNullable(best);
    }

    public List<AspectPattern> findPatterns(final Chart chart) {
        return findPatterns(chart.points(), findAspects(chart));
    }

    public List<AspectPattern> findPatterns(final List<ChartPoint> points, final List<Aspect> aspects) {
        final var byId = new HashMap<String, ChartPoint>();
        points.forEach(p -> byId.put(p.id(), p));
        final var ids = points.stream()
                .sorted(Comparator.comparingInt(ChartPoint::rank).thenComparing(ChartPoint::id))
                .map(ChartPoint::id)
                .toList();
        final var index = new HashMap<String, AspectType>();
        aspects.forEach(a -> {
            index.put(a.first() + "|" + a.second(), a.type());
            index.put(a.second() + "|" + a.first(), a.type());
        });

        final var patterns = new ArrayList<AspectPattern>();
        final var n = ids.size();
        for (var i = 0; i < n; i++) {
            for (var j = i + 1; j < n; j++) {
                final var a = ids.get(i);
                final var b = ids.get(j);
                final var ab = index.get(a + "|" + b);
                if (ab == null) {
                    continue;
                }
                for (var k = 0; k < n; k++) {
                    if (k == i || k == j) {
                        continue;
                    }
                    final var c = ids.get(k);
                    final var ac = index.get(a + "|" + c);
                    final var bc = index.get(b + "|" + c);
                    if (ab == AspectType.TRINE && k > j && ac == AspectType.TRINE && bc == AspectType.TRINE
                            && sameElement(byId.get(a), byId.get(b), byId.get(c))) {
                        patterns.add(new AspectPattern(PatternType.GRAND_TRINE, List.of(a, b, c)));
                    }
                    if (ab == AspectType.OPPOSITION && ac == AspectType.SQUARE && bc == AspectType.SQUARE) {
                        patterns.add(new AspectPattern(PatternType.T_SQUARE, List.of(a, b, c)));
                    }
                    if (ab == AspectType.SEXTILE && ac == AspectType.QUINCUNX && bc == AspectType.QUINCUNX) {
                        patterns.add(new AspectPattern(PatternType.YOD, List.of(a, b, c)));
                    }
                }
            }
        }
        patterns.addAll(grandCrosses(ids, index));
        patterns.addAll(stelliums(points));
        log.debug("Found {} aspect patterns", patterns.size());
        return patterns;
    }

    private List<AspectPattern> grandCrosses(final List<String> ids, final Map<String, AspectType> index) {
        final var result = new ArrayList<AspectPattern>();
        final var n = ids.size();
        for (var a = 0; a < n; a++) {
            for (var b = a + 1; b < n; b++) {
                if (index.get(ids.get(a) + "|" + ids.get(b)) != AspectType.OPPOSITION) {
                    continue;
                }
                for (var c = a + 1; c < n; c++) {
                    for (var d = c + 1; d < n; d++) {
                        if (c == b || d == b) {
                            continue;
                        }
                        final var pa = ids.get(a);
                        final var pb = ids.get(b);
                        final var pc = ids.get(c);
                        final var pd = ids.get(d);
                        if (index.get(pc + "|" + pd) == AspectType.OPPOSITION
                                && index.get(pa + "|" + pc) == AspectType.SQUARE
                                && index.get(pa + "|" + pd) == AspectType.SQUARE
                                && index.get(pb + "|" + pc) == AspectType.SQUARE
                                && index.get(pb + "|" + pd) == AspectType.SQUARE) {
                            result.add(new AspectPattern(PatternType.GRAND_CROSS, List.of(pa, pb, pc, pd)));
                        }
                    }
                }
            }
        }
        return result;
    }

    /**
     * Maximal groups of at least N bodies inside the configured arc. Angles do not count.
     */
    private List<AspectPattern> stelliums(final List<ChartPoint> points) {
        final var minBodies = properties.aspects().stelliumMinBodies();
        final var arc = properties.aspects().stelliumArc();
        final var bodies = points.stream()
                .filter(p -> p.body() != null)
                .sorted(Comparator.comparingDouble(ChartPoint::longitude))
                .toList();

        final var groups = new ArrayList<Set<String>>();
        for (final var start : bodies) {
            final var group = new LinkedHashSet<String>();
            bodies.stream()
                    .filter(p -> Angles.normalize(p.longitude() - start.longitude()) <= arc)
                    .sorted(Comparator.comparingInt(ChartPoint::rank))
                    .forEach(p -> group.add(p.id()));
            if (group.size() >= minBodies && groups.stream().noneMatch(g -> g.containsAll(group))) {
                groups.removeIf(group::containsAll);
                groups.add(group);
            }
        }
        return groups.stream()
                .map(g -> new AspectPattern(PatternType.STELLIUM, List.copyOf(g)))
                .toList();
    }

    private static boolean sameElement(final ChartPoint a, final ChartPoint b, final ChartPoint c) {
        final var element = ZodiacSign.ofLongitude(a.longitude()).element();
        return ZodiacSign.ofLongitude(b.longitude()).element() == element
                && ZodiacSign.ofLongitude(c.longitude()).element() == element;
    }

    private static Boolean applying(final ChartPoint first, final ChartPoint second, final AspectType type,
                                    final double orb) {
        if (first.dailyMotion() == null || second.dailyMotion() == null) {
            return null;
        }
        final var later = Angles.separation(
                first.longitude() + first.dailyMotion() * APPLYING_STEP_DAYS,
                second.longitude() + second.dailyMotion() * APPLYING_STEP_DAYS);
        return FastMath.abs(later - type.angle()) < orb;
    }
}
