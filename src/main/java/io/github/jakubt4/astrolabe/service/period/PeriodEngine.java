package io.github.jakubt4.astrolabe.service.period;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.error.OutOfRangeInstantException;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.Nakshatra;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.ephemeris.EphemerisGateway;
import io.github.jakubt4.astrolabe.util.Angles;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds and queries the Vimshottari period tree.
 *
 * <p>The cycle starts from the lord of the Moon's birth nakshatra, back-dated by the part of
 * that lord's period already elapsed. Each level divides its parent in the proportions of the
 * nine-lord table, starting from the parent's own lord.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PeriodEngine {

    public static final double CYCLE_YEARS = 120.0;
    public static final int MIN_DEPTH = 3;
    public static final int MAX_DEPTH = 5;

    private static final Body[] SEQUENCE = {
            Body.KETU, Body.VENUS, Body.SUN, Body.MOON, Body.MARS,
            Body.RAHU, Body.JUPITER, Body.SATURN, Body.MERCURY
    };
    private static final Map<Body, Double> YEARS = new EnumMap<>(Body.class);

    static {
        YEARS.put(Body.KETU, 7.0);
        YEARS.put(Body.VENUS, 20.0);
        YEARS.put(Body.SUN, 6.0);
        YEARS.put(Body.MOON, 10.0);
        YEARS.put(Body.MARS, 7.0);
        YEARS.put(Body.RAHU, 18.0);
        YEARS.put(Body.JUPITER, 16.0);
        YEARS.put(Body.SATURN, 19.0);
        YEARS.put(Body.MERCURY, 17.0);
    }

    private final EphemerisGateway gateway;
    private final AstrolabeProperties properties;

    public static double years(final Body lord) {
        final var years = YEARS.get(lord);
        if (years == null) {
            throw new IllegalArgumentException("Not a Vimshottari lord: " + lord);
        }
        return years;
    }

    public PeriodTree buildTree(final Subject subject) {
        return buildTree(subject, properties.periods().depth());
    }

    public PeriodTree buildTree(final Subject subject, final int depth) {
        final var jd = subject.julianDayUt();
        final var tropicalMoon = gateway.getLongitude(Body.MOON, jd);
        final var siderealMoon = Angles.normalize(tropicalMoon - properties.chart().ayanamsa().valueAt(jd));
        return buildTree(jd, siderealMoon, depth);
    }

    /**
     * Tree from an already cast chart, reusing its Moon.
     */
    public PeriodTree buildTree(final Chart natal) {
        final var moon = natal.position(Body.MOON).longitude();
        final var sidereal = natal.zodiac() == ZodiacType.SIDEREAL
                ? moon
                : Angles.normalize(moon - properties.chart().ayanamsa().valueAt(natal.julianDay()));
        return buildTree(natal.julianDay(), sidereal, properties.periods().depth());
    }

    public PeriodTree buildTree(final double birthJd, final double siderealMoon, final int depth) {
        if (depth < MIN_DEPTH || depth > MAX_DEPTH) {
            throw new IllegalArgumentException("Period depth must be between " + MIN_DEPTH + " and " + MAX_DEPTH
                    + ", got: " + depth);
        }
        final var nakshatra = Nakshatra.ofLongitude(siderealMoon);
        final var elapsed = Nakshatra.elapsedFraction(siderealMoon);
        final var lord = nakshatra.lord();
        final var start = birthJd - elapsed * years(lord) * JulianDay.DAYS_PER_YEAR;
        final var end = start + CYCLE_YEARS * JulianDay.DAYS_PER_YEAR;

        final var root = new Period(0, null, null, start, end, subdivide(lord, null, start, end, 1, depth));
        final var balance = (1.0 - elapsed) * years(lord);
        log.debug("Vimshottari tree: {} ({}), elapsed {}, balance {} years", nakshatra, lord, elapsed, balance);
        return new PeriodTree(root, siderealMoon, nakshatra, lord, elapsed, balance, depth);
    }

    /**
     * Path of periods containing the instant, from the major period down to the deepest level.
     *
     * @throws OutOfRangeInstantException if the instant lies outside the 120-year cycle
     */
    public List<Period> query(final PeriodTree tree, final double julianDay) {
        final var root = tree.root();
        if (!root.contains(julianDay)) {
            throw new OutOfRangeInstantException(String.format(Locale.ROOT,
                    "JD %.5f is outside the period cycle [%.5f, %.5f)", julianDay, root.startJd(), root.endJd()));
        }
        final var path = new ArrayList<Period>(tree.depth());
        var node = root;
        while (!node.children().isEmpty()) {
            final var current = node;
            node = current.children().stream()
                    .filter(child -> child.contains(julianDay))
                    .findFirst()
                    .orElse(current.children().get(current.children().size() - 1));
            path.add(node);
        }
        return path;
    }

    /**
     * The next {@code count} periods at {@code level} starting after the instant.
     */
    public List<Period> upcoming(final PeriodTree tree, final double julianDay, final int level, final int count) {
        if (level < 1 || level > tree.depth()) {
            throw new IllegalArgumentException("Level must be between 1 and " + tree.depth() + ", got: " + level);
        }
        final var atLevel = new ArrayList<Period>();
        collect(tree.root(), level, atLevel);
        return atLevel.stream()
                .filter(p -> p.startJd() > julianDay)
                .limit(count)
                .toList();
    }

    private static void collect(final Period node, final int level, final List<Period> out) {
        if (node.level() == level) {
            out.add(node);
            return;
        }
        node.children().forEach(child -> collect(child, level, out));
    }

    private static List<Period> subdivide(final Body firstLord, final Body parentLord, final double start,
                                          final double end, final int level, final int depth) {
        if (level > depth) {
            return List.of();
        }
        final var span = end - start;
        final var children = new ArrayList<Period>(SEQUENCE.length);
        final var offset = indexOf(firstLord);
        var cursor = start;
        for (var i = 0; i < SEQUENCE.length; i++) {
            final var lord = SEQUENCE[(offset + i) % SEQUENCE.length];
            final var last = i == SEQUENCE.length - 1;
            final var childEnd = last ? end : cursor + span * years(lord) / CYCLE_YEARS;
            children.add(new Period(level, lord, parentLord, cursor, childEnd,
                    subdivide(lord, lord, cursor, childEnd, level + 1, depth)));
            cursor = childEnd;
        }
        return children;
    }

    private static int indexOf(final Body lord) {
        for (var i = 0; i < SEQUENCE.length; i++) {
            if (SEQUENCE[i] == lord) {
                return i;
            }
        }
        throw new IllegalArgumentException("Not a Vimshottari lord: " + lord);
    }
}
