package io.github.jakubt4.astrolabe.service.aspect;

import org.hipparchus.util.FastMath;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Which aspects are matched and how wide their orbs may be.
 *
 * <p>The orb allowed between two points is the aspect's maximum scaled by the smaller of
 * the two point factors. Factors never exceed 1, so the configured maximum is a hard cap.
 */
public final class OrbTable {

    private final Map<AspectType, Double> maxOrbs;
    private final Map<String, Double> pointFactors;
    private final Set<AspectType> enabled;

    public OrbTable(final Map<AspectType, Double> maxOrbs, final Map<String, Double> pointFactors,
                    final Set<AspectType> enabled) {
        final var orbs = new EnumMap<AspectType, Double>(AspectType.class);
        for (final var type : AspectType.values()) {
            final var orb = maxOrbs.getOrDefault(type, type.defaultOrb());
            if (orb < 0 || orb >= 30.0) {
                throw new IllegalArgumentException("Orb for " + type + " must be in [0, 30), got: " + orb);
            }
            orbs.put(type, orb);
        }
        pointFactors.forEach((point, factor) -> {
            if (factor <= 0 || factor > 1.0) {
                throw new IllegalArgumentException("Orb factor for " + point + " must be in (0, 1], got: " + factor);
            }
        });
        this.maxOrbs = Collections.unmodifiableMap(orbs);
        this.pointFactors = Map.copyOf(pointFactors);
        this.enabled = enabled.isEmpty() ? EnumSet.noneOf(AspectType.class) : EnumSet.copyOf(enabled);
    }

    /**
     * Default orbs, factor 1 everywhere; minors optional.
     */
    public static OrbTable standard(final boolean includeMinors) {
        return new OrbTable(Map.of(), Map.of(), enabledSet(includeMinors));
    }

    /**
     * One orb for every listed aspect, as used for progressions and directions.
     */
    public static OrbTable uniform(final double orb, final Set<AspectType> types) {
        final var orbs = new HashMap<AspectType, Double>();
        types.forEach(type -> orbs.put(type, orb));
        return new OrbTable(orbs, Map.of(), types);
    }

    public static Set<AspectType> enabledSet(final boolean includeMinors) {
        final var set = EnumSet.noneOf(AspectType.class);
        for (final var type : AspectType.values()) {
            if (includeMinors || !type.isMinor()) {
                set.add(type);
            }
        }
        return set;
    }

    public Set<AspectType> enabled() {
        return Collections.unmodifiableSet(enabled);
    }

    public double maxOrb(final AspectType type) {
        return maxOrbs.get(type);
    }

    public double allowedOrb(final AspectType type, final String first, final String second) {
        return maxOrbs.get(type) * FastMath.min(factor(first), factor(second));
    }

    private double factor(final String point) {
        return pointFactors.getOrDefault(point, 1.0);
    }
}
