package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.service.aspect.AspectType;

import java.util.EnumSet;
import java.util.Set;

/**
 * What a transit scan looks for.
 *
 * @param stepDays sampling step; {@code null} picks 0.25 day when the Moon is scanned, 1 day otherwise
 */
public record TransitScanOptions(Set<Body> bodies, Set<AspectType> aspects, boolean ingresses,
                                 boolean aspectEvents, boolean stations, Double stepDays) {

    public static final Set<Body> DEFAULT_BODIES = EnumSet.of(Body.SUN, Body.MERCURY, Body.VENUS, Body.MARS,
            Body.JUPITER, Body.SATURN, Body.URANUS, Body.NEPTUNE, Body.PLUTO, Body.RAHU);

    public static final Set<Body> SLOW_BODIES = EnumSet.of(Body.JUPITER, Body.SATURN, Body.URANUS,
            Body.NEPTUNE, Body.PLUTO, Body.RAHU);

    public TransitScanOptions {
        if (bodies == null || bodies.isEmpty()) {
            throw new IllegalArgumentException("A transit scan needs at least one body");
        }
        bodies = EnumSet.copyOf(bodies);
        aspects = aspects == null || aspects.isEmpty() ? EnumSet.noneOf(AspectType.class) : EnumSet.copyOf(aspects);
        if (stepDays != null && stepDays <= 0) {
            throw new IllegalArgumentException("Step must be positive, got: " + stepDays);
        }
    }

    public static TransitScanOptions defaults() {
        return forBodies(DEFAULT_BODIES);
    }

    public static TransitScanOptions forBodies(final Set<Body> bodies) {
        return new TransitScanOptions(bodies, EnumSet.of(AspectType.CONJUNCTION, AspectType.SEXTILE,
                AspectType.SQUARE, AspectType.TRINE, AspectType.OPPOSITION), true, true, true, null);
    }

    public double effectiveStep() {
        if (stepDays != null) {
            return stepDays;
        }
        return bodies.contains(Body.MOON) ? 0.25 : 1.0;
    }
}
