package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.util.Angles;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable chart snapshot.
 *
 * <p>{@code julianDay} is the UT instant the positions were computed for (the birth
 * for natal charts). {@code location} is where the houses were cast. Longitudes, cusps
 * and angles are already expressed in the chart's zodiac; {@code ayanamsaValue} is zero
 * for tropical charts. Cusps are listed from the first house.
 */
public record Chart(Subject subject, double julianDay, GeoLocation location, HouseSystem houseSystem,
                    ZodiacType zodiac, Ayanamsa ayanamsa, double ayanamsaValue,
                    List<BodyPosition> positions, List<Double> cusps, double ascendant, double midheaven) {

    public Chart {
        positions = List.copyOf(positions);
        cusps = List.copyOf(cusps);
        if (cusps.size() != 12) {
            throw new IllegalArgumentException("A chart needs 12 cusps, got " + cusps.size());
        }
    }

    public BodyPosition position(final Body body) {
        return positions.stream()
                .filter(p -> p.body() == body)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Body not in chart: " + body));
    }

    public boolean contains(final Body body) {
        return positions.stream().anyMatch(p -> p.body() == body);
    }

    /**
     * House (1-12) whose cusp span contains the body.
     */
    public int houseOf(final Body body) {
        return houseOfLongitude(position(body).longitude());
    }

    public int houseOfLongitude(final double longitude) {
        for (var i = 0; i < 12; i++) {
            final var start = cusps.get(i);
            final var span = Angles.normalize(cusps.get((i + 1) % 12) - start);
            if (Angles.normalize(longitude - start) < span) {
                return i + 1;
            }
        }
        // only reachable through rounding at a cusp boundary
        return 12;
    }

    /**
     * Bodies followed by the ascendant and midheaven.
     */
    public List<ChartPoint> points() {
        final var points = new ArrayList<ChartPoint>(positions.size() + 2);
        positions.forEach(p -> points.add(ChartPoint.of(p)));
        points.add(ChartPoint.angle(ChartPoint.ASCENDANT, ascendant));
        points.add(ChartPoint.angle(ChartPoint.MIDHEAVEN, midheaven));
        return points;
    }

    public List<ChartPoint> bodyPoints() {
        return positions.stream().map(ChartPoint::of).toList();
    }
}
