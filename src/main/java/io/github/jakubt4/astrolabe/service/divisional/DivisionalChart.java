package io.github.jakubt4.astrolabe.service.divisional;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.BodyPosition;
import io.github.jakubt4.astrolabe.model.ZodiacSign;

import java.util.List;

/**
 * A chart projected through a {@link Varga}. Houses are whole signs counted from the
 * divisional ascendant.
 */
public record DivisionalChart(int factor, String name, List<BodyPosition> positions, double ascendant,
                              List<Double> cusps) {

    public DivisionalChart {
        positions = List.copyOf(positions);
        cusps = List.copyOf(cusps);
    }

    public BodyPosition position(final Body body) {
        return positions.stream()
                .filter(p -> p.body() == body)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Body not in chart: " + body));
    }

    public int houseOf(final Body body) {
        return ZodiacSign.houseDistance(ZodiacSign.ofLongitude(ascendant), position(body).sign());
    }
}
