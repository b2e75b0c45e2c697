package io.github.jakubt4.astrolabe.service.dosha;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Nakshatra;

/**
 * Lunar mansion occupied by a chart point.
 */
public record NakshatraPlacement(String point, double longitude, Nakshatra nakshatra, int pada, Body lord) {

    public static NakshatraPlacement of(final String point, final double siderealLongitude) {
        final var nakshatra = Nakshatra.ofLongitude(siderealLongitude);
        return new NakshatraPlacement(point, siderealLongitude, nakshatra, Nakshatra.pada(siderealLongitude),
                nakshatra.lord());
    }
}
