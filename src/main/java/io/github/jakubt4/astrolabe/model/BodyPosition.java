package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.util.Angles;

/**
 * Apparent geocentric ecliptic position of a body.
 *
 * @param longitude   degrees in [0, 360)
 * @param latitude    degrees
 * @param distance    astronomical units
 * @param dailyMotion degrees per day, negative while retrograde
 */
public record BodyPosition(Body body, double longitude, double latitude, double distance,
                           double dailyMotion, boolean retrograde) {

    public static BodyPosition of(final Body body, final double longitude, final double latitude,
                                  final double distance, final double dailyMotion) {
        return new BodyPosition(body, Angles.normalize(longitude), latitude, distance, dailyMotion, dailyMotion < 0);
    }

    public BodyPosition withLongitude(final double newLongitude) {
        return new BodyPosition(body, Angles.normalize(newLongitude), latitude, distance, dailyMotion, retrograde);
    }

    public ZodiacSign sign() {
        return ZodiacSign.ofLongitude(longitude);
    }
}
