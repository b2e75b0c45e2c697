package io.github.jakubt4.astrolabe.model;

/**
 * Geodetic place of an observer.
 *
 * @param latitude  degrees, north positive, within [-90, 90]
 * @param longitude degrees, east positive, within [-180, 180]
 * @param elevation metres above sea level
 */
public record GeoLocation(double latitude, double longitude, double elevation) {

    public GeoLocation {
        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0) {
            throw new IllegalArgumentException("Latitude out of range: " + latitude);
        }
        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0) {
            throw new IllegalArgumentException("Longitude out of range: " + longitude);
        }
    }

    public static GeoLocation of(final double latitude, final double longitude) {
        return new GeoLocation(latitude, longitude, 0.0);
    }
}
