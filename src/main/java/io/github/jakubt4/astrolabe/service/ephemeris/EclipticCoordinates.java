package io.github.jakubt4.astrolabe.service.ephemeris;

/**
 * Apparent geocentric ecliptic coordinates referred to the true equinox of date.
 *
 * @param longitude degrees
 * @param latitude  degrees
 * @param distance  astronomical units
 */
public record EclipticCoordinates(double longitude, double latitude, double distance) {
}
