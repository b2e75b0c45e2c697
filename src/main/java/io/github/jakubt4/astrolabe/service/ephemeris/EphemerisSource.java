package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.model.Body;

import java.util.Map;
import java.util.Set;

/**
 * Port to whatever produces body positions.
 *
 * <p>Implementations return apparent geocentric ecliptic coordinates of date for every
 * requested body in one call and signal failures with
 * {@link io.github.jakubt4.astrolabe.error.EphemerisUnavailableException}.
 */
public interface EphemerisSource {

    Map<Body, EclipticCoordinates> positions(Set<Body> bodies, double julianDayTt);

    String name();
}
