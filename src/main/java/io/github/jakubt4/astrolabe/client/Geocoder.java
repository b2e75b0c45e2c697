package io.github.jakubt4.astrolabe.client;

import java.util.Optional;

/**
 * Resolves a free-text place name to coordinates and a time zone.
 *
 * <p>No implementation ships with the engine; deployments register one as a bean. Without it,
 * requests must carry coordinates.
 */
public interface Geocoder {

    /**
     * @return the best match, or empty when the place is unknown
     */
    Optional<GeocodedPlace> geocode(String place);
}
