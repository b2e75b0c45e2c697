package io.github.jakubt4.astrolabe.service.dispatch;

import io.github.jakubt4.astrolabe.client.GeocodedPlace;
import io.github.jakubt4.astrolabe.client.Geocoder;
import io.github.jakubt4.astrolabe.error.GeocodingUnresolvedException;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import io.github.jakubt4.astrolabe.model.Subject;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Turns caller-supplied birth data into a {@link Subject}.
 *
 * <p>Coordinates win over the place name; the place goes through the {@link Geocoder} bean when
 * one is registered. A local time that falls into a daylight-saving gap is shifted forward.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SubjectResolver {

    private final ObjectProvider<Geocoder> geocoder;

    public Subject resolve(final BirthData data) {
        final var missing = data.missingFields(List.of(BirthData.DATE, BirthData.TIME, BirthData.LOCATION));
        if (!missing.isEmpty()) {
            throw InputValidationException.missing(missing);
        }

        GeocodedPlace geocoded = null;
        final GeoLocation location;
        if (data.hasCoordinates()) {
            location = toLocation(data.latitude(), data.longitude());
        } else {
            geocoded = geocode(data.place());
            location = geocoded.location();
        }

        final var zone = zoneOf(data, geocoded);
        final var instant = LocalDateTime.of(data.date(), data.time()).atZone(zone).toInstant();
        final var offset = zone.getRules().getOffset(instant);
        log.debug("Resolved birth [{}] to {} at ({}, {}) offset {}", data.name(), instant,
                location.latitude(), location.longitude(), offset);
        return Subject.of(data.name(), instant, location, offset);
    }

    private GeocodedPlace geocode(final String place) {
        final var service = geocoder.getIfAvailable();
        if (service == null) {
            log.warn("No geocoder configured, cannot resolve place [{}]", place);
            throw new GeocodingUnresolvedException(place);
        }
        return service.geocode(place).orElseThrow(() -> {
            log.warn("Geocoder found no match for [{}]", place);
            return new GeocodingUnresolvedException(place);
        });
    }

    private static ZoneId zoneOf(final BirthData data, final GeocodedPlace geocoded) {
        if (data.timeZone() != null && !data.timeZone().isBlank()) {
            try {
                return ZoneId.of(data.timeZone().trim());
            } catch (final DateTimeException e) {
                throw new InputValidationException("Unknown time zone [" + data.timeZone() + "]");
            }
        }
        if (geocoded != null && geocoded.zone() != null) {
            return geocoded.zone();
        }
        return ZoneOffset.UTC;
    }

    private static GeoLocation toLocation(final double latitude, final double longitude) {
        try {
            return GeoLocation.of(latitude, longitude);
        } catch (final IllegalArgumentException e) {
            throw new InputValidationException(e.getMessage());
        }
    }
}
