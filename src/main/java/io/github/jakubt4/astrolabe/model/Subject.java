package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.util.JulianDay;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HexFormat;
import java.util.Locale;

/**
 * A resolved birth: the UTC instant, the place and the offset the local time was given in.
 *
 * <p>Instances are immutable. {@code fingerprint} is a SHA-256 digest of the canonical
 * birth data and identifies the subject in cache keys.
 */
public record Subject(String name, Instant birthInstant, GeoLocation location, ZoneOffset utcOffset,
                      double julianDayUt, String fingerprint) {

    public static Subject of(final String name, final Instant birthInstant, final GeoLocation location,
                             final ZoneOffset utcOffset) {
        final var canonical = String.format(Locale.ROOT, "%s|%.6f|%.6f|%.1f|%s",
                birthInstant, location.latitude(), location.longitude(), location.elevation(), utcOffset.getId());
        return new Subject(name, birthInstant, location, utcOffset,
                JulianDay.fromInstant(birthInstant), sha256(canonical));
    }

    public static Subject of(final Instant birthInstant, final GeoLocation location) {
        return of(null, birthInstant, location, ZoneOffset.UTC);
    }

    private static String sha256(final String value) {
        try {
            final var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
