package io.github.jakubt4.astrolabe.service.dispatch;

import io.github.jakubt4.astrolabe.client.GeocodedPlace;
import io.github.jakubt4.astrolabe.client.Geocoder;
import io.github.jakubt4.astrolabe.error.GeocodingUnresolvedException;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.model.GeoLocation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SubjectResolverTest {

    private static final LocalDate DATE = LocalDate.of(1990, 6, 15);
    private static final LocalTime NOON = LocalTime.NOON;

    private Geocoder geocoder;
    private ObjectProvider<Geocoder> provider;
    private SubjectResolver resolver;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        geocoder = mock(Geocoder.class);
        provider = mock(ObjectProvider.class);
        when(provider.getIfAvailable()).thenReturn(geocoder);
        resolver = new SubjectResolver(provider);
    }

    @Test
    void coordinatesAndZoneIdResolveToUtcInstant() {
        final var subject = resolver.resolve(BirthData.at(DATE, NOON, 50.0755, 14.4378, "Europe/Prague"));

        assertThat(subject.birthInstant()).isEqualTo(Instant.parse("1990-06-15T10:00:00Z"));
        assertThat(subject.utcOffset()).isEqualTo(ZoneOffset.ofHours(2));
        assertThat(subject.location().latitude()).isEqualTo(50.0755);
        verifyNoInteractions(geocoder);
    }

    @Test
    void missingZoneDefaultsToUtc() {
        final var subject = resolver.resolve(BirthData.at(DATE, NOON, 51.5, -0.12, null));

        assertThat(subject.birthInstant()).isEqualTo(Instant.parse("1990-06-15T12:00:00Z"));
        assertThat(subject.utcOffset()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void placeIsGeocodedWhenCoordinatesAreMissing() {
        when(geocoder.geocode("New Delhi")).thenReturn(Optional.of(new GeocodedPlace("New Delhi, India",
                GeoLocation.of(28.6139, 77.2090), ZoneId.of("Asia/Kolkata"))));

        final var subject = resolver.resolve(new BirthData("a", DATE, NOON, null, null, "New Delhi", null));

        assertThat(subject.location().longitude()).isEqualTo(77.2090);
        assertThat(subject.utcOffset()).isEqualTo(ZoneOffset.ofHoursMinutes(5, 30));
        assertThat(subject.birthInstant()).isEqualTo(Instant.parse("1990-06-15T06:30:00Z"));
    }

    @Test
    void explicitZoneOverridesGeocodedZone() {
        when(geocoder.geocode("New Delhi")).thenReturn(Optional.of(new GeocodedPlace("New Delhi, India",
                GeoLocation.of(28.6139, 77.2090), ZoneId.of("Asia/Kolkata"))));

        final var subject = resolver.resolve(new BirthData("a", DATE, NOON, null, null, "New Delhi", "UTC"));

        assertThat(subject.birthInstant()).isEqualTo(Instant.parse("1990-06-15T12:00:00Z"));
    }

    @Test
    void unknownPlaceIsUnresolved() {
        when(geocoder.geocode(anyString())).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.resolve(new BirthData("a", DATE, NOON, null, null, "Atlantis", null)))
                .isInstanceOf(GeocodingUnresolvedException.class)
                .hasMessageContaining("Atlantis");
    }

    @Test
    void placeWithoutGeocoderIsUnresolved() {
        when(provider.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> resolver.resolve(new BirthData("a", DATE, NOON, null, null, "Prague", null)))
                .isInstanceOf(GeocodingUnresolvedException.class);
    }

    @Test
    void missingFieldsAreListed() {
        assertThatThrownBy(() -> resolver.resolve(new BirthData("a", null, null, null, null, " ", null)))
                .isInstanceOfSatisfying(InputValidationException.class, e -> assertThat(e.getMissingFields())
                        .containsExactly(BirthData.DATE, BirthData.TIME, BirthData.LOCATION));
    }

    @Test
    void invalidLatitudeAndZoneAreInputErrors() {
        assertThatThrownBy(() -> resolver.resolve(BirthData.at(DATE, NOON, 91.0, 0.0, null)))
                .isInstanceOf(InputValidationException.class);
        assertThatThrownBy(() -> resolver.resolve(BirthData.at(DATE, NOON, 10.0, 0.0, "Mars/Olympus")))
                .isInstanceOf(InputValidationException.class)
                .hasMessageContaining("Mars/Olympus");
    }

    @Test
    void sameBirthGivesTheSameFingerprint() {
        final var first = resolver.resolve(BirthData.at(DATE, NOON, 51.5, -0.12, "Europe/London"));
        final var second = resolver.resolve(BirthData.at(DATE, LocalTime.of(11, 0), 51.5, -0.12, "+00:00"));

        assertThat(first.birthInstant()).isEqualTo(second.birthInstant());
        assertThat(first.fingerprint()).isNotEqualTo(second.fingerprint());
        assertThat(resolver.resolve(BirthData.at(DATE, NOON, 51.5, -0.12, "Europe/London")).fingerprint())
                .isEqualTo(first.fingerprint());
    }
}
