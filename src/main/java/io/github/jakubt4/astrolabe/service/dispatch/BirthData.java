package io.github.jakubt4.astrolabe.service.dispatch;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Birth data as supplied by a caller, before resolution.
 *
 * @param timeZone zone id or offset ({@code Europe/Prague}, {@code +05:30}); when absent the
 *                 geocoded zone is used, then UTC
 * @param place    free-text place, used only when coordinates are missing
 */
public record BirthData(String name, LocalDate date, LocalTime time, Double latitude, Double longitude,
                        String place, String timeZone) {

    public static final String DATE = "date";
    public static final String TIME = "time";
    public static final String LOCATION = "location";

    public static BirthData at(final LocalDate date, final LocalTime time, final double latitude,
                               final double longitude, final String timeZone) {
        return new BirthData(null, date, time, latitude, longitude, null, timeZone);
    }

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

    public boolean hasPlace() {
        return place != null && !place.isBlank();
    }

    /**
     * The subset of {@code required} this record does not supply.
     */
    public List<String> missingFields(final List<String> required) {
        final var missing = new ArrayList<String>();
        for (final var field : required) {
            final var absent = switch (field) {
                case DATE -> date == null;
                case TIME -> time == null;
                case LOCATION -> !hasCoordinates() && !hasPlace();
                default -> false;
            };
            if (absent) {
                missing.add(field);
            }
        }
        return missing;
    }
}
