package io.github.jakubt4.astrolabe.dto;

import io.github.jakubt4.astrolabe.service.dispatch.BirthData;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Birth data as posted by a client.
 *
 * @param date     ISO local date, e.g. {@code 1990-06-15}
 * @param time     ISO local time, e.g. {@code 14:30}
 * @param timeZone zone id or offset; optional
 * @param place    used only when {@code latitude}/{@code longitude} are absent
 */
public record BirthDataPayload(String name, LocalDate date, LocalTime time, Double latitude, Double longitude,
                               String place, String timeZone) {

    public BirthData toBirthData() {
        return new BirthData(name, date, time, latitude, longitude, place, timeZone);
    }
}
