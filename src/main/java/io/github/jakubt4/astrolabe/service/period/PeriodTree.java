package io.github.jakubt4.astrolabe.service.period;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Nakshatra;

/**
 * Vimshottari periods of a subject.
 *
 * @param moonLongitude   sidereal longitude of the Moon at birth
 * @param elapsedFraction share of the birth nakshatra the Moon had already crossed
 * @param balanceYears    years of the first major period left at birth
 */
public record PeriodTree(Period root, double moonLongitude, Nakshatra nakshatra, Body startingLord,
                         double elapsedFraction, double balanceYears, int depth) {
}
