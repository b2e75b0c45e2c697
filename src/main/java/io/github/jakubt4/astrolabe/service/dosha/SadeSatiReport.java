package io.github.jakubt4.astrolabe.service.dosha;

import io.github.jakubt4.astrolabe.model.ZodiacSign;

import java.util.List;

/**
 * Saturn's passages over the 12th, 1st and 2nd signs from the natal Moon inside a window.
 *
 * @param current phase containing {@code asOfJd}, or {@code null}
 */
public record SadeSatiReport(ZodiacSign moonSign, double asOfJd, boolean active, SadeSatiPhase current,
                             List<SadeSatiPhase> phases) {

    public SadeSatiReport {
        phases = List.copyOf(phases);
    }
}
