package io.github.jakubt4.astrolabe.service.dosha;

import io.github.jakubt4.astrolabe.model.ZodiacSign;

/**
 * One continuous stay of Saturn in a sign of the Sade Sati window.
 */
public record SadeSatiPhase(Phase phase, ZodiacSign sign, double startJd, double endJd) {

    public enum Phase {
        RISING, PEAK, SETTING
    }

    public boolean contains(final double julianDay) {
        return julianDay >= startJd && julianDay < endJd;
    }
}
