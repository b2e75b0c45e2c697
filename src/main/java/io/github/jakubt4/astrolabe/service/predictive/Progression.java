package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.service.aspect.Aspect;

import java.util.List;

/**
 * A progressed or directed chart and its aspects to the natal chart (progressed point first).
 *
 * @param ageYears age at the target date in 365.25-day years
 * @param arc      degrees every point was moved by; for secondary progressions the Sun's arc
 */
public record Progression(ProgressionTechnique technique, double targetJd, double ageYears, double arc,
                          Chart chart, List<Aspect> aspectsToNatal) {

    public Progression {
        aspectsToNatal = List.copyOf(aspectsToNatal);
    }
}
