package io.github.jakubt4.astrolabe.service.predictive;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;

/**
 * Chart cast for the moment a body comes back to its natal longitude.
 *
 * @param residual |longitude - natal longitude| at the returned instant, degrees
 */
public record ReturnChart(Body body, double natalLongitude, double julianDay, int iterations, double residual,
                          Chart chart) {
}
