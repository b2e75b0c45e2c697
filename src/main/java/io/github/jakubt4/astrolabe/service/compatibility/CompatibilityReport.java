package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.model.Chart;

import java.util.Map;

/**
 * @param score   0-100, higher is more harmonious; 100 for a chart compared with itself
 * @param tension 0-100 from the exactness of hard cross aspects
 */
public record CompatibilityReport(CrossAspectMatrix matrix, CompositeChart composite, Chart davison,
                                  Map<HarmonyFactor, Double> factors, double score, double tension) {
}
