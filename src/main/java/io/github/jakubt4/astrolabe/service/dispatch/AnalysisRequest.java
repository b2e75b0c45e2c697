package io.github.jakubt4.astrolabe.service.dispatch;

import java.time.LocalDate;
import java.util.Map;

/**
 * @param secondary second birth, for relationship analyses
 * @param asOf      reference date for dated analyses; today when {@code null}
 */
public record AnalysisRequest(String analysisId, BirthData primary, BirthData secondary, LocalDate asOf,
                              Map<String, String> params) {

    public AnalysisRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }

    public static AnalysisRequest of(final String analysisId, final BirthData primary) {
        return new AnalysisRequest(analysisId, primary, null, null, Map.of());
    }
}
