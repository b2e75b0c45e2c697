package io.github.jakubt4.astrolabe.dto;

import io.github.jakubt4.astrolabe.service.dispatch.AnalysisRequest;

import java.time.LocalDate;
import java.util.Map;

/**
 * Inbound body of {@code POST /api/analysis/{analysisId}}.
 *
 * @param secondary second birth for relationship analyses; may be {@code null}
 * @param asOf      reference date; today when {@code null}
 * @param params    analysis parameters overriding the catalog defaults
 */
public record AnalysisRequestBody(BirthDataPayload primary, BirthDataPayload secondary, LocalDate asOf,
                                  Map<String, String> params) {

    public AnalysisRequest toRequest(final String analysisId) {
        return new AnalysisRequest(analysisId,
                primary == null ? null : primary.toBirthData(),
                secondary == null ? null : secondary.toBirthData(),
                asOf, params);
    }
}
