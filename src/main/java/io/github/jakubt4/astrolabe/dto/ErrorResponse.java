package io.github.jakubt4.astrolabe.dto;

import java.util.List;

/**
 * Error body returned by the analysis endpoint.
 *
 * @param code          stable machine-readable error kind, e.g. {@code INPUT_VALIDATION}
 * @param missingFields fields the request lacked; empty for other errors
 */
public record ErrorResponse(String analysisId, String code, String message, List<String> missingFields) {

    public static ErrorResponse of(final String analysisId, final String code, final String message) {
        return new ErrorResponse(analysisId, code, message, List.of());
    }
}
