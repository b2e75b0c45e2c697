package io.github.jakubt4.astrolabe.service.dispatch;

import java.time.LocalDate;
import java.util.List;

/**
 * @param payload   structured result of the pipeline
 * @param narrative short plain-text findings, in pipeline order
 */
public record AnalysisResult(String analysisId, Pipeline pipeline, String subjectFingerprint, LocalDate asOf,
                             Object payload, List<String> narrative) {

    public AnalysisResult {
        narrative = narrative == null ? List.of() : List.copyOf(narrative);
    }
}
