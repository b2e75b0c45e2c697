package io.github.jakubt4.astrolabe.error;

/**
 * Wraps an unexpected failure inside an analysis pipeline, keeping the original cause.
 */
public class AnalysisException extends AstrolabeException {

    private final String analysisId;

    public AnalysisException(final String analysisId, final Throwable cause) {
        super("Analysis [" + analysisId + "] failed: " + cause.getMessage(), cause);
        this.analysisId = analysisId;
    }

    public String getAnalysisId() {
        return analysisId;
    }

    @Override
    public String code() {
        return "ANALYSIS_FAILED";
    }
}
