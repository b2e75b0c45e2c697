package io.github.jakubt4.astrolabe.controller;

import io.github.jakubt4.astrolabe.dto.ErrorResponse;
import io.github.jakubt4.astrolabe.error.AnalysisException;
import io.github.jakubt4.astrolabe.error.AstrolabeException;
import io.github.jakubt4.astrolabe.error.EphemerisUnavailableException;
import io.github.jakubt4.astrolabe.error.GeocodingUnresolvedException;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.error.NoConvergenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;

/**
 * Maps the engine's exception taxonomy onto HTTP statuses.
 *
 * <p>400 for bad input (validation, unsupported parameter, polar latitude, instant out of
 * range), 422 when the input is well formed but cannot be resolved or solved, 503 when the
 * ephemeris is unavailable, 500 for wrapped failures.
 */
@Slf4j
@RestControllerAdvice
public class AnalysisExceptionHandler {

    @ExceptionHandler(AstrolabeException.class)
    public ResponseEntity<ErrorResponse> handle(final AstrolabeException e) {
        final var status = statusOf(e);
        final var analysisId = e instanceof AnalysisException analysis ? analysis.getAnalysisId() : null;
        final List<String> missing = e instanceof InputValidationException validation
                ? validation.getMissingFields()
                : List.of();
        if (status.is5xxServerError()) {
            log.error("Analysis error [{}]: {}", e.code(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(analysisId, e.code(), e.getMessage(), missing));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(final HttpMessageNotReadableException e) {
        log.warn("Unreadable analysis request: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(null, "INPUT_VALIDATION", "Malformed request body"));
    }

    static HttpStatus statusOf(final AstrolabeException e) {
        if (e instanceof GeocodingUnresolvedException || e instanceof NoConvergenceException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (e instanceof EphemerisUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        if (e instanceof AnalysisException) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }
}
