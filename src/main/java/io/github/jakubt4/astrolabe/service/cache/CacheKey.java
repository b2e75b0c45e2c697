package io.github.jakubt4.astrolabe.service.cache;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Identity of a cached analysis result.
 *
 * @param asOf   {@code null} for natal analyses
 * @param params effective parameters, including the second subject's fingerprint when one is given
 */
public record CacheKey(String subjectFingerprint, String analysisId, LocalDate asOf, Map<String, String> params) {

    public CacheKey {
        Objects.requireNonNull(subjectFingerprint, "subjectFingerprint");
        Objects.requireNonNull(analysisId, "analysisId");
        params = params == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(params));
    }
}
