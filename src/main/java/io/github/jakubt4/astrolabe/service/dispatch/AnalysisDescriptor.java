package io.github.jakubt4.astrolabe.service.dispatch;

import io.github.jakubt4.astrolabe.service.cache.CacheTier;

import java.util.List;
import java.util.Map;

/**
 * One row of the analysis catalog.
 *
 * @param requiredFields birth-data fields the analysis cannot run without ({@code date}, {@code time},
 *                       {@code location})
 * @param defaultParams  parameters applied unless the request overrides them
 */
public record AnalysisDescriptor(String id, Pipeline pipeline, String description, List<String> requiredFields,
                                 SecondSubject secondSubject, CacheTier cacheTier, Map<String, String> defaultParams) {

    public AnalysisDescriptor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Catalog row without id");
        }
        if (pipeline == null) {
            throw new IllegalArgumentException("Catalog row [" + id + "] has no pipeline");
        }
        requiredFields = requiredFields == null ? List.of() : List.copyOf(requiredFields);
        secondSubject = secondSubject == null ? SecondSubject.NONE : secondSubject;
        cacheTier = cacheTier == null ? CacheTier.NATAL : cacheTier;
        defaultParams = defaultParams == null ? Map.of() : Map.copyOf(defaultParams);
    }
}
