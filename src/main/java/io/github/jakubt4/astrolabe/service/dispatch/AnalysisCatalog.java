package io.github.jakubt4.astrolabe.service.dispatch;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable id-to-descriptor table, loaded once at startup.
 */
@Slf4j
public class AnalysisCatalog {

    static final String ANALYSES_PARAM = "analyses";

    private final Map<String, AnalysisDescriptor> descriptors;

    public AnalysisCatalog(final Collection<AnalysisDescriptor> rows) {
        final var byId = new LinkedHashMap<String, AnalysisDescriptor>();
        for (final var row : rows) {
            if (byId.putIfAbsent(row.id(), row) != null) {
                throw new IllegalStateException("Duplicate analysis id in catalog [" + row.id() + "]");
            }
        }
        for (final var row : byId.values()) {
            if (row.pipeline() == Pipeline.COMPREHENSIVE) {
                for (final var part : parts(row.defaultParams().get(ANALYSES_PARAM))) {
                    final var target = byId.get(part);
                    if (target == null || target.pipeline() == Pipeline.COMPREHENSIVE) {
                        throw new IllegalStateException("Analysis [" + row.id() + "] lists invalid part [" + part + "]");
                    }
                }
            }
        }
        this.descriptors = Map.copyOf(byId);
    }

    public static AnalysisCatalog load(final ObjectMapper objectMapper, final InputStream json) throws IOException {
        final List<AnalysisDescriptor> rows = objectMapper.readValue(json, new TypeReference<>() {
        });
        log.info("Analysis catalog loaded [{} analyses]", rows.size());
        return new AnalysisCatalog(rows);
    }

    public Optional<AnalysisDescriptor> find(final String analysisId) {
        return Optional.ofNullable(analysisId).map(descriptors::get);
    }

    /**
     * @throws UnsupportedParameterException for unknown ids
     */
    public AnalysisDescriptor require(final String analysisId) {
        return find(analysisId).orElseThrow(() -> new UnsupportedParameterException("analysis", analysisId));
    }

    public int size() {
        return descriptors.size();
    }

    public Collection<AnalysisDescriptor> descriptors() {
        return descriptors.values();
    }

    static List<String> parts(final String commaSeparated) {
        if (commaSeparated == null || commaSeparated.isBlank()) {
            return List.of();
        }
        return Arrays.stream(commaSeparated.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
