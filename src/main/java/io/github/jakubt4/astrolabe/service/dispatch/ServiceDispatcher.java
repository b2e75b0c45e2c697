package io.github.jakubt4.astrolabe.service.dispatch;

import io.github.jakubt4.astrolabe.error.AnalysisException;
import io.github.jakubt4.astrolabe.error.AstrolabeException;
import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.model.Subject;
import io.github.jakubt4.astrolabe.service.cache.CacheKey;
import io.github.jakubt4.astrolabe.service.cache.CacheTier;
import io.github.jakubt4.astrolabe.service.cache.ResultCache;
import io.github.jakubt4.astrolabe.util.JulianDay;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Single entry point for analyses: catalog lookup, input validation, subject resolution,
 * caching and pipeline execution.
 *
 * <p>Every failure leaves as an {@link AstrolabeException}; anything else raised by a pipeline
 * is wrapped in {@link AnalysisException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ServiceDispatcher {

    private static final String SECOND_FINGERPRINT_PARAM = "secondSubject";

    private final AnalysisCatalog catalog;
    private final SubjectResolver subjectResolver;
    private final AnalysisPipelines pipelines;
    private final ResultCache cache;
    private final Clock clock;
    private final ExecutorService analysisExecutor;

    public AnalysisResult invoke(final String analysisId, final BirthData birthData,
                                 final Map<String, String> params) {
        return invoke(new AnalysisRequest(analysisId, birthData, null, null, params));
    }

    public AnalysisResult invoke(final AnalysisRequest request) {
        final var analysisId = request.analysisId();
        try {
            final var descriptor = catalog.require(analysisId);
            validate(descriptor, request);

            final var asOf = request.asOf() != null ? request.asOf() : LocalDate.now(clock);
            final var params = new HashMap<>(descriptor.defaultParams());
            params.putAll(request.params());

            final var primary = subjectResolver.resolve(request.primary());
            final var secondary = request.secondary() != null && descriptor.secondSubject() != SecondSubject.NONE
                    ? subjectResolver.resolve(request.secondary())
                    : null;
            final var context = new AnalysisContext(descriptor, primary, secondary, asOf,
                    JulianDay.atMidnight(asOf), Map.copyOf(params));

            final var output = (PipelineOutput) cache.getOrCompute(cacheKey(context), descriptor.cacheTier(),
                    () -> execute(context, request));
            log.info("Analysis [{}] completed for subject [{}]", analysisId, primary.fingerprint().substring(0, 12));
            return new AnalysisResult(analysisId, descriptor.pipeline(), primary.fingerprint(), asOf,
                    output.payload(), output.narrative());
        } catch (final AstrolabeException e) {
            log.warn("Analysis [{}] rejected: {} {}", analysisId, e.code(), e.getMessage());
            throw e;
        } catch (final RuntimeException e) {
            log.error("Analysis [{}] failed", analysisId, e);
            throw new AnalysisException(analysisId, e);
        }
    }

    private PipelineOutput execute(final AnalysisContext context, final AnalysisRequest request) {
        if (context.descriptor().pipeline() == Pipeline.COMPREHENSIVE) {
            return comprehensive(context, request);
        }
        return pipelines.run(context);
    }

    /**
     * Runs the listed analyses concurrently; the first failure fails the whole result.
     */
    private PipelineOutput comprehensive(final AnalysisContext context, final AnalysisRequest request) {
        final var parts = AnalysisCatalog.parts(context.param(AnalysisCatalog.ANALYSES_PARAM));
        final var overrides = new HashMap<>(request.params());
        overrides.remove(AnalysisCatalog.ANALYSES_PARAM);

        final var futures = new LinkedHashMap<String, CompletableFuture<AnalysisResult>>();
        for (final var part : parts) {
            final var subRequest = new AnalysisRequest(part, request.primary(), request.secondary(),
                    context.asOf(), overrides);
            futures.put(part, CompletableFuture.supplyAsync(() -> invoke(subRequest), analysisExecutor));
        }
        try {
            CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new)).join();
        } catch (final CompletionException e) {
            futures.values().forEach(f -> f.cancel(true));
            if (e.getCause() instanceof AstrolabeException cause) {
                throw cause;
            }
            throw e;
        }

        final var payload = new LinkedHashMap<String, Object>();
        final var narrative = new ArrayList<String>();
        futures.forEach((part, future) -> {
            final var result = future.join();
            payload.put(part, result.payload());
            narrative.addAll(result.narrative());
        });
        log.debug("Comprehensive analysis [{}] aggregated {} parts", context.descriptor().id(), parts.size());
        return new PipelineOutput(payload, narrative);
    }

    private static void validate(final AnalysisDescriptor descriptor, final AnalysisRequest request) {
        if (request.primary() == null) {
            throw InputValidationException.missing(List.of("primary"));
        }
        final var missing = new ArrayList<>(request.primary().missingFields(descriptor.requiredFields()));
        if (request.secondary() != null && descriptor.secondSubject() != SecondSubject.NONE) {
            request.secondary().missingFields(descriptor.requiredFields())
                    .forEach(field -> missing.add("secondary." + field));
        } else if (descriptor.secondSubject() == SecondSubject.REQUIRED) {
            missing.add("secondary");
        }
        if (!missing.isEmpty()) {
            throw InputValidationException.missing(missing);
        }
    }

    private static CacheKey cacheKey(final AnalysisContext context) {
        final var keyParams = new HashMap<>(context.params());
        final Subject secondary = context.secondary();
        if (secondary != null) {
            keyParams.put(SECOND_FINGERPRINT_PARAM, secondary.fingerprint());
        }
        final var asOf = context.descriptor().cacheTier() == CacheTier.DATED ? context.asOf() : null;
        return new CacheKey(context.primary().fingerprint(), context.descriptor().id(), asOf, keyParams);
    }
}
