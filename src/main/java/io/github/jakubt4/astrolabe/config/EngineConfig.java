package io.github.jakubt4.astrolabe.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.astrolabe.service.cache.ResultCache;
import io.github.jakubt4.astrolabe.service.dispatch.AnalysisCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Infrastructure beans around the engines: clock, result cache, analysis catalog and the
 * pool that runs comprehensive sub-analyses.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResultCache resultCache(final AstrolabeProperties properties) {
        return new ResultCache(properties.cache());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor(final AstrolabeProperties properties) {
        final var poolSize = properties.dispatcher().poolSize();
        log.info("Analysis executor started [poolSize={}]", poolSize);
        return Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("analysis-"));
    }

    @Bean
    public AnalysisCatalog analysisCatalog(final ObjectMapper objectMapper, final ResourceLoader resourceLoader,
                                           final AstrolabeProperties properties) {
        final var location = properties.dispatcher().catalogLocation();
        final var resource = resourceLoader.getResource(location.contains(":") ? location : "classpath:" + location);
        try (var json = resource.getInputStream()) {
            return AnalysisCatalog.load(objectMapper, json);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read analysis catalog " + location, e);
        }
    }
}
