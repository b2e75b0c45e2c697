package io.github.jakubt4.astrolabe.service.ephemeris;

import io.github.jakubt4.astrolabe.error.EphemerisUnavailableException;
import io.github.jakubt4.astrolabe.model.Body;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.retry.support.RetrySynchronizationManager;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Calls the configured {@link EphemerisSource}, retrying transient failures.
 *
 * <p>After the last attempt the {@link EphemerisUnavailableException} reaches the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EphemerisReader {

    private final EphemerisSource source;

    @Retryable(retryFor = EphemerisUnavailableException.class,
               maxAttemptsExpression = "${astrolabe.ephemeris.max-attempts:2}",
               backoff = @Backoff(delayExpression = "${astrolabe.ephemeris.backoff-millis:200}"))
    public Map<Body, EclipticCoordinates> read(final Set<Body> bodies, final double julianDayTt) {
        final var context = RetrySynchronizationManager.getContext();
        if (context != null && context.getRetryCount() > 0) {
            log.warn("Retrying {} ephemeris read at JD(TT) {} (attempt {}): {}", source.name(), julianDayTt,
                    context.getRetryCount() + 1,
                    context.getLastThrowable() == null ? "-" : context.getLastThrowable().getMessage());
        }
        return source.positions(bodies, julianDayTt);
    }

    public String sourceName() {
        return source.name();
    }
}
