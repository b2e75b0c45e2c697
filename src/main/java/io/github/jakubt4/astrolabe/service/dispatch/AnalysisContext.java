package io.github.jakubt4.astrolabe.service.dispatch;

import io.github.jakubt4.astrolabe.error.InputValidationException;
import io.github.jakubt4.astrolabe.model.Subject;

import java.time.LocalDate;
import java.util.Map;

/**
 * Resolved inputs handed to a pipeline.
 *
 * @param secondary {@code null} unless a second subject was supplied
 * @param asOfJd    Julian Day (UT) of 00:00 UTC on {@code asOf}
 * @param params    catalog defaults overlaid with the request parameters
 */
record AnalysisContext(AnalysisDescriptor descriptor, Subject primary, Subject secondary, LocalDate asOf,
                       double asOfJd, Map<String, String> params) {

    String param(final String name) {
        final var value = params.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    String param(final String name, final String fallback) {
        final var value = param(name);
        return value == null ? fallback : value;
    }

    int intParam(final String name, final int fallback) {
        final var value = param(name);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new InputValidationException("Parameter [" + name + "] must be an integer, got: " + value);
        }
    }

    double doubleParam(final String name, final double fallback) {
        final var value = param(name);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw new InputValidationException("Parameter [" + name + "] must be a number, got: " + value);
        }
    }

    boolean flag(final String name) {
        return Boolean.parseBoolean(param(name, "false"));
    }
}
