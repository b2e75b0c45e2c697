package io.github.jakubt4.astrolabe.service.aspect;

import java.util.List;

/**
 * A multi-point configuration. For T-squares and yods the apex is listed last.
 */
public record AspectPattern(PatternType type, List<String> points) {

    public AspectPattern {
        points = List.copyOf(points);
    }
}
