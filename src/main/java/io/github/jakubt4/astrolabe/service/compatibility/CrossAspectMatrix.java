package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.service.aspect.Aspect;

import java.util.List;
import java.util.Optional;

/**
 * Aspects between the points of two charts. Every aspect names its row point first.
 */
public record CrossAspectMatrix(List<String> rows, List<String> columns, List<Aspect> aspects) {

    public CrossAspectMatrix {
        rows = List.copyOf(rows);
        columns = List.copyOf(columns);
        aspects = List.copyOf(aspects);
    }

    public Optional<Aspect> cell(final String row, final String column) {
        return aspects.stream()
                .filter(a -> a.first().equals(row) && a.second().equals(column))
                .findFirst();
    }

    /**
     * Same matrix seen from the other chart: rows and columns swapped.
     */
    public CrossAspectMatrix transpose() {
        final var swapped = columns.stream()
                .flatMap(column -> rows.stream()
                        .map(row -> cell(row, column))
                        .flatMap(Optional::stream)
                        .map(Aspect::swapped))
                .toList();
        return new CrossAspectMatrix(columns, rows, swapped);
    }
}
