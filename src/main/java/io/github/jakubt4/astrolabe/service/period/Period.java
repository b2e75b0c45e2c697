package io.github.jakubt4.astrolabe.service.period;

import io.github.jakubt4.astrolabe.model.Body;

import java.util.List;

/**
 * A node of the Vimshottari tree. Level 0 is the whole 120-year cycle (no lord), level 1
 * the major periods, level 2 the sub-periods and so on. Children tile {@code [startJd, endJd)}.
 *
 * @param parentLord lord of the enclosing period, {@code null} for levels 0 and 1
 */
public record Period(int level, Body lord, Body parentLord, double startJd, double endJd, List<Period> children) {

    public Period {
        children = List.copyOf(children);
    }

    public boolean contains(final double julianDay) {
        return julianDay >= startJd && julianDay < endJd;
    }

    public double durationDays() {
        return endJd - startJd;
    }
}
