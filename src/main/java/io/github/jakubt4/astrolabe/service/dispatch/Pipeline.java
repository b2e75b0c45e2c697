package io.github.jakubt4.astrolabe.service.dispatch;

/**
 * Computation behind an analysis id. Several catalog rows may share a pipeline with different
 * default parameters.
 */
public enum Pipeline {
    BIRTH_CHART,
    DIVISIONAL_CHART,
    ASPECTS,
    STRENGTH,
    ASHTAKAVARGA,
    NAKSHATRA,
    PERIOD_TREE,
    CURRENT_PERIOD,
    UPCOMING_PERIODS,
    PROGRESSION,
    RETURN_CHART,
    TRANSIT_SCAN,
    COMPATIBILITY,
    GUNA_MILAN,
    DOSHA,
    SADE_SATI,
    COMPREHENSIVE
}
