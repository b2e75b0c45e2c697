package io.github.jakubt4.astrolabe.model;

/**
 * Anything an aspect can be formed to: a body or one of the chart angles.
 *
 * @param id          body name, {@code ASC} or {@code MC}
 * @param body        the body, or {@code null} for an angle
 * @param dailyMotion degrees per day, {@code null} when unknown
 */
public record ChartPoint(String id, Body body, double longitude, Double dailyMotion) {

    public static final String ASCENDANT = "ASC";
    public static final String MIDHEAVEN = "MC";

    public static ChartPoint of(final BodyPosition position) {
        return new ChartPoint(position.body().name(), position.body(), position.longitude(), position.dailyMotion());
    }

    public static ChartPoint angle(final String id, final double longitude) {
        return new ChartPoint(id, null, longitude, null);
    }

    /**
     * Ordering key for canonical pairs: bodies in enum order, then the ascendant, then the MC.
     */
    public int rank() {
        if (body != null) {
            return body.ordinal();
        }
        return ASCENDANT.equals(id) ? Body.values().length : Body.values().length + 1;
    }
}
