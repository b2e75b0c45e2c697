package io.github.jakubt4.astrolabe.service.aspect;

/**
 * A matched aspect between two chart points.
 *
 * @param separation minimal angular distance, degrees in [0, 180]
 * @param orb        |separation - aspect angle|, never above {@code allowedOrb}
 * @param exactness  1 at perfection falling to 0 at the edge of the orb
 * @param applying   {@code true} while the orb is shrinking; {@code null} when a speed is unknown
 */
public record Aspect(String first, String second, AspectType type, double separation, double orb,
                     double allowedOrb, double exactness, Boolean applying) {

    public boolean involves(final String point) {
        return first.equals(point) || second.equals(point);
    }

    /**
     * Same aspect seen from the other side.
     */
    public Aspect swapped() {
        return new Aspect(second, first, type, separation, orb, allowedOrb, exactness, applying);
    }
}
