package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.util.Angles;

/**
 * The twelve signs with their triplicity, modality and traditional ruler.
 */
public enum ZodiacSign {

    ARIES(Element.FIRE, Modality.MOVABLE, Body.MARS),
    TAURUS(Element.EARTH, Modality.FIXED, Body.VENUS),
    GEMINI(Element.AIR, Modality.DUAL, Body.MERCURY),
    CANCER(Element.WATER, Modality.MOVABLE, Body.MOON),
    LEO(Element.FIRE, Modality.FIXED, Body.SUN),
    VIRGO(Element.EARTH, Modality.DUAL, Body.MERCURY),
    LIBRA(Element.AIR, Modality.MOVABLE, Body.VENUS),
    SCORPIO(Element.WATER, Modality.FIXED, Body.MARS),
    SAGITTARIUS(Element.FIRE, Modality.DUAL, Body.JUPITER),
    CAPRICORN(Element.EARTH, Modality.MOVABLE, Body.SATURN),
    AQUARIUS(Element.AIR, Modality.FIXED, Body.SATURN),
    PISCES(Element.WATER, Modality.DUAL, Body.JUPITER);

    public enum Element {
        FIRE, EARTH, AIR, WATER
    }

    public enum Modality {
        MOVABLE, FIXED, DUAL
    }

    private static final ZodiacSign[] VALUES = values();

    private final Element element;
    private final Modality modality;
    private final Body ruler;

    ZodiacSign(final Element element, final Modality modality, final Body ruler) {
        this.element = element;
        this.modality = modality;
        this.ruler = ruler;
    }

    public Element element() {
        return element;
    }

    public Modality modality() {
        return modality;
    }

    public Body ruler() {
        return ruler;
    }

    /**
     * Aries, Gemini, Leo... are odd (masculine) signs.
     */
    public boolean isOdd() {
        return ordinal() % 2 == 0;
    }

    public double startLongitude() {
        return ordinal() * Angles.SIGN_SPAN;
    }

    /**
     * The sign {@code count} places further along the zodiac (negative counts go back).
     */
    public ZodiacSign plus(final int count) {
        return of(ordinal() + count);
    }

    public static ZodiacSign of(final int index) {
        return VALUES[Math.floorMod(index, 12)];
    }

    public static ZodiacSign ofLongitude(final double longitude) {
        return VALUES[Angles.signIndex(longitude)];
    }

    /**
     * 1-based count from {@code from} to {@code to}, inclusive, as used for sign aspects
     * and "houses from" reckoning (same sign = 1).
     */
    public static int houseDistance(final ZodiacSign from, final ZodiacSign to) {
        return Math.floorMod(to.ordinal() - from.ordinal(), 12) + 1;
    }
}
