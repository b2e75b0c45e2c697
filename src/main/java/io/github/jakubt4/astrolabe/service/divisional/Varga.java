package io.github.jakubt4.astrolabe.service.divisional;

import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;
import io.github.jakubt4.astrolabe.model.ZodiacSign;

import static io.github.jakubt4.astrolabe.model.ZodiacSign.AQUARIUS;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.ARIES;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.CANCER;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.CAPRICORN;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.GEMINI;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.LEO;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.LIBRA;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.PISCES;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.SAGITTARIUS;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.SCORPIO;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.TAURUS;
import static io.github.jakubt4.astrolabe.model.ZodiacSign.VIRGO;

/**
 * Parashari divisional charts. Each rule maps a sign and the zero-based part a longitude
 * falls in to the sign that part is projected onto.
 */
public enum Varga {

    D1(1, "Rasi", (sign, part) -> sign),
    D2(2, "Hora", (sign, part) -> sign.isOdd() == (part == 0) ? LEO : CANCER),
    D3(3, "Drekkana", (sign, part) -> sign.plus(4 * part)),
    D4(4, "Chaturthamsa", (sign, part) -> sign.plus(3 * part)),
    D7(7, "Saptamsa", (sign, part) -> sign.isOdd() ? sign.plus(part) : sign.plus(6 + part)),
    D9(9, "Navamsa", (sign, part) -> byElement(sign, ARIES, CAPRICORN, LIBRA, CANCER).plus(part)),
    D10(10, "Dasamsa", (sign, part) -> sign.isOdd() ? sign.plus(part) : sign.plus(8 + part)),
    D12(12, "Dwadasamsa", (sign, part) -> sign.plus(part)),
    D16(16, "Shodasamsa", (sign, part) -> byModality(sign, ARIES, LEO, SAGITTARIUS).plus(part)),
    D20(20, "Vimsamsa", (sign, part) -> byModality(sign, ARIES, SAGITTARIUS, LEO).plus(part)),
    D24(24, "Chaturvimsamsa", (sign, part) -> (sign.isOdd() ? LEO : CANCER).plus(part)),
    D27(27, "Bhamsa", (sign, part) -> byElement(sign, ARIES, CANCER, LIBRA, CAPRICORN).plus(part)),
    D30(30, "Trimsamsa", null),
    D40(40, "Khavedamsa", (sign, part) -> (sign.isOdd() ? ARIES : LIBRA).plus(part)),
    D45(45, "Akshavedamsa", (sign, part) -> byModality(sign, ARIES, LEO, SAGITTARIUS).plus(part)),
    D60(60, "Shashtiamsa", (sign, part) -> sign.plus(part));

    @FunctionalInterface
    interface Rule {
        ZodiacSign target(ZodiacSign sign, int part);
    }

    // Trimsamsa: unequal parts ruled by Mars, Saturn, Jupiter, Mercury, Venus in odd signs
    static final double[] TRIMSAMSA_ODD_BOUNDS = {0, 5, 10, 18, 25, 30};
    static final ZodiacSign[] TRIMSAMSA_ODD_SIGNS = {ARIES, AQUARIUS, SAGITTARIUS, GEMINI, LIBRA};
    static final double[] TRIMSAMSA_EVEN_BOUNDS = {0, 5, 12, 20, 25, 30};
    static final ZodiacSign[] TRIMSAMSA_EVEN_SIGNS = {TAURUS, VIRGO, PISCES, CAPRICORN, SCORPIO};

    private final int factor;
    private final String displayName;
    private final Rule rule;

    Varga(final int factor, final String displayName, final Rule rule) {
        this.factor = factor;
        this.displayName = displayName;
        this.rule = rule;
    }

    public int factor() {
        return factor;
    }

    public String displayName() {
        return displayName;
    }

    Rule rule() {
        return rule;
    }

    public static Varga ofFactor(final int factor) {
        for (final var varga : values()) {
            if (varga.factor == factor) {
                return varga;
            }
        }
        throw new UnsupportedParameterException("divisional factor", factor);
    }

    private static ZodiacSign byElement(final ZodiacSign sign, final ZodiacSign fire, final ZodiacSign earth,
                                        final ZodiacSign air, final ZodiacSign water) {
        return switch (sign.element()) {
            case FIRE -> fire;
            case EARTH -> earth;
            case AIR -> air;
            case WATER -> water;
        };
    }

    private static ZodiacSign byModality(final ZodiacSign sign, final ZodiacSign movable, final ZodiacSign fixed,
                                         final ZodiacSign dual) {
        return switch (sign.modality()) {
            case MOVABLE -> movable;
            case FIXED -> fixed;
            case DUAL -> dual;
        };
    }
}
