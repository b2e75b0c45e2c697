package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.model.Nakshatra;
import io.github.jakubt4.astrolabe.model.ZodiacSign;

import java.util.EnumSet;
import java.util.Set;

/**
 * Classifications of the Moon's sign and mansion used by Ashtakoota matching.
 */
final class KootaTraits {

    enum Varna {
        SHUDRA, VAISHYA, KSHATRIYA, BRAHMIN
    }

    enum Vashya {
        CHATUSHPADA, MANAVA, JALACHARA, VANACHARA, KEETA
    }

    enum Yoni {
        HORSE, ELEPHANT, SHEEP, SERPENT, DOG, CAT, RAT, COW, BUFFALO, TIGER, DEER, MONKEY, MONGOOSE, LION
    }

    enum Gana {
        DEVA, MANUSHYA, RAKSHASA
    }

    enum Nadi {
        ADI, MADHYA, ANTYA
    }

    private static final Yoni[] YONI = {
            Yoni.HORSE, Yoni.ELEPHANT, Yoni.SHEEP, Yoni.SERPENT, Yoni.SERPENT, Yoni.DOG, Yoni.CAT, Yoni.SHEEP,
            Yoni.CAT, Yoni.RAT, Yoni.RAT, Yoni.COW, Yoni.BUFFALO, Yoni.TIGER, Yoni.BUFFALO, Yoni.TIGER, Yoni.DEER,
            Yoni.DEER, Yoni.DOG, Yoni.MONKEY, Yoni.MONGOOSE, Yoni.MONKEY, Yoni.LION, Yoni.HORSE, Yoni.LION,
            Yoni.COW, Yoni.ELEPHANT
    };

    private static final Set<Nakshatra> DEVA = EnumSet.of(Nakshatra.ASHWINI, Nakshatra.MRIGASHIRA,
            Nakshatra.PUNARVASU, Nakshatra.PUSHYA, Nakshatra.HASTA, Nakshatra.SWATI, Nakshatra.ANURADHA,
            Nakshatra.SHRAVANA, Nakshatra.REVATI);
    private static final Set<Nakshatra> RAKSHASA = EnumSet.of(Nakshatra.KRITTIKA, Nakshatra.ASHLESHA,
            Nakshatra.MAGHA, Nakshatra.CHITRA, Nakshatra.VISHAKHA, Nakshatra.JYESHTHA, Nakshatra.MULA,
            Nakshatra.DHANISHTA, Nakshatra.SHATABHISHA);

    // rows: groom, columns: bride
    private static final double[][] VASHYA_POINTS = {
            {2.0, 1.0, 1.0, 0.5, 1.0},
            {1.0, 2.0, 0.5, 0.0, 1.0},
            {1.0, 0.5, 2.0, 1.0, 1.0},
            {0.5, 0.0, 1.0, 2.0, 0.0},
            {1.0, 1.0, 1.0, 0.0, 2.0}
    };
    private static final double[][] GANA_POINTS = {
            {6.0, 6.0, 1.0},
            {5.0, 6.0, 0.0},
            {1.0, 0.0, 6.0}
    };

    private KootaTraits() {
    }

    static Varna varna(final ZodiacSign sign) {
        return switch (sign.element()) {
            case WATER -> Varna.BRAHMIN;
            case FIRE -> Varna.KSHATRIYA;
            case EARTH -> Varna.VAISHYA;
            case AIR -> Varna.SHUDRA;
        };
    }

    /**
     * Sagittarius and Capricorn change class at 15°.
     */
    static Vashya vashya(final ZodiacSign sign, final double degreeInSign) {
        return switch (sign) {
            case ARIES, TAURUS -> Vashya.CHATUSHPADA;
            case GEMINI, VIRGO, LIBRA, AQUARIUS -> Vashya.MANAVA;
            case CANCER, PISCES -> Vashya.JALACHARA;
            case LEO -> Vashya.VANACHARA;
            case SCORPIO -> Vashya.KEETA;
            case SAGITTARIUS -> degreeInSign < 15.0 ? Vashya.MANAVA : Vashya.CHATUSHPADA;
            case CAPRICORN -> degreeInSign < 15.0 ? Vashya.CHATUSHPADA : Vashya.JALACHARA;
        };
    }

    static double vashyaPoints(final Vashya groom, final Vashya bride) {
        return VASHYA_POINTS[groom.ordinal()][bride.ordinal()];
    }

    static Yoni yoni(final Nakshatra nakshatra) {
        return YONI[nakshatra.ordinal()];
    }

    /**
     * Same animal 4, sworn enemies 0, any other pairing 2.
     */
    static double yoniPoints(final Yoni a, final Yoni b) {
        if (a == b) {
            return 4.0;
        }
        return swornEnemies(a, b) || swornEnemies(b, a) ? 0.0 : 2.0;
    }

    private static boolean swornEnemies(final Yoni a, final Yoni b) {
        return switch (a) {
            case HORSE -> b == Yoni.BUFFALO;
            case ELEPHANT -> b == Yoni.LION;
            case SHEEP -> b == Yoni.MONKEY;
            case SERPENT -> b == Yoni.MONGOOSE;
            case DOG -> b == Yoni.DEER;
            case CAT -> b == Yoni.RAT;
            case COW -> b == Yoni.TIGER;
            default -> false;
        };
    }

    static Gana gana(final Nakshatra nakshatra) {
        if (DEVA.contains(nakshatra)) {
            return Gana.DEVA;
        }
        return RAKSHASA.contains(nakshatra) ? Gana.RAKSHASA : Gana.MANUSHYA;
    }

    static double ganaPoints(final Gana groom, final Gana bride) {
        return GANA_POINTS[groom.ordinal()][bride.ordinal()];
    }

    /**
     * Nadis run Adi, Madhya, Antya, Antya, Madhya, Adi in blocks of six mansions from Ashwini.
     */
    static Nadi nadi(final Nakshatra nakshatra) {
        return switch (nakshatra.ordinal() % 6) {
            case 0, 5 -> Nadi.ADI;
            case 1, 4 -> Nadi.MADHYA;
            default -> Nadi.ANTYA;
        };
    }
}
