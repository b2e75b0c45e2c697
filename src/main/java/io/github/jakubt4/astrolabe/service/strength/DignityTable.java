package io.github.jakubt4.astrolabe.service.strength;

import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.ZodiacSign;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static io.github.jakubt4.astrolabe.model.Body.JUPITER;
import static io.github.jakubt4.astrolabe.model.Body.MARS;
import static io.github.jakubt4.astrolabe.model.Body.MERCURY;
import static io.github.jakubt4.astrolabe.model.Body.MOON;
import static io.github.jakubt4.astrolabe.model.Body.SATURN;
import static io.github.jakubt4.astrolabe.model.Body.SUN;
import static io.github.jakubt4.astrolabe.model.Body.VENUS;

/**
 * Classical sign dignities and natural planetary friendships (Parashara).
 */
public final class DignityTable {

    private record Moolatrikona(ZodiacSign sign, double from, double to) {
    }

    private static final Map<Body, ZodiacSign> EXALTATION = new EnumMap<>(Body.class);
    private static final Map<Body, Moolatrikona> MOOLATRIKONA = new EnumMap<>(Body.class);
    private static final Map<Body, Set<Body>> FRIENDS = new EnumMap<>(Body.class);
    private static final Map<Body, Set<Body>> ENEMIES = new EnumMap<>(Body.class);

    static {
        EXALTATION.put(SUN, ZodiacSign.ARIES);
        EXALTATION.put(MOON, ZodiacSign.TAURUS);
        EXALTATION.put(MARS, ZodiacSign.CAPRICORN);
        EXALTATION.put(MERCURY, ZodiacSign.VIRGO);
        EXALTATION.put(JUPITER, ZodiacSign.CANCER);
        EXALTATION.put(VENUS, ZodiacSign.PISCES);
        EXALTATION.put(SATURN, ZodiacSign.LIBRA);

        MOOLATRIKONA.put(SUN, new Moolatrikona(ZodiacSign.LEO, 0, 20));
        MOOLATRIKONA.put(MOON, new Moolatrikona(ZodiacSign.TAURUS, 3, 30));
        MOOLATRIKONA.put(MARS, new Moolatrikona(ZodiacSign.ARIES, 0, 12));
        MOOLATRIKONA.put(MERCURY, new Moolatrikona(ZodiacSign.VIRGO, 15, 20));
        MOOLATRIKONA.put(JUPITER, new Moolatrikona(ZodiacSign.SAGITTARIUS, 0, 10));
        MOOLATRIKONA.put(VENUS, new Moolatrikona(ZodiacSign.LIBRA, 0, 15));
        MOOLATRIKONA.put(SATURN, new Moolatrikona(ZodiacSign.AQUARIUS, 0, 20));

        FRIENDS.put(SUN, EnumSet.of(MOON, MARS, JUPITER));
        FRIENDS.put(MOON, EnumSet.of(SUN, MERCURY));
        FRIENDS.put(MARS, EnumSet.of(SUN, MOON, JUPITER));
        FRIENDS.put(MERCURY, EnumSet.of(SUN, VENUS));
        FRIENDS.put(JUPITER, EnumSet.of(SUN, MOON, MARS));
        FRIENDS.put(VENUS, EnumSet.of(MERCURY, SATURN));
        FRIENDS.put(SATURN, EnumSet.of(MERCURY, VENUS));

        ENEMIES.put(SUN, EnumSet.of(VENUS, SATURN));
        ENEMIES.put(MOON, EnumSet.noneOf(Body.class));
        ENEMIES.put(MARS, EnumSet.of(MERCURY));
        ENEMIES.put(MERCURY, EnumSet.of(MOON));
        ENEMIES.put(JUPITER, EnumSet.of(MERCURY, VENUS));
        ENEMIES.put(VENUS, EnumSet.of(SUN, MOON));
        ENEMIES.put(SATURN, EnumSet.of(SUN, MOON, MARS));
    }

    private DignityTable() {
    }

    /**
     * Dignity of a classical planet at a sidereal sign and degree within it.
     */
    public static Dignity dignity(final Body planet, final ZodiacSign sign, final double degreeInSign) {
        final var exaltation = EXALTATION.get(planet);
        if (exaltation == null) {
            throw new IllegalArgumentException("No dignities defined for " + planet);
        }
        // Moon and Mercury share the sign with their moolatrikona, which starts at 3° and 15°
        final var exalted = sign == exaltation
                && !(planet == MOON && degreeInSign >= 3)
                && !(planet == MERCURY && degreeInSign >= 15);
        if (exalted) {
            return Dignity.EXALTED;
        }
        if (sign == exaltation.plus(6)) {
            return Dignity.DEBILITATED;
        }
        final var moolatrikona = MOOLATRIKONA.get(planet);
        if (sign == moolatrikona.sign() && degreeInSign >= moolatrikona.from() && degreeInSign < moolatrikona.to()) {
            return Dignity.MOOLATRIKONA;
        }
        if (sign.ruler() == planet) {
            return Dignity.OWN;
        }
        return relation(planet, sign.ruler());
    }

    /**
     * Natural relationship of {@code planet} towards {@code other}.
     */
    public static Dignity relation(final Body planet, final Body other) {
        if (FRIENDS.get(planet).contains(other)) {
            return Dignity.FRIEND;
        }
        if (ENEMIES.get(planet).contains(other)) {
            return Dignity.ENEMY;
        }
        return Dignity.NEUTRAL;
    }

    public static ZodiacSign exaltation(final Body planet) {
        return EXALTATION.get(planet);
    }
}
