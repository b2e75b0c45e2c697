package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.config.AstrolabeProperties;
import io.github.jakubt4.astrolabe.model.Body;
import io.github.jakubt4.astrolabe.model.Chart;
import io.github.jakubt4.astrolabe.model.Nakshatra;
import io.github.jakubt4.astrolabe.model.ZodiacSign;
import io.github.jakubt4.astrolabe.model.ZodiacType;
import io.github.jakubt4.astrolabe.service.strength.Dignity;
import io.github.jakubt4.astrolabe.service.strength.DignityTable;
import io.github.jakubt4.astrolabe.util.Angles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;

/**
 * Ashtakoota (guna milan) matching of two sidereal Moon positions, out of 36 points.
 *
 * <p>Varna, Vashya and Gana are read from the groom's side, so {@code match(a, b)} and
 * {@code match(b, a)} may differ; the other five kootas are symmetric.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GunaMilanEngine {

    private final AstrolabeProperties properties;

    public GunaMatch match(final Chart groom, final Chart bride) {
        return match(siderealMoon(groom), siderealMoon(bride));
    }

    public GunaMatch match(final double groomMoon, final double brideMoon) {
        final var groomSign = ZodiacSign.ofLongitude(groomMoon);
        final var brideSign = ZodiacSign.ofLongitude(brideMoon);
        final var groomStar = Nakshatra.ofLongitude(groomMoon);
        final var brideStar = Nakshatra.ofLongitude(brideMoon);

        final var kootas = new EnumMap<Koota, Double>(Koota.class);
        final var varnaMatches = KootaTraits.varna(groomSign).compareTo(KootaTraits.varna(brideSign)) >= 0;
        kootas.put(Koota.VARNA, varnaMatches ? 1.0 : 0.0);
        kootas.put(Koota.VASHYA, KootaTraits.vashyaPoints(
                KootaTraits.vashya(groomSign, Angles.degreeInSign(groomMoon)),
                KootaTraits.vashya(brideSign, Angles.degreeInSign(brideMoon))));
        kootas.put(Koota.TARA, tara(brideStar, groomStar) + tara(groomStar, brideStar));
        kootas.put(Koota.YONI, KootaTraits.yoniPoints(KootaTraits.yoni(groomStar), KootaTraits.yoni(brideStar)));
        kootas.put(Koota.GRAHA_MAITRI, grahaMaitri(groomSign.ruler(), brideSign.ruler()));
        kootas.put(Koota.GANA, KootaTraits.ganaPoints(KootaTraits.gana(groomStar), KootaTraits.gana(brideStar)));
        final var bhakootDosha = bhakootDosha(groomSign, brideSign);
        kootas.put(Koota.BHAKOOT, bhakootDosha ? 0.0 : Koota.BHAKOOT.maxPoints());
        final var nadiDosha = KootaTraits.nadi(groomStar) == KootaTraits.nadi(brideStar);
        kootas.put(Koota.NADI, nadiDosha ? 0.0 : Koota.NADI.maxPoints());

        final var total = kootas.values().stream().mapToDouble(Double::doubleValue).sum();
        log.debug("Guna milan {} / {} for {} and {}", total, Koota.TOTAL, groomStar, brideStar);
        return new GunaMatch(groomStar, brideStar, groomSign, brideSign, kootas, total, GunaVerdict.of(total),
                bhakootDosha, nadiDosha);
    }

    /**
     * 1.5 points unless the count from {@code from} lands on the 3rd, 5th or 7th tara.
     */
    static double tara(final Nakshatra from, final Nakshatra to) {
        final var count = Math.floorMod(to.ordinal() - from.ordinal(), 27) + 1;
        final var tara = (count - 1) % 9 + 1;
        return tara == 3 || tara == 5 || tara == 7 ? 0.0 : 1.5;
    }

    static double grahaMaitri(final Body groomLord, final Body brideLord) {
        if (groomLord == brideLord) {
            return 5.0;
        }
        final var forward = DignityTable.relation(groomLord, brideLord);
        final var backward = DignityTable.relation(brideLord, groomLord);
        final var friends = count(Dignity.FRIEND, forward, backward);
        final var enemies = count(Dignity.ENEMY, forward, backward);
        if (friends == 2) {
            return 5.0;
        }
        if (friends == 1) {
            return enemies == 0 ? 4.0 : 1.0;
        }
        return switch (enemies) {
            case 0 -> 3.0;
            case 1 -> 0.5;
            default -> 0.0;
        };
    }

    /**
     * Moon signs 2/12, 5/9 or 6/8 from each other.
     */
    static boolean bhakootDosha(final ZodiacSign groom, final ZodiacSign bride) {
        final var distance = ZodiacSign.houseDistance(groom, bride);
        return distance == 2 || distance == 12 || distance == 5 || distance == 9 || distance == 6 || distance == 8;
    }

    private double siderealMoon(final Chart chart) {
        final var moon = chart.position(Body.MOON).longitude();
        return chart.zodiac() == ZodiacType.SIDEREAL
                ? moon
                : Angles.normalize(moon - properties.chart().ayanamsa().valueAt(chart.julianDay()));
    }

    private static int count(final Dignity wanted, final Dignity first, final Dignity second) {
        return (first == wanted ? 1 : 0) + (second == wanted ? 1 : 0);
    }
}
