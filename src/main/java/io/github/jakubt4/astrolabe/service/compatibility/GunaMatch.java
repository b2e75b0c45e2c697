package io.github.jakubt4.astrolabe.service.compatibility;

import io.github.jakubt4.astrolabe.model.Nakshatra;
import io.github.jakubt4.astrolabe.model.ZodiacSign;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Ashtakoota result. The groom's Moon is the first subject's, the bride's the second's.
 *
 * @param bhakootDosha the Moon signs stand 2/12, 5/9 or 6/8 from each other
 * @param nadiDosha    both Moons share a nadi
 */
public record GunaMatch(Nakshatra groomNakshatra, Nakshatra brideNakshatra, ZodiacSign groomMoonSign,
                        ZodiacSign brideMoonSign, Map<Koota, Double> kootas, double total, GunaVerdict verdict,
                        boolean bhakootDosha, boolean nadiDosha) {

    public GunaMatch {
        kootas = Collections.unmodifiableMap(new EnumMap<>(kootas));
    }

    public double points(final Koota koota) {
        return kootas.get(koota);
    }
}
