package io.github.jakubt4.astrolabe.service.dosha;

import io.github.jakubt4.astrolabe.model.Body;

import java.util.List;

/**
 * @param ascending  {@code true} when the planets lie on the arc running forward from Rahu to Ketu
 *                   (Kaal Sarp proper), {@code false} for the reverse arc (Kaal Amrit)
 * @param outside    planets breaking the enclosure; empty when the dosha is present
 */
public record KaalSarpResult(boolean present, KaalSarpType type, boolean ascending, int rahuHouse,
                             List<Body> outside) {

    public KaalSarpResult {
        outside = List.copyOf(outside);
    }

    /**
     * Present, or broken by a single planet.
     */
    public boolean partial() {
        return !present && outside.size() == 1;
    }
}
