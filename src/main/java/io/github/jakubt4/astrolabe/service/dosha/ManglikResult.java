package io.github.jakubt4.astrolabe.service.dosha;

/**
 * @param houseFromAscendant sign-house of Mars counted from the ascendant sign
 * @param houseFromMoon      sign-house of Mars counted from the Moon sign
 * @param cancelled          Mars in its own or exaltation sign
 */
public record ManglikResult(boolean present, boolean fromAscendant, boolean fromMoon, int houseFromAscendant,
                            int houseFromMoon, boolean cancelled) {
}
