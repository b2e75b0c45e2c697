package io.github.jakubt4.astrolabe.service.strength;

/**
 * Positional dignity of a planet in a sign, with its value in virupas (60 = full strength).
 */
public enum Dignity {

    EXALTED(60.0),
    MOOLATRIKONA(45.0),
    OWN(30.0),
    FRIEND(15.0),
    NEUTRAL(7.5),
    ENEMY(3.75),
    DEBILITATED(0.0);

    private final double virupas;

    Dignity(final double virupas) {
        this.virupas = virupas;
    }

    public double virupas() {
        return virupas;
    }
}
