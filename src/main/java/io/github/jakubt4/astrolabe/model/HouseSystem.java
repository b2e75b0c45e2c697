package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;

public enum HouseSystem {

    PLACIDUS, WHOLE_SIGN, EQUAL, PORPHYRY;

    public static HouseSystem parse(final String value) {
        for (final var system : values()) {
            if (system.name().equalsIgnoreCase(value.trim().replace('-', '_'))) {
                return system;
            }
        }
        throw new UnsupportedParameterException("houseSystem", value);
    }
}
