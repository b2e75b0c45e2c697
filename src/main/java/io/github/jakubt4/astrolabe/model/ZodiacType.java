package io.github.jakubt4.astrolabe.model;

import io.github.jakubt4.astrolabe.error.UnsupportedParameterException;

public enum ZodiacType {

    TROPICAL, SIDEREAL;

    public static ZodiacType parse(final String value) {
        for (final var type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new UnsupportedParameterException("zodiac", value);
    }
}
