package io.github.jakubt4.astrolabe.error;

import java.util.Locale;

public class InvalidLatitudeException extends AstrolabeException {

    public InvalidLatitudeException(final double latitude, final double limit, final String houseSystem) {
        super(String.format(Locale.ROOT, "%s houses are undefined at latitude %.4f (limit %.1f)",
                houseSystem, latitude, limit));
    }

    @Override
    public String code() {
        return "INVALID_LATITUDE";
    }
}
