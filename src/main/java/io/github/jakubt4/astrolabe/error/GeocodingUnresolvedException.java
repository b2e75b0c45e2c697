package io.github.jakubt4.astrolabe.error;

public class GeocodingUnresolvedException extends AstrolabeException {

    public GeocodingUnresolvedException(final String place) {
        super("Could not resolve place [" + place + "]");
    }

    @Override
    public String code() {
        return "GEOCODING_UNRESOLVED";
    }
}
