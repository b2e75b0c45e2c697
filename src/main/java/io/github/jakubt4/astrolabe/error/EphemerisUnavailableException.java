package io.github.jakubt4.astrolabe.error;

/**
 * The ephemeris cannot answer: the instant is outside the supported range or the source failed.
 */
public class EphemerisUnavailableException extends AstrolabeException {

    public EphemerisUnavailableException(final String message) {
        super(message);
    }

    public EphemerisUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() {
        return "EPHEMERIS_UNAVAILABLE";
    }
}
