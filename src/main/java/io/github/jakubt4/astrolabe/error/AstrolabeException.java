package io.github.jakubt4.astrolabe.error;

/**
 * Root of every failure the engine reports on purpose. Unchecked, like the Orekit
 * exceptions the computations build on.
 */
public abstract class AstrolabeException extends RuntimeException {

    protected AstrolabeException(final String message) {
        super(message);
    }

    protected AstrolabeException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable kind, used in error responses.
     */
    public abstract String code();
}
