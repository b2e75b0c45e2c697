package io.github.jakubt4.astrolabe.error;

/**
 * Unknown analysis id, divisional factor, technique, house system or similar.
 */
public class UnsupportedParameterException extends AstrolabeException {

    private final String parameter;

    public UnsupportedParameterException(final String parameter, final Object value) {
        super("Unsupported " + parameter + " [" + value + "]");
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public String code() {
        return "UNSUPPORTED_PARAMETER";
    }
}
