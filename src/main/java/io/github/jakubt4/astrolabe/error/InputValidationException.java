package io.github.jakubt4.astrolabe.error;

import java.util.List;

public class InputValidationException extends AstrolabeException {

    private final List<String> missingFields;

    public InputValidationException(final String message) {
        this(message, List.of());
    }

    public InputValidationException(final String message, final List<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }

    public static InputValidationException missing(final List<String> fields) {
        return new InputValidationException("Missing required fields: " + String.join(", ", fields), fields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }

    @Override
    public String code() {
        return "INPUT_VALIDATION";
    }
}
