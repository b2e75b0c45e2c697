package io.github.jakubt4.astrolabe.error;

public class OutOfRangeInstantException extends AstrolabeException {

    public OutOfRangeInstantException(final String message) {
        super(message);
    }

    @Override
    public String code() {
        return "OUT_OF_RANGE_INSTANT";
    }
}
