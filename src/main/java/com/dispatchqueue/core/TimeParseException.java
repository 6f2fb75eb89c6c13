package com.dispatchqueue.core;

// Thrown when a schedule expression is neither a relative time nor a parseable date
public class TimeParseException extends RuntimeException {

    private final String input;

    public TimeParseException(String input) {
        super("Unable to parse date: " + input);
        this.input = input;
    }

    public TimeParseException(String input, Throwable cause) {
        super("Unable to parse date: " + input, cause);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
