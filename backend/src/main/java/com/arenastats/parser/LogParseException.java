package com.arenastats.parser;

/**
 * Error raised while reading a client log.
 */
public class LogParseException extends RuntimeException {

    private final String details;

    public LogParseException(String message, String details) {
        super(buildMessage(message, details));
        this.details = details;
    }

    public LogParseException(String message, String details, Throwable cause) {
        super(buildMessage(message, details), cause);
        this.details = details;
    }

    public String getDetails() {
        return details;
    }

    private static String buildMessage(String message, String details) {
        return details == null ? message : message + ": " + details;
    }
}
