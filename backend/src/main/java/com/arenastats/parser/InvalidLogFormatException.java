package com.arenastats.parser;

/**
 * The file cannot be read as a client log at all.
 */
public class InvalidLogFormatException extends LogParseException {

    public InvalidLogFormatException(String message, String details) {
        super(message, details);
    }

    public InvalidLogFormatException(String message, String details, Throwable cause) {
        super(message, details, cause);
    }
}
