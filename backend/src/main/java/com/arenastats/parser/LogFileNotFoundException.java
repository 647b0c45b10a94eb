package com.arenastats.parser;

public class LogFileNotFoundException extends LogParseException {

    public LogFileNotFoundException(String path) {
        super("Log file not found", path);
    }
}
