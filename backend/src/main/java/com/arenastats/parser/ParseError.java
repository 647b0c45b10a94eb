package com.arenastats.parser;

/**
 * A single event that could not be processed. Parsing carried on past it.
 */
public record ParseError(LogEventKind eventKind, int lineNumber, String message) {
}
