package com.arenastats.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.OffsetDateTime;

/**
 * A classified JSON payload lifted out of the log.
 *
 * @param kind Classified payload kind
 * @param payload Parsed JSON object
 * @param timestampMs Epoch-millisecond timestamp carried by the payload itself, if any
 * @param lineNumber Line on which the payload finished
 * @param loggerTimestamp Last logger-prefix timestamp seen before the payload
 */
public record RawEvent(
        LogEventKind kind,
        JsonNode payload,
        Long timestampMs,
        int lineNumber,
        OffsetDateTime loggerTimestamp
) {
}
