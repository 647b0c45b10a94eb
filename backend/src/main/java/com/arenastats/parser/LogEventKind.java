package com.arenastats.parser;

/**
 * Payload kinds recognised in the client log, in classification priority order.
 */
public enum LogEventKind {
    MATCH_STATE,
    GRE_EVENT,
    COURSE_DECK,
    DECK_UPSERT,
    DECK_SET,
    GAME_STATE
}
