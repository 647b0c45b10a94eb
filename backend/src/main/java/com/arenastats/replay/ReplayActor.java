package com.arenastats.replay;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReplayActor {
    YOU("you"),
    OPPONENT("opponent"),
    UNKNOWN("unknown");

    private final String value;

    ReplayActor(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
