package com.example.reviewbot.router;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventKind {
    COMMAND,
    CALLBACK,
    TEXT;

    @JsonCreator
    public static EventKind fromJson(String value) {
        return value == null ? null : EventKind.valueOf(value.trim().toUpperCase());
    }

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
