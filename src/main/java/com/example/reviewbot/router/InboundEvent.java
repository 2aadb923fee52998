package com.example.reviewbot.router;

/**
 * One event from the messaging transport. Exactly one of the token/text fields is
 * expected to match {@code kind}.
 */
public record InboundEvent(long subjectId,
                           EventKind kind,
                           String commandToken,
                           String callbackToken,
                           String text) {

    public static InboundEvent command(long subjectId, String command) {
        return new InboundEvent(subjectId, EventKind.COMMAND, command, null, null);
    }

    public static InboundEvent callback(long subjectId, String token) {
        return new InboundEvent(subjectId, EventKind.CALLBACK, null, token, null);
    }

    public static InboundEvent text(long subjectId, String text) {
        return new InboundEvent(subjectId, EventKind.TEXT, null, null, text);
    }
}
