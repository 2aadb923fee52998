package com.example.reviewbot.router;

import java.util.List;

/**
 * Response handed to the transport: its class, the message text and keyboard rows.
 * Rendering is the transport's business.
 */
public record BotReply(ReplyType type, String text, List<List<Button>> keyboard) {

    public BotReply {
        keyboard = keyboard == null ? List.of() : List.copyOf(keyboard);
    }

    public static BotReply of(ReplyType type, String text) {
        return new BotReply(type, text, List.of());
    }

    public static BotReply success(String text, List<List<Button>> keyboard) {
        return new BotReply(ReplyType.SUCCESS, text, keyboard);
    }

    public BotReply withKeyboard(List<List<Button>> rows) {
        return new BotReply(type, text, rows);
    }

    /** True if some button carries {@code token}. */
    public boolean offers(String token) {
        return keyboard.stream().flatMap(List::stream).anyMatch(b -> b.token().equals(token));
    }
}
