package com.example.reviewbot.error;

import com.example.reviewbot.model.ConversationState;

/**
 * A handler tried to move a session along an edge the allow-list does not contain.
 * This is a programming error, so the message is for logs only.
 */
public class InvalidTransitionException extends ReviewBotException {

    private final ConversationState from;
    private final ConversationState to;

    public InvalidTransitionException(ConversationState from, ConversationState to) {
        super("Invalid transition " + from + " -> " + to);
        this.from = from;
        this.to = to;
    }

    public ConversationState getFrom() { return from; }
    public ConversationState getTo() { return to; }
}
