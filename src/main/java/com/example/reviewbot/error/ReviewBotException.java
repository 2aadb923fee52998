package com.example.reviewbot.error;

/**
 * Base type for failures the event router knows how to turn into a reply.
 * The message is safe to show to the subject unless a subclass says otherwise.
 */
public class ReviewBotException extends RuntimeException {

    public ReviewBotException(String message) {
        super(message);
    }

    public ReviewBotException(String message, Throwable cause) {
        super(message, cause);
    }
}
