package com.example.reviewbot.error;

public class ConflictException extends ReviewBotException {

    public ConflictException(String message) {
        super(message);
    }
}
