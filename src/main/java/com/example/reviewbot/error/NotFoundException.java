package com.example.reviewbot.error;

public class NotFoundException extends ReviewBotException {

    public NotFoundException(String message) {
        super(message);
    }
}
