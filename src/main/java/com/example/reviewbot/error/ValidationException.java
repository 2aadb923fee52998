package com.example.reviewbot.error;

public class ValidationException extends ReviewBotException {

    public ValidationException(String message) {
        super(message);
    }
}
