package com.example.reviewbot.error;

/**
 * Raised once the store boundary has given up retrying. Never shown verbatim.
 */
public class StoreUnavailableException extends ReviewBotException {

    private final String operation;

    public StoreUnavailableException(String operation, Throwable cause) {
        super("Store unavailable during " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
