package com.example.reviewbot.router;

/** Which class of response was chosen for an event. */
public enum ReplyType {
    SUCCESS,
    VALIDATION_ERROR,
    RATE_LIMITED,
    UNKNOWN_COMMAND,
    UNKNOWN_ACTION,
    UNRECOGNIZED_INPUT,
    DUPLICATE_SUBMISSION,
    NOT_FOUND,
    CONFLICT,
    RESET,
    UNAVAILABLE,
    IGNORED,
    TIMEOUT_WARNING,
    TIMEOUT_EXPIRED
}
