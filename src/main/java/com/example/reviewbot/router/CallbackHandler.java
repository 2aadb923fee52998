package com.example.reviewbot.router;

import java.util.Set;

/**
 * Step handler for button taps. Each action is owned by exactly one handler.
 */
public interface CallbackHandler {

    Set<CallbackAction> actions();

    BotReply handle(long subjectId, CallbackToken token);
}
