package com.example.reviewbot.transport;

import com.example.reviewbot.router.BotReply;

/**
 * Delivers messages that are not a direct reply to an inbound event.
 */
public interface ChatTransport {
    void send(long subjectId, BotReply reply);
}
