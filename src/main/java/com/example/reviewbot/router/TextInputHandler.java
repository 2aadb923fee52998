package com.example.reviewbot.router;

import com.example.reviewbot.model.ConversationState;
import com.example.reviewbot.model.Session;

import java.util.Set;

/**
 * Step handler for free text, selected by the subject's current state.
 */
public interface TextInputHandler {

    Set<ConversationState> states();

    BotReply handleText(long subjectId, Session session, String text);
}
