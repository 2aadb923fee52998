package com.example.reviewbot.session;

import com.example.reviewbot.error.InvalidTransitionException;
import com.example.reviewbot.model.ConversationState;
import com.example.reviewbot.model.Session;
import com.example.reviewbot.model.SessionContext;
import org.springframework.stereotype.Component;

/**
 * Transition-checked access to the session store for step handlers.
 */
@Component
public class ConversationFlow {

    private final SessionStore sessionStore;

    public ConversationFlow(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    /** The live session, or a transient ROOT session when there is none. */
    public Session current(long subjectId) {
        return sessionStore.getState(subjectId).orElseGet(() -> Session.builder()
                .subjectId(subjectId)
                .state(ConversationState.ROOT)
                .context(SessionContext.empty())
                .build());
    }

    public SessionContext context(long subjectId) {
        SessionContext context = current(subjectId).getContext();
        return context == null ? SessionContext.empty() : context;
    }

    public Session moveTo(long subjectId, ConversationState to) {
        return moveTo(subjectId, to, null);
    }

    /**
     * @throws InvalidTransitionException if the allow-list has no edge from the current state to {@code to}
     */
    public Session moveTo(long subjectId, ConversationState to, SessionContext context) {
        ConversationState from = current(subjectId).getState();
        if (!StateTransitions.isValidTransition(from, to)) {
            throw new InvalidTransitionException(from, to);
        }
        return sessionStore.setState(subjectId, to, context);
    }

    /** Escape hatch; always allowed. */
    public Session reset(long subjectId) {
        return sessionStore.setState(subjectId, ConversationState.ROOT);
    }
}
