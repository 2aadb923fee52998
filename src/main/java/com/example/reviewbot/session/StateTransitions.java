package com.example.reviewbot.session;

import com.example.reviewbot.model.ConversationState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.example.reviewbot.model.ConversationState.*;

/**
 * Allow-list of conversation moves. ROOT is reachable from everywhere, and staying
 * in the same state to update its context is always allowed.
 */
public final class StateTransitions {

    private static final Map<ConversationState, Set<ConversationState>> ALLOWED = new EnumMap<>(ConversationState.class);

    static {
        ALLOWED.put(ROOT, EnumSet.of(BROWSING, DRAFTING, VIEWING_OWN_RECORDS));
        ALLOWED.put(BROWSING, EnumSet.of(ROOT, VIEWING_RECORD));
        ALLOWED.put(VIEWING_RECORD, EnumSet.of(BROWSING, ROOT, DRAFTING));
        ALLOWED.put(DRAFTING, EnumSet.of(ROOT, VIEWING_RECORD, COLLECTING_PROFILE_NAME));
        ALLOWED.put(COLLECTING_PROFILE_NAME, EnumSet.of(ROOT, COLLECTING_PROFILE_TAG));
        ALLOWED.put(COLLECTING_PROFILE_TAG, EnumSet.of(ROOT, DRAFTING));
        ALLOWED.put(VIEWING_OWN_RECORDS, EnumSet.of(ROOT, DRAFTING, VIEWING_RECORD, EDITING_RECORD));
        ALLOWED.put(EDITING_RECORD, EnumSet.of(VIEWING_OWN_RECORDS, ROOT, EDITING_RECORD_TEXT));
        ALLOWED.put(EDITING_RECORD_TEXT, EnumSet.of(EDITING_RECORD, VIEWING_OWN_RECORDS, ROOT));
    }

    private StateTransitions() {
    }

    /** A null {@code from} stands for a subject without a live session, which sits at ROOT. */
    public static boolean isValidTransition(ConversationState from, ConversationState to) {
        if (to == ROOT) return true;
        if (to == null) return false;
        ConversationState current = from == null ? ROOT : from;
        if (current == to) return true;
        return ALLOWED.getOrDefault(current, Collections.emptySet()).contains(to);
    }

    public static Set<ConversationState> allowedFrom(ConversationState from) {
        Set<ConversationState> targets = EnumSet.of(ROOT);
        targets.addAll(ALLOWED.getOrDefault(from == null ? ROOT : from, Collections.emptySet()));
        return Collections.unmodifiableSet(targets);
    }
}
