package com.example.reviewbot.session;

import com.example.reviewbot.model.ConversationState;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.example.reviewbot.model.ConversationState.*;
import static org.junit.jupiter.api.Assertions.*;

class StateTransitionsTest {

    @Test
    void testRootReachableFromEveryState() {
        for (ConversationState from : ConversationState.values()) {
            assertTrue(StateTransitions.isValidTransition(from, ROOT), from + " -> ROOT");
        }
        assertTrue(StateTransitions.isValidTransition(null, ROOT));
    }

    @Test
    void testOnlyAllowListedEdgesAreValid() {
        for (ConversationState from : ConversationState.values()) {
            Set<ConversationState> allowed = StateTransitions.allowedFrom(from);
            for (ConversationState to : ConversationState.values()) {
                boolean expected = to == ROOT || to == from || allowed.contains(to);
                assertEquals(expected, StateTransitions.isValidTransition(from, to), from + " -> " + to);
            }
        }
    }

    @Test
    void testDraftingMovesOnlyToRootRecordOrProfileName() {
        assertTrue(StateTransitions.isValidTransition(DRAFTING, VIEWING_RECORD));
        assertTrue(StateTransitions.isValidTransition(DRAFTING, COLLECTING_PROFILE_NAME));
        assertFalse(StateTransitions.isValidTransition(DRAFTING, BROWSING));
        assertFalse(StateTransitions.isValidTransition(DRAFTING, EDITING_RECORD));
        assertFalse(StateTransitions.isValidTransition(DRAFTING, COLLECTING_PROFILE_TAG));
    }

    @Test
    void testMissingSessionBehavesAsRoot() {
        assertTrue(StateTransitions.isValidTransition(null, BROWSING));
        assertFalse(StateTransitions.isValidTransition(null, EDITING_RECORD_TEXT));
    }

    @Test
    void testEditingFlow() {
        assertTrue(StateTransitions.isValidTransition(VIEWING_OWN_RECORDS, EDITING_RECORD));
        assertTrue(StateTransitions.isValidTransition(EDITING_RECORD, EDITING_RECORD_TEXT));
        assertTrue(StateTransitions.isValidTransition(EDITING_RECORD_TEXT, EDITING_RECORD));
        assertFalse(StateTransitions.isValidTransition(BROWSING, EDITING_RECORD));
        assertFalse(StateTransitions.isValidTransition(ROOT, EDITING_RECORD_TEXT));
    }
}
