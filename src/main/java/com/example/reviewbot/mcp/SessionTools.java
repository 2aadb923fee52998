package com.example.reviewbot.mcp;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.model.ReviewDraft;
import com.example.reviewbot.model.Session;
import com.example.reviewbot.quota.QuotaGate;
import com.example.reviewbot.session.SessionStore;
import com.example.reviewbot.session.TimeoutSupervisor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operator tools for inspecting and resetting a subject's conversation.
 */
@Service
public class SessionTools {

    private final SessionStore sessionStore;
    private final TimeoutSupervisor timeoutSupervisor;
    private final QuotaGate quotaGate;
    private final DraftEditor draftEditor;

    public SessionTools(SessionStore sessionStore, TimeoutSupervisor timeoutSupervisor,
                        QuotaGate quotaGate, DraftEditor draftEditor) {
        this.sessionStore = sessionStore;
        this.timeoutSupervisor = timeoutSupervisor;
        this.quotaGate = quotaGate;
        this.draftEditor = draftEditor;
    }

    @Tool(description = "Get the live conversation session of a subject (state, context, last activity)")
    public Map<String,Object> session_get(Long subjectId) {
        Optional<Session> session = sessionStore.getState(subjectId);
        Map<String, Object> result = new HashMap<>();
        result.put("subjectId", subjectId);
        result.put("present", session.isPresent());
        session.ifPresent(s -> {
            result.put("state", s.getState().name());
            result.put("context", s.getContext());
            result.put("lastActivityAt", s.getLastActivityAt().toString());
        });
        return result;
    }

    @Tool(description = "Time remaining before the inactivity warning and expiry of a subject's session")
    public Map<String,Object> session_timeout_info(Long subjectId) {
        return timeoutSupervisor.getTimeoutInfo(subjectId)
                .map(info -> {
                    Map<String, Object> view = new HashMap<>(info.toMap());
                    view.put("subjectId", subjectId);
                    view.put("present", true);
                    return view;
                })
                .orElseGet(() -> Map.of("subjectId", subjectId, "present", false));
    }

    @Tool(description = "Clear a subject's session and drop their draft, returning them to the main menu")
    public Map<String,Object> session_clear(Long subjectId) {
        draftEditor.discard(subjectId);
        sessionStore.clear(subjectId);
        timeoutSupervisor.cancel(subjectId);
        return Map.of("ok", true, "subjectId", subjectId);
    }

    @Tool(description = "Get the review draft a subject is currently writing or editing")
    public Map<String,Object> draft_get(Long subjectId) {
        Optional<ReviewDraft> draft = draftEditor.current(subjectId);
        Map<String, Object> result = new HashMap<>();
        result.put("subjectId", subjectId);
        result.put("draft", draft.orElse(null));
        return result;
    }

    @Tool(description = "Daily and lifetime message quota status of a subject")
    public Map<String,Object> quota_status(Long subjectId) {
        return quotaGate.status(subjectId).toMap();
    }
}
