package com.example.reviewbot.session;

import com.example.reviewbot.kv.KvClient;
import com.example.reviewbot.model.ConversationState;
import com.example.reviewbot.model.Session;
import com.example.reviewbot.model.SessionContext;
import com.example.reviewbot.store.StoreRetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Current conversation state per subject, kept in the shared KV store.
 * <p>
 * Expiry is decided from {@code lastActivityAt} on every read. The Redis TTL is twice
 * the inactivity window, so an expired session stays visible long enough for the
 * timeout sweep to announce it; it only exists to keep the keyspace clean.
 * The store does not check transitions; callers consult {@link StateTransitions}.
 */
@Service
public class SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(SessionStore.class);

    static final String KEY_PREFIX = "session:";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final StoreRetry storeRetry;
    private final Clock clock;

    @Value("${app.session.inactivity-window-ms:1800000}")
    private long inactivityWindowMs;

    public SessionStore(KvClient kvClient, ObjectMapper objectMapper, StoreRetry storeRetry, Clock clock) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public Session setState(long subjectId, ConversationState state) {
        return setState(subjectId, state, null);
    }

    public Session setState(long subjectId, ConversationState state, SessionContext context) {
        Session session = Session.builder()
                .subjectId(subjectId)
                .state(state)
                .context(context == null ? SessionContext.empty() : context)
                .lastActivityAt(clock.instant())
                .build();
        write(session);
        logger.debug("Session {} -> {}", subjectId, state);
        return session;
    }

    /** Live session, or empty. An expired session is deleted as a side effect. */
    public Optional<Session> getState(long subjectId) {
        Optional<Session> stored = peek(subjectId);
        if (stored.isPresent() && isExpired(stored.get())) {
            logger.debug("Session {} expired (last activity {})", subjectId, stored.get().getLastActivityAt());
            clear(subjectId);
            return Optional.empty();
        }
        return stored;
    }

    /** Stored session regardless of expiry. Used by the timeout supervisor. */
    public Optional<Session> peek(long subjectId) {
        return storeRetry.call("session.get", () -> kvClient.get(key(subjectId)))
                .flatMap(json -> parse(key(subjectId), json));
    }

    public void clear(long subjectId) {
        storeRetry.run("session.clear", () -> kvClient.del(key(subjectId)));
    }

    /** Bumps activity of a live session without touching its state. No-op when absent. */
    public Optional<Session> renew(long subjectId) {
        Optional<Session> live = getState(subjectId);
        live.ifPresent(session -> {
            session.setLastActivityAt(clock.instant());
            write(session);
        });
        return live;
    }

    public boolean isExpired(Session session) {
        Instant last = session.getLastActivityAt();
        if (last == null) return true;
        return Duration.between(last, clock.instant()).compareTo(inactivityWindow()) > 0;
    }

    public Duration inactivityWindow() {
        return Duration.ofMillis(inactivityWindowMs);
    }

    /** Stored sessions, expired ones included, up to {@code limit}. */
    public List<Session> scan(int limit) {
        List<String> keys = storeRetry.call("session.scan", () -> kvClient.scan(KEY_PREFIX, limit));
        if (keys.isEmpty()) return List.of();
        Map<String, String> values = storeRetry.call("session.mget", () -> kvClient.mget(keys));
        List<Session> sessions = new ArrayList<>();
        values.forEach((key, json) -> {
            if (json != null) parse(key, json).ifPresent(sessions::add);
        });
        return sessions;
    }

    private void write(Session session) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize session " + session.getSubjectId(), e);
        }
        storeRetry.run("session.set", () -> kvClient.set(key(session.getSubjectId()), json, inactivityWindow().multipliedBy(2)));
    }

    private Optional<Session> parse(String key, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, Session.class));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable session {}: {}", key, e.getOriginalMessage());
            storeRetry.run("session.clear", () -> kvClient.del(key));
            return Optional.empty();
        }
    }

    private static String key(long subjectId) {
        return KEY_PREFIX + subjectId;
    }
}
