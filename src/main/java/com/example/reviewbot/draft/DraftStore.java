package com.example.reviewbot.draft;

import com.example.reviewbot.kv.KvClient;
import com.example.reviewbot.model.ReviewDraft;
import com.example.reviewbot.store.StoreRetry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived draft storage in the shared KV store, TTL equal to the session window.
 */
@Component
public class DraftStore {

    private static final Logger logger = LoggerFactory.getLogger(DraftStore.class);

    static final String KEY_PREFIX = "draft:";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final StoreRetry storeRetry;

    @Value("${app.session.inactivity-window-ms:1800000}")
    private long ttlMs;

    public DraftStore(KvClient kvClient, ObjectMapper objectMapper, StoreRetry storeRetry) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.storeRetry = storeRetry;
    }

    public Optional<ReviewDraft> get(long subjectId) {
        Optional<String> json = storeRetry.call("draft.get", () -> kvClient.get(key(subjectId)));
        if (json.isEmpty()) return Optional.empty();
        try {
            return Optional.of(objectMapper.readValue(json.get(), ReviewDraft.class));
        } catch (JsonProcessingException e) {
            logger.warn("Dropping unreadable draft of {}: {}", subjectId, e.getOriginalMessage());
            delete(subjectId);
            return Optional.empty();
        }
    }

    public void put(ReviewDraft draft) {
        String json;
        try {
            json = objectMapper.writeValueAsString(draft);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize draft of " + draft.getSubjectId(), e);
        }
        storeRetry.run("draft.set", () -> kvClient.set(key(draft.getSubjectId()), json, Duration.ofMillis(ttlMs)));
    }

    public void delete(long subjectId) {
        storeRetry.run("draft.del", () -> kvClient.del(key(subjectId)));
    }

    private static String key(long subjectId) {
        return KEY_PREFIX + subjectId;
    }
}
