package com.example.reviewbot.kv;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Shared key-value store holding per-subject conversation state.
 * Every instance of the bot sees the same keys.
 */
public interface KvClient {
    Optional<String> get(String key);
    Map<String,String> mget(List<String> keys);
    void set(String key, String value, Duration ttl);

    /**
     * Writes only when the key does not exist yet.
     *
     * @return true if this call created the key
     */
    boolean setIfAbsent(String key, String value, Duration ttl);

    void del(String key);
    Optional<Duration> ttl(String key);
    List<String> scan(String prefix, int limit);
}
