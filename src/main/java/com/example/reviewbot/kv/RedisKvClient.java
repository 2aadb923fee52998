package com.example.reviewbot.kv;

import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.*;

/**
 * Redis-backed {@link KvClient}. Sessions, drafts and notice claims all carry a TTL;
 * a missing or non-positive TTL writes a persistent key.
 */
@Component
public class RedisKvClient implements KvClient {

    private final StringRedisTemplate redis;
    private final ValueOperations<String, String> values;

    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
        this.values = redis.opsForValue();
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public Map<String, String> mget(List<String> keys) {
        Map<String, String> result = new LinkedHashMap<>();
        if (keys.isEmpty()) return result;
        // answered positionally, null for missing keys
        List<String> found = values.multiGet(keys);
        Iterator<String> it = found == null ? Collections.emptyIterator() : found.iterator();
        for (String key : keys) {
            result.put(key, it.hasNext() ? it.next() : null);
        }
        return result;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (expires(ttl)) {
            values.set(key, value, ttl);
        } else {
            values.set(key, value);
        }
    }

    @Override
    public boolean setIfAbsent(String key, String value, Duration ttl) {
        Boolean created = expires(ttl) ? values.setIfAbsent(key, value, ttl) : values.setIfAbsent(key, value);
        return Boolean.TRUE.equals(created);
    }

    @Override
    public void del(String key) {
        redis.delete(key);
    }

    @Override
    public Optional<Duration> ttl(String key) {
        Long seconds = redis.getExpire(key);
        return seconds == null || seconds < 0 ? Optional.empty() : Optional.of(Duration.ofSeconds(seconds));
    }

    @Override
    public List<String> scan(String prefix, int limit) {
        ScanOptions options = ScanOptions.scanOptions().match(prefix + "*").count(Math.max(limit, 100)).build();
        List<String> keys = new ArrayList<>();
        try (Cursor<String> cursor = redis.scan(options)) {
            while (cursor.hasNext() && keys.size() < limit) {
                keys.add(cursor.next());
            }
        }
        return keys;
    }

    private static boolean expires(Duration ttl) {
        return ttl != null && !ttl.isZero() && !ttl.isNegative();
    }
}
