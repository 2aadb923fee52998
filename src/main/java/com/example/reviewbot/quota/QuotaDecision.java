package com.example.reviewbot.quota;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Outcome of a quota check. {@code reason} is null when allowed; {@code resetTime}
 * is only set for a daily denial.
 */
public record QuotaDecision(boolean allowed,
                            int dailyCount,
                            long lifetimeCount,
                            int dailyLimit,
                            long lifetimeLimit,
                            DenialReason reason,
                            Instant resetTime) {

    public static QuotaDecision allow(int dailyCount, long lifetimeCount, int dailyLimit, long lifetimeLimit) {
        return new QuotaDecision(true, dailyCount, lifetimeCount, dailyLimit, lifetimeLimit, null, null);
    }

    public static QuotaDecision deny(DenialReason reason, Instant resetTime,
                                     int dailyCount, long lifetimeCount, int dailyLimit, long lifetimeLimit) {
        return new QuotaDecision(false, dailyCount, lifetimeCount, dailyLimit, lifetimeLimit, reason, resetTime);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("allowed", allowed);
        map.put("dailyCount", dailyCount);
        map.put("lifetimeCount", lifetimeCount);
        map.put("dailyLimit", dailyLimit);
        map.put("lifetimeLimit", lifetimeLimit);
        map.put("reason", reason == null ? null : reason.name().toLowerCase());
        map.put("resetTime", resetTime == null ? null : resetTime.toString());
        return map;
    }
}
