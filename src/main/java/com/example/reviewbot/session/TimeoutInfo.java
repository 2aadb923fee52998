package com.example.reviewbot.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Time left before the warning and the expiry of a session, both clamped at zero.
 */
public record TimeoutInfo(Instant lastActivityAt,
                          Duration timeUntilWarning,
                          Duration timeUntilExpiry,
                          boolean isExpired,
                          boolean needsWarning) {

    public static TimeoutInfo compute(Instant lastActivityAt, Instant now, Duration window, Duration warningLead) {
        Duration elapsed = Duration.between(lastActivityAt, now);
        Duration untilExpiry = window.minus(elapsed);
        Duration untilWarning = window.minus(warningLead).minus(elapsed);
        boolean expired = untilExpiry.isNegative() || untilExpiry.isZero();
        boolean warn = !expired && untilExpiry.compareTo(warningLead) <= 0;
        return new TimeoutInfo(lastActivityAt, clamp(untilWarning), clamp(untilExpiry), expired, warn);
    }

    private static Duration clamp(Duration d) {
        return d.isNegative() ? Duration.ZERO : d;
    }

    public Map<String, Object> toMap() {
        return Map.of(
                "lastActivityAt", lastActivityAt.toString(),
                "timeUntilWarningMs", timeUntilWarning.toMillis(),
                "timeUntilExpiryMs", timeUntilExpiry.toMillis(),
                "isExpired", isExpired,
                "needsWarning", needsWarning
        );
    }
}
