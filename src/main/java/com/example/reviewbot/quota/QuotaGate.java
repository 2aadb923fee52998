package com.example.reviewbot.quota;

import com.example.reviewbot.model.QuotaCounter;
import com.example.reviewbot.repo.QuotaCounterStore;
import com.example.reviewbot.store.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Daily and lifetime message quota per subject.
 * <p>
 * The daily window is the calendar day in the reference zone. A counter whose
 * {@code windowDate} is an older day counts as zero on read; it is only rewritten
 * by the next {@link #recordAccepted(long)}.
 */
@Service
public class QuotaGate {

    private static final Logger logger = LoggerFactory.getLogger(QuotaGate.class);

    private final QuotaCounterStore counterStore;
    private final StoreRetry storeRetry;
    private final Clock clock;

    @Value("${app.quota.daily-limit:100}")
    private int dailyLimit;

    @Value("${app.quota.lifetime-limit:3000}")
    private long lifetimeLimit;

    @Value("${app.quota.zone:UTC}")
    private String zone;

    public QuotaGate(QuotaCounterStore counterStore, StoreRetry storeRetry, Clock clock) {
        this.counterStore = counterStore;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public QuotaDecision checkAndConsider(long subjectId) {
        LocalDate today = today();
        QuotaCounter counter = storeRetry.call("quota.read",
                () -> counterStore.find(subjectId).orElseGet(() -> counterStore.create(subjectId, today.toString())));
        QuotaDecision decision = decide(counter, today);
        if (!decision.allowed()) {
            logger.debug("Quota denied for {}: {} (daily {}/{}, lifetime {}/{})", subjectId, decision.reason(),
                    decision.dailyCount(), dailyLimit, decision.lifetimeCount(), lifetimeLimit);
        }
        return decision;
    }

    public void recordAccepted(long subjectId) {
        String today = today().toString();
        storeRetry.run("quota.increment", () -> counterStore.increment(subjectId, today, clock.instant()));
    }

    /** Same as {@link #checkAndConsider(long)} but never creates a counter. */
    public QuotaDecision status(long subjectId) {
        LocalDate today = today();
        QuotaCounter counter = storeRetry.call("quota.read", () -> counterStore.find(subjectId))
                .orElseGet(() -> QuotaCounter.builder().subjectId(subjectId).windowDate(today.toString()).build());
        return decide(counter, today);
    }

    private QuotaDecision decide(QuotaCounter counter, LocalDate today) {
        int effectiveDaily = today.toString().equals(counter.getWindowDate()) ? counter.getDailyCount() : 0;
        long lifetime = counter.getLifetimeCount();
        if (effectiveDaily >= dailyLimit) {
            return QuotaDecision.deny(DenialReason.DAILY, nextMidnight(today),
                    effectiveDaily, lifetime, dailyLimit, lifetimeLimit);
        }
        if (lifetime >= lifetimeLimit) {
            return QuotaDecision.deny(DenialReason.LIFETIME, null,
                    effectiveDaily, lifetime, dailyLimit, lifetimeLimit);
        }
        return QuotaDecision.allow(effectiveDaily, lifetime, dailyLimit, lifetimeLimit);
    }

    private LocalDate today() {
        return LocalDate.now(clock.withZone(zoneId()));
    }

    private Instant nextMidnight(LocalDate today) {
        return today.plusDays(1).atStartOfDay(zoneId()).toInstant();
    }

    /** Zone whose midnight closes the daily window. */
    public ZoneId zone() {
        return zoneId();
    }

    private ZoneId zoneId() {
        return ZoneId.of(zone);
    }
}
