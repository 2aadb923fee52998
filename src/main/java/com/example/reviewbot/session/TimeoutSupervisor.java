package com.example.reviewbot.session;

import com.example.reviewbot.kv.KvClient;
import com.example.reviewbot.model.Session;
import com.example.reviewbot.store.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;

/**
 * Inactivity warning and expiry per session.
 * <p>
 * {@link #getTimeoutInfo(long)} is computed from the stored activity time only. The local
 * timers are a fast path; {@link #sweep(int)} covers sessions whose timers lived on another
 * instance or were lost. Both paths claim a notice key in the KV store before calling the
 * listener, so a notice goes out once per activity epoch.
 */
@Service
public class TimeoutSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(TimeoutSupervisor.class);

    static final String NOTICE_PREFIX = "notice:";

    private final SessionStore sessionStore;
    private final KvClient kvClient;
    private final StoreRetry storeRetry;
    private final List<TimeoutListener> listeners;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final Map<Long, Deadlines> deadlines = new ConcurrentHashMap<>();

    @Value("${app.session.warning-lead-ms:300000}")
    private long warningLeadMs;

    public TimeoutSupervisor(SessionStore sessionStore, KvClient kvClient, StoreRetry storeRetry,
                             List<TimeoutListener> listeners, Clock clock) {
        this.sessionStore = sessionStore;
        this.kvClient = kvClient;
        this.storeRetry = storeRetry;
        this.listeners = listeners;
        this.clock = clock;
        this.scheduler = Executors.newScheduledThreadPool(1, r -> {
            Thread t = new Thread(r, "session-timeout");
            t.setDaemon(true);
            return t;
        });
    }

    /** Renews activity of a live session and reschedules both deadlines. */
    public Optional<Session> renew(long subjectId) {
        Optional<Session> renewed = sessionStore.renew(subjectId);
        renewed.ifPresent(this::schedule);
        return renewed;
    }

    /** Re-reads the stored session and aligns the timers with it. */
    public void track(long subjectId) {
        Optional<Session> stored = sessionStore.peek(subjectId);
        if (stored.isPresent()) {
            schedule(stored.get());
        } else {
            cancel(subjectId);
        }
    }

    public void cancel(long subjectId) {
        Deadlines old = deadlines.remove(subjectId);
        if (old != null) old.cancel();
    }

    public Optional<TimeoutInfo> getTimeoutInfo(long subjectId) {
        return sessionStore.peek(subjectId).map(this::timeoutInfo);
    }

    public TimeoutInfo timeoutInfo(Session session) {
        return TimeoutInfo.compute(session.getLastActivityAt(), clock.instant(),
                sessionStore.inactivityWindow(), warningLead());
    }

    /**
     * Delivers notices for stored sessions that are due, whether or not a local timer exists.
     *
     * @return number of notices delivered
     */
    public int sweep(int limit) {
        int delivered = 0;
        for (Session session : sessionStore.scan(limit)) {
            if (session.getLastActivityAt() == null) continue;
            TimeoutInfo info = timeoutInfo(session);
            if (info.isExpired()) {
                if (expire(session)) delivered++;
            } else if (info.needsWarning()) {
                if (warn(session, info)) delivered++;
            }
        }
        return delivered;
    }

    void fireWarning(long subjectId) {
        try {
            Optional<Session> live = sessionStore.getState(subjectId);
            if (live.isEmpty()) return;
            TimeoutInfo info = timeoutInfo(live.get());
            if (info.needsWarning()) {
                warn(live.get(), info);
            }
        } catch (RuntimeException e) {
            logger.warn("Warning timer failed for subject {}: {}", subjectId, e.getMessage());
        }
    }

    void fireExpiry(long subjectId) {
        try {
            Optional<Session> stored = sessionStore.peek(subjectId);
            if (stored.isEmpty()) {
                deadlines.remove(subjectId);
                return;
            }
            if (timeoutInfo(stored.get()).isExpired()) {
                expire(stored.get());
            } else {
                // renewed on another instance since this timer was set
                schedule(stored.get());
            }
        } catch (RuntimeException e) {
            logger.warn("Expiry timer failed for subject {}: {}", subjectId, e.getMessage());
        }
    }

    private boolean warn(Session session, TimeoutInfo info) {
        if (!claim("warning", session)) return false;
        logger.info("Session {} inactive, expires in {}s", session.getSubjectId(), info.timeUntilExpiry().toSeconds());
        for (TimeoutListener listener : listeners) {
            listener.onWarning(session.getSubjectId(), info);
        }
        return true;
    }

    private boolean expire(Session session) {
        long subjectId = session.getSubjectId();
        Optional<Session> current = sessionStore.peek(subjectId);
        if (current.isPresent() && !session.getLastActivityAt().equals(current.get().getLastActivityAt())) {
            // renewed since it was read
            return false;
        }
        sessionStore.clear(subjectId);
        cancel(subjectId);
        if (!claim("expiry", session)) return false;
        logger.info("Session {} expired after inactivity", subjectId);
        for (TimeoutListener listener : listeners) {
            listener.onExpired(subjectId);
        }
        return true;
    }

    private boolean claim(String kind, Session session) {
        String key = NOTICE_PREFIX + kind + ":" + session.getSubjectId() + ":" + session.getLastActivityAt().toEpochMilli();
        return storeRetry.call("notice.claim",
                () -> kvClient.setIfAbsent(key, clock.instant().toString(), sessionStore.inactivityWindow().multipliedBy(2)));
    }

    private void schedule(Session session) {
        long subjectId = session.getSubjectId();
        TimeoutInfo info = timeoutInfo(session);
        Deadlines next = new Deadlines(
                info.timeUntilWarning().isZero() ? null
                        : scheduler.schedule(() -> fireWarning(subjectId), info.timeUntilWarning().toMillis(), TimeUnit.MILLISECONDS),
                scheduler.schedule(() -> fireExpiry(subjectId), info.timeUntilExpiry().toMillis(), TimeUnit.MILLISECONDS));
        Deadlines old = deadlines.put(subjectId, next);
        if (old != null) old.cancel();
    }

    int scheduledCount() {
        return deadlines.size();
    }

    Duration warningLead() {
        return Duration.ofMillis(warningLeadMs);
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    private static final class Deadlines {
        private final ScheduledFuture<?> warning;
        private final ScheduledFuture<?> expiry;

        Deadlines(ScheduledFuture<?> warning, ScheduledFuture<?> expiry) {
            this.warning = warning;
            this.expiry = expiry;
        }

        void cancel() {
            if (warning != null) warning.cancel(false);
            expiry.cancel(false);
        }
    }
}
