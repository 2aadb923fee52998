package com.example.reviewbot.repo;

import com.example.reviewbot.model.QuotaCounter;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-subject quota counters with atomic single-document updates.
 */
public interface QuotaCounterStore {

    Optional<QuotaCounter> find(long subjectId);

    /** Creates an empty counter, or returns the one a concurrent caller created first. */
    QuotaCounter create(long subjectId, String windowDate);

    /**
     * Counts one accepted message: lifetime always +1, daily +1 inside {@code today}'s
     * window or reset to 1 when the stored window is an older day.
     */
    void increment(long subjectId, String today, Instant at);
}
