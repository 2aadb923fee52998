package com.example.reviewbot.model;

import lombok.*;

import java.time.Instant;

/**
 * Review being written or edited. Lives in the KV store under {@code draft:<subjectId>}
 * with the session inactivity window as TTL; never written to MongoDB.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReviewDraft {
    private long subjectId;
    private String targetCourseId;
    private Ratings ratings;
    private String text;
    private boolean anonymous;
    /** Set when editing an existing review, null for a new one. */
    private String sourceReviewId;
    /** True while a commit for this draft is in flight. */
    private boolean submitting;
    private Instant startedAt;
}
