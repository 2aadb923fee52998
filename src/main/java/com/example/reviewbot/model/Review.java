package com.example.reviewbot.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A committed review. At most one live (non-deleted) review per user and course,
 * enforced by the partial unique index.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("reviews")
@CompoundIndex(name = "user_course_live", def = "{'userId': 1, 'courseId': 1}",
        unique = true, partialFilter = "{'deleted': false}")
public class Review {
    @Id
    private String reviewId;
    @Indexed
    private String courseId;
    private long userId;
    private Ratings ratings;
    private String text;
    private boolean anonymous;
    private Instant createdAt;
    private Instant updatedAt;
    private boolean deleted;
    @Version
    private Long version;
}
