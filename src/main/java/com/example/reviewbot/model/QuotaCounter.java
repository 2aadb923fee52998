package com.example.reviewbot.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Message counters for one subject. {@code dailyCount} only applies while
 * {@code windowDate} (ISO date in the reference zone) is today.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("quota_counters")
public class QuotaCounter {
    @Id
    private Long subjectId;
    private int dailyCount;
    private long lifetimeCount;
    private String windowDate;
    private Instant lastMessageAt;
}
