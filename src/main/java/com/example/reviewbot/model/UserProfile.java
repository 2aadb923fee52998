package com.example.reviewbot.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/** Public name shown on non-anonymous reviews. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("profiles")
public class UserProfile {
    @Id
    private Long subjectId;
    private String name;
    private String promotion;
    private Instant createdAt;
    private Instant lastActive;
}
