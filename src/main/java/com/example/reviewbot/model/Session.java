package com.example.reviewbot.model;

import lombok.*;

import java.time.Instant;

/** Conversation position of one subject, stored as JSON under {@code session:<subjectId>}. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Session {
    private long subjectId;
    private ConversationState state;
    private SessionContext context;
    private Instant lastActivityAt;
}
