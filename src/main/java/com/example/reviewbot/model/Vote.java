package com.example.reviewbot.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("votes")
public class Vote {
    /** {@code <voterId>#<reviewId>}, which makes the (voter, review) pair unique. */
    @Id
    private String voteId;
    @Indexed
    private String reviewId;
    private long userId;
    private VoteDirection direction;
    private Instant createdAt;

    public static String idFor(long voterId, String reviewId) {
        return voterId + "#" + reviewId;
    }
}
