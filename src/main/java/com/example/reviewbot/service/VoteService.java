package com.example.reviewbot.service;

import com.example.reviewbot.error.ConflictException;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.model.Vote;
import com.example.reviewbot.model.VoteDirection;
import com.example.reviewbot.repo.VoteRepo;
import com.example.reviewbot.store.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Up/down votes on reviews. Every write is conditional on the row read just before it,
 * so of two concurrent casts for the same pair only one creates; the other re-reads and
 * toggles or replaces against what it finds.
 */
@Service
public class VoteService {

    private static final Logger logger = LoggerFactory.getLogger(VoteService.class);

    static final int MAX_ATTEMPTS = 3;

    private final VoteRepo voteRepo;
    private final ReviewService reviewService;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public VoteService(VoteRepo voteRepo, ReviewService reviewService, StoreRetry storeRetry, Clock clock) {
        this.voteRepo = voteRepo;
        this.reviewService = reviewService;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public VoteOutcome cast(long voterId, String reviewId, VoteDirection direction) {
        Review review = reviewService.liveReview(reviewId);
        if (review.getUserId() == voterId) {
            throw new ConflictException("You cannot vote on your own review");
        }
        String voteId = Vote.idFor(voterId, reviewId);

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<Vote> current = storeRetry.call("vote.get", () -> voteRepo.findById(voteId));
            if (current.isEmpty()) {
                Vote vote = Vote.builder()
                        .voteId(voteId)
                        .reviewId(reviewId)
                        .userId(voterId)
                        .direction(direction)
                        .createdAt(clock.instant())
                        .build();
                try {
                    storeRetry.call("vote.insert", () -> voteRepo.insert(vote));
                    return VoteOutcome.CREATED;
                } catch (DuplicateKeyException e) {
                    logger.debug("Vote {} created concurrently, re-reading", voteId);
                    continue;
                }
            }
            VoteDirection existing = current.get().getDirection();
            if (existing == direction) {
                long deleted = storeRetry.call("vote.delete", () -> voteRepo.deleteIfDirection(voteId, direction.name()));
                if (deleted > 0) return VoteOutcome.REMOVED;
            } else {
                long swapped = storeRetry.call("vote.swap",
                        () -> voteRepo.swapDirection(voteId, existing.name(), direction.name()));
                if (swapped > 0) return VoteOutcome.REPLACED;
            }
            logger.debug("Vote {} changed under attempt {}, re-reading", voteId, attempt);
        }
        throw new ConflictException("Your vote changed at the same time, please try again");
    }
}
