package com.example.reviewbot.service;

import com.example.reviewbot.error.ConflictException;
import com.example.reviewbot.error.DuplicateSubmissionException;
import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.Ratings;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.model.Vote;
import com.example.reviewbot.model.VoteDirection;
import com.example.reviewbot.repo.ReviewRepo;
import com.example.reviewbot.repo.VoteRepo;
import com.example.reviewbot.store.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Committed reviews. Soft-deleted reviews are invisible to every read here.
 */
@Service
public class ReviewService {

    private static final Logger logger = LoggerFactory.getLogger(ReviewService.class);

    public static final int REVIEWS_PER_PAGE = 5;

    private final ReviewRepo reviewRepo;
    private final VoteRepo voteRepo;
    private final CourseService courseService;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public ReviewService(ReviewRepo reviewRepo, VoteRepo voteRepo, CourseService courseService,
                         StoreRetry storeRetry, Clock clock) {
        this.reviewRepo = reviewRepo;
        this.voteRepo = voteRepo;
        this.courseService = courseService;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public Optional<Review> existingReview(long userId, String courseId) {
        return storeRetry.call("review.find",
                () -> reviewRepo.findFirstByUserIdAndCourseIdAndDeletedFalse(userId, courseId));
    }

    /** Throws unless the user may start a new review of the course. */
    public void checkEligible(long userId, String courseId) {
        courseService.findCourse(courseId);
        existingReview(userId, courseId).ifPresent(existing -> {
            throw new DuplicateSubmissionException(courseId, existing.getReviewId());
        });
    }

    public Review create(long userId, String courseId, Ratings ratings, String text, boolean anonymous) {
        checkEligible(userId, courseId);
        Instant now = clock.instant();
        Review review = Review.builder()
                .reviewId(newReviewId(now))
                .courseId(courseId)
                .userId(userId)
                .ratings(ratings.copy())
                .text(text)
                .anonymous(anonymous)
                .createdAt(now)
                .updatedAt(now)
                .deleted(false)
                .build();
        Review saved;
        try {
            saved = storeRetry.call("review.insert", () -> reviewRepo.insert(review));
        } catch (DuplicateKeyException e) {
            // lost to a concurrent submit for the same course
            String existingId = existingReview(userId, courseId).map(Review::getReviewId).orElse(null);
            throw new DuplicateSubmissionException(courseId, existingId);
        }
        logger.info("Review {} created for course {}", saved.getReviewId(), courseId);
        refreshAverages(courseId);
        return saved;
    }

    public Review update(long userId, String reviewId, Ratings ratings, String text, boolean anonymous) {
        Review review = ownedReview(userId, reviewId);
        review.setRatings(ratings.copy());
        review.setText(text);
        review.setAnonymous(anonymous);
        review.setUpdatedAt(clock.instant());
        Review saved;
        try {
            saved = storeRetry.call("review.save", () -> reviewRepo.save(review));
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("This review was changed elsewhere, please try again");
        }
        logger.info("Review {} updated", reviewId);
        refreshAverages(saved.getCourseId());
        return saved;
    }

    public void softDelete(long userId, String reviewId) {
        Review review = ownedReview(userId, reviewId);
        review.setDeleted(true);
        review.setUpdatedAt(clock.instant());
        try {
            storeRetry.run("review.delete", () -> reviewRepo.save(review));
        } catch (OptimisticLockingFailureException e) {
            throw new ConflictException("This review was changed elsewhere, please try again");
        }
        long removedVotes = storeRetry.call("vote.purge", () -> voteRepo.deleteByReviewId(reviewId));
        logger.info("Review {} deleted, {} votes removed", reviewId, removedVotes);
        refreshAverages(review.getCourseId());
    }

    /** Averages are derived from the reviews; a failed refresh leaves the review write standing. */
    private void refreshAverages(String courseId) {
        try {
            courseService.refreshAverages(courseId);
        } catch (RuntimeException e) {
            logger.error("Could not refresh averages for course {}", courseId, e);
        }
    }

    /** A live review by id, for any reader. */
    public Review liveReview(String reviewId) {
        return storeRetry.call("review.get", () -> reviewRepo.findById(reviewId))
                .filter(r -> !r.isDeleted())
                .orElseThrow(() -> new NotFoundException("Review not found"));
    }

    /** A live review owned by the user. Someone else's review reads as missing. */
    public Review ownedReview(long userId, String reviewId) {
        Review review = liveReview(reviewId);
        if (review.getUserId() != userId) {
            throw new NotFoundException("Review not found");
        }
        return review;
    }

    public List<Review> reviewsOf(long userId) {
        return storeRetry.call("review.byUser", () -> reviewRepo.findByUserIdAndDeletedFalseOrderByCreatedAtDesc(userId));
    }

    public PageSlice<Review> reviewsOfPage(long userId, int page) {
        return PageSlice.of(reviewsOf(userId), page, REVIEWS_PER_PAGE);
    }

    /** Live reviews of a course, best net score first, newest first on ties. */
    public PageSlice<RankedReview> reviewsForCourse(String courseId, int page) {
        List<Review> reviews = storeRetry.call("review.byCourse", () -> reviewRepo.findByCourseIdAndDeletedFalse(courseId));
        Map<String, int[]> tally = new HashMap<>();
        if (!reviews.isEmpty()) {
            Set<String> ids = reviews.stream().map(Review::getReviewId).collect(Collectors.toSet());
            for (Vote vote : storeRetry.call("vote.byReviews", () -> voteRepo.findByReviewIdIn(ids))) {
                int[] counts = tally.computeIfAbsent(vote.getReviewId(), k -> new int[2]);
                counts[vote.getDirection() == VoteDirection.UP ? 0 : 1]++;
            }
        }
        List<RankedReview> ranked = reviews.stream()
                .map(r -> {
                    int[] counts = tally.getOrDefault(r.getReviewId(), new int[2]);
                    return new RankedReview(r, counts[0], counts[1]);
                })
                .sorted(Comparator.comparingInt(RankedReview::netVotes).reversed()
                        .thenComparing(rr -> rr.review().getCreatedAt(), Comparator.nullsLast(Comparator.<Instant>reverseOrder())))
                .collect(Collectors.toList());
        return PageSlice.of(ranked, page, REVIEWS_PER_PAGE);
    }

    private static String newReviewId(Instant now) {
        String suffix = Long.toString(ThreadLocalRandom.current().nextLong(Long.MAX_VALUE), 36);
        return "review_" + now.toEpochMilli() + "_" + suffix.substring(0, Math.min(9, suffix.length()));
    }
}
