package com.example.reviewbot.draft;

import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.error.ValidationException;
import com.example.reviewbot.model.RatingDimension;
import com.example.reviewbot.model.Ratings;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.model.ReviewDraft;
import com.example.reviewbot.service.ReviewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Field-by-field editing of a review before it is committed.
 * <p>
 * A commit writes the whole draft through {@link ReviewService} or fails; the draft
 * is deleted only after a successful write, so a failed commit can be retried.
 * A draft with a commit in flight is never discarded; the commit removes it.
 */
@Service
public class DraftEditor {

    private static final Logger logger = LoggerFactory.getLogger(DraftEditor.class);

    public static final int MIN_RATING = 1;
    public static final int MAX_RATING = 5;
    public static final int MAX_TEXT_LENGTH = 2000;

    private final DraftStore draftStore;
    private final ReviewService reviewService;
    private final Clock clock;

    public DraftEditor(DraftStore draftStore, ReviewService reviewService, Clock clock) {
        this.draftStore = draftStore;
        this.reviewService = reviewService;
        this.clock = clock;
    }

    /**
     * Starts a draft, replacing any previous one. With a {@code sourceReviewId} the draft
     * is seeded from that review, which must belong to the subject.
     */
    public ReviewDraft begin(long subjectId, String targetCourseId, String sourceReviewId) {
        ReviewDraft draft;
        if (sourceReviewId != null) {
            Review source = reviewService.ownedReview(subjectId, sourceReviewId);
            draft = ReviewDraft.builder()
                    .subjectId(subjectId)
                    .targetCourseId(source.getCourseId())
                    .ratings(source.getRatings() == null ? new Ratings() : source.getRatings().copy())
                    .text(source.getText())
                    .anonymous(source.isAnonymous())
                    .sourceReviewId(sourceReviewId)
                    .startedAt(clock.instant())
                    .build();
        } else {
            draft = ReviewDraft.builder()
                    .subjectId(subjectId)
                    .targetCourseId(targetCourseId)
                    .ratings(new Ratings())
                    .startedAt(clock.instant())
                    .build();
        }
        draftStore.put(draft);
        logger.debug("Draft begun for {} on course {} (source {})", subjectId, draft.getTargetCourseId(), sourceReviewId);
        return draft;
    }

    public Optional<ReviewDraft> current(long subjectId) {
        return draftStore.get(subjectId);
    }

    public ReviewDraft setRating(long subjectId, RatingDimension dimension, int value) {
        checkRating(dimension, value);
        ReviewDraft draft = require(subjectId);
        draft.getRatings().put(dimension, value);
        draftStore.put(draft);
        return draft;
    }

    /** Null or blank text removes it. */
    public ReviewDraft setText(long subjectId, String text) {
        String normalized = text == null || text.isBlank() ? null : text.trim();
        if (normalized != null && normalized.length() > MAX_TEXT_LENGTH) {
            throw new ValidationException("Review text must be at most " + MAX_TEXT_LENGTH + " characters");
        }
        ReviewDraft draft = require(subjectId);
        draft.setText(normalized);
        draftStore.put(draft);
        return draft;
    }

    public ReviewDraft setAnonymous(long subjectId, boolean anonymous) {
        ReviewDraft draft = require(subjectId);
        draft.setAnonymous(anonymous);
        draftStore.put(draft);
        return draft;
    }

    public ReviewDraft toggleAnonymous(long subjectId) {
        ReviewDraft draft = require(subjectId);
        return setAnonymous(subjectId, !draft.isAnonymous());
    }

    /**
     * Validates and writes the draft: creates a review for a new draft, updates the
     * source review otherwise.
     */
    public Review commit(long subjectId) {
        ReviewDraft draft = require(subjectId);
        validate(draft);

        draft.setSubmitting(true);
        draftStore.put(draft);
        Review committed;
        try {
            committed = draft.getSourceReviewId() == null
                    ? reviewService.create(subjectId, draft.getTargetCourseId(), draft.getRatings(), draft.getText(), draft.isAnonymous())
                    : reviewService.update(subjectId, draft.getSourceReviewId(), draft.getRatings(), draft.getText(), draft.isAnonymous());
        } catch (RuntimeException e) {
            draft.setSubmitting(false);
            draftStore.put(draft);
            throw e;
        }
        draftStore.delete(subjectId);
        logger.info("Draft of {} committed as review {}", subjectId, committed.getReviewId());
        return committed;
    }

    /**
     * Drops the draft unless a commit for it is in flight.
     *
     * @return the draft as it was found, if any
     */
    public Optional<ReviewDraft> discard(long subjectId) {
        Optional<ReviewDraft> draft = draftStore.get(subjectId);
        if (draft.isPresent() && draft.get().isSubmitting()) {
            logger.debug("Not discarding draft of {}, commit in flight", subjectId);
            return draft;
        }
        draft.ifPresent(d -> draftStore.delete(subjectId));
        return draft;
    }

    public static void validate(ReviewDraft draft) {
        Ratings ratings = draft.getRatings();
        for (RatingDimension dimension : RatingDimension.values()) {
            Integer value = ratings == null ? null : ratings.valueOf(dimension);
            if (value == null) {
                throw new ValidationException(dimension.label() + " rating is missing");
            }
            checkRating(dimension, value);
        }
        if (draft.getText() != null && draft.getText().length() > MAX_TEXT_LENGTH) {
            throw new ValidationException("Review text must be at most " + MAX_TEXT_LENGTH + " characters");
        }
    }

    private static void checkRating(RatingDimension dimension, int value) {
        if (value < MIN_RATING || value > MAX_RATING) {
            throw new ValidationException(dimension.label() + " rating must be between " + MIN_RATING + " and " + MAX_RATING);
        }
    }

    private ReviewDraft require(long subjectId) {
        return draftStore.get(subjectId)
                .orElseThrow(() -> new NotFoundException("No review in progress"));
    }
}
