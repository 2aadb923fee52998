package com.example.reviewbot.handler;

import com.example.reviewbot.model.*;
import com.example.reviewbot.service.RankedReview;
import com.example.reviewbot.service.UserProfileService;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Plain-text bodies for course cards, reviews and drafts.
 */
@Component
public class ReviewFormatter {

    private final UserProfileService profileService;

    public ReviewFormatter(UserProfileService profileService) {
        this.profileService = profileService;
    }

    public String course(Course course, boolean details) {
        StringBuilder sb = new StringBuilder();
        sb.append(course.getName()).append(" (").append(course.getCourseId()).append(")\n");
        AverageRatings avg = course.getAverageRatings();
        if (avg == null || course.getReviewCount() == 0) {
            sb.append("No reviews yet.");
        } else {
            sb.append("Overall ").append(avg.getOverall())
                    .append(" | Quality ").append(avg.getQuality())
                    .append(" | Difficulty ").append(avg.getDifficulty())
                    .append("\n").append(course.getReviewCount()).append(" review(s)");
        }
        if (details) {
            if (course.getDescription() != null) sb.append("\n\n").append(course.getDescription());
            if (course.getGradingScheme() != null) sb.append("\nGrading: ").append(course.getGradingScheme());
        }
        return sb.toString();
    }

    public String review(RankedReview ranked) {
        return review(ranked.review()) + "\n+" + ranked.upvotes() + " / -" + ranked.downvotes();
    }

    public String review(Review review) {
        StringBuilder sb = new StringBuilder();
        sb.append(author(review.isAnonymous(), review.getUserId())).append(": ");
        sb.append(ratings(review.getRatings()));
        if (review.getText() != null) sb.append("\n").append(review.getText());
        return sb.toString();
    }

    public String draft(ReviewDraft draft, String courseName) {
        StringBuilder sb = new StringBuilder();
        sb.append("Course: ").append(courseName).append("\n");
        sb.append(ratings(draft.getRatings())).append("\n");
        sb.append("Text: ").append(draft.getText() == null ? "(none)" : draft.getText()).append("\n");
        sb.append("Posted as: ").append(author(draft.isAnonymous(), draft.getSubjectId()));
        return sb.toString();
    }

    public String ratings(Ratings ratings) {
        StringBuilder sb = new StringBuilder();
        for (RatingDimension dimension : RatingDimension.values()) {
            if (sb.length() > 0) sb.append(" | ");
            Integer value = ratings == null ? null : ratings.valueOf(dimension);
            sb.append(dimension.label()).append(" ").append(value == null ? "-" : value + "/5");
        }
        return sb.toString();
    }

    private String author(boolean anonymous, long userId) {
        if (anonymous) return "Anonymous";
        Optional<UserProfile> profile = profileService.find(userId);
        return profile.map(p -> p.getName() + " (" + p.getPromotion() + ")").orElse("Student");
    }
}
