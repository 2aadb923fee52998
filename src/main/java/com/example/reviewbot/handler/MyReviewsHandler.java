package com.example.reviewbot.handler;

import com.example.reviewbot.model.ConversationState;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.model.SessionContext;
import com.example.reviewbot.router.*;
import com.example.reviewbot.service.PageSlice;
import com.example.reviewbot.service.ReviewService;
import com.example.reviewbot.session.ConversationFlow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
public class MyReviewsHandler implements CallbackHandler {

    private final ConversationFlow flow;
    private final ReviewService reviewService;
    private final ReviewFormatter formatter;

    public MyReviewsHandler(ConversationFlow flow, ReviewService reviewService, ReviewFormatter formatter) {
        this.flow = flow;
        this.reviewService = reviewService;
        this.formatter = formatter;
    }

    @Override
    public Set<CallbackAction> actions() {
        return EnumSet.of(CallbackAction.MY_REVIEWS, CallbackAction.MANAGE_REVIEW,
                CallbackAction.DELETE_REVIEW, CallbackAction.CONFIRM_DELETE);
    }

    @Override
    public BotReply handle(long subjectId, CallbackToken token) {
        switch (token.action()) {
            case MY_REVIEWS:
                return list(subjectId, token.page(), null);
            case MANAGE_REVIEW:
                return manage(subjectId, token.id());
            case DELETE_REVIEW:
                return askDelete(subjectId, token.id());
            case CONFIRM_DELETE:
                reviewService.softDelete(subjectId, token.id());
                return list(subjectId, 1, "Review deleted.");
            default:
                throw new IllegalArgumentException("Unsupported action " + token.action());
        }
    }

    /** Lists the subject's reviews; {@code notice} is prepended when set. */
    public BotReply list(long subjectId, int page, String notice) {
        PageSlice<Review> slice = reviewService.reviewsOfPage(subjectId, page);
        flow.moveTo(subjectId, ConversationState.VIEWING_OWN_RECORDS, SessionContext.builder().page(slice.page()).build());
        List<List<Button>> rows = new ArrayList<>();
        for (Review review : slice.items()) {
            rows.add(List.of(new Button(review.getCourseId() + " - " + review.getRatings().getOverall() + "/5",
                    Tokens.manageReview(review.getReviewId()))));
        }
        if (slice.totalPages() > 1) {
            rows.add(Keyboards.pager(slice.page(), slice.totalPages(), Tokens::myReviewsPage));
        }
        if (slice.totalItems() == 0) {
            rows.add(List.of(new Button("Post a review", Tokens.POST_REVIEW)));
        }
        rows.add(Keyboards.backToMenu());
        String body = slice.totalItems() == 0 ? "You have not posted any reviews yet." : "Your reviews (" + slice.totalItems() + "):";
        return BotReply.success(notice == null ? body : notice + "\n" + body, rows);
    }

    private BotReply manage(long subjectId, String reviewId) {
        Review review = reviewService.ownedReview(subjectId, reviewId);
        flow.moveTo(subjectId, ConversationState.VIEWING_OWN_RECORDS,
                SessionContext.builder().reviewId(reviewId).courseId(review.getCourseId()).build());
        List<List<Button>> rows = List.of(
                List.of(new Button("Edit", Tokens.editReview(reviewId)), new Button("Delete", Tokens.deleteReview(reviewId))),
                List.of(new Button("View course", Tokens.courseFromReview(reviewId))),
                List.of(new Button("My reviews", Tokens.MY_REVIEWS)),
                Keyboards.backToMenu());
        return BotReply.success(review.getCourseId() + "\n" + formatter.review(review), rows);
    }

    private BotReply askDelete(long subjectId, String reviewId) {
        Review review = reviewService.ownedReview(subjectId, reviewId);
        List<List<Button>> rows = List.of(
                List.of(new Button("Yes, delete", Tokens.confirmDelete(reviewId)), new Button("No", Tokens.manageReview(reviewId))));
        return BotReply.success("Delete your review of " + review.getCourseId() + "? This cannot be undone.", rows);
    }
}
