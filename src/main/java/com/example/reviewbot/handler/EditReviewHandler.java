package com.example.reviewbot.handler;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.error.InvalidTransitionException;
import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.*;
import com.example.reviewbot.router.*;
import com.example.reviewbot.service.CourseService;
import com.example.reviewbot.session.ConversationFlow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Editing a published review through a draft seeded from it. Every token carries the
 * review id; a draft for another review (or none) reads as an expired edit.
 */
@Component
public class EditReviewHandler implements CallbackHandler, TextInputHandler {

    static final String KEEP_TEXT = "cancel";
    static final String REMOVE_TEXT = "-";

    private static final Set<ConversationState> EDIT_STATES =
            EnumSet.of(ConversationState.EDITING_RECORD, ConversationState.EDITING_RECORD_TEXT);

    private final ConversationFlow flow;
    private final DraftEditor draftEditor;
    private final CourseService courseService;
    private final MyReviewsHandler myReviewsHandler;
    private final ReviewFormatter formatter;

    public EditReviewHandler(ConversationFlow flow, DraftEditor draftEditor, CourseService courseService,
                             MyReviewsHandler myReviewsHandler, ReviewFormatter formatter) {
        this.flow = flow;
        this.draftEditor = draftEditor;
        this.courseService = courseService;
        this.myReviewsHandler = myReviewsHandler;
        this.formatter = formatter;
    }

    @Override
    public Set<CallbackAction> actions() {
        return EnumSet.of(CallbackAction.EDIT_REVIEW, CallbackAction.EDIT_RATING, CallbackAction.SET_RATING,
                CallbackAction.EDIT_TEXT, CallbackAction.EDIT_ANONYMOUS, CallbackAction.SAVE_REVIEW,
                CallbackAction.CANCEL_EDIT);
    }

    @Override
    public Set<ConversationState> states() {
        return EnumSet.of(ConversationState.EDITING_RECORD_TEXT);
    }

    @Override
    public BotReply handle(long subjectId, CallbackToken token) {
        String reviewId = token.id();
        switch (token.action()) {
            case EDIT_REVIEW:
                return begin(subjectId, reviewId);
            case EDIT_RATING:
                requireEdit(subjectId, reviewId);
                return BotReply.success("New " + token.dimension().label().toLowerCase() + " rating:", List.of(
                        Keyboards.ratingRow(v -> Tokens.setRating(reviewId, token.dimension(), v)),
                        List.of(new Button("Cancel", Tokens.cancelEdit(reviewId)))));
            case SET_RATING:
                requireEdit(subjectId, reviewId);
                draftEditor.setRating(subjectId, token.dimension(), token.number());
                return menu(subjectId, reviewId, "Rating updated.");
            case EDIT_TEXT:
                requireEdit(subjectId, reviewId);
                flow.moveTo(subjectId, ConversationState.EDITING_RECORD_TEXT, editContext(subjectId, reviewId));
                return BotReply.success("Send the new text. Send \"" + REMOVE_TEXT + "\" to remove the text or \""
                        + KEEP_TEXT + "\" to keep it.", List.of());
            case EDIT_ANONYMOUS:
                requireEdit(subjectId, reviewId);
                ReviewDraft toggled = draftEditor.toggleAnonymous(subjectId);
                return menu(subjectId, reviewId, toggled.isAnonymous() ? "Review will be anonymous." : "Review will show your name.");
            case SAVE_REVIEW:
                requireEdit(subjectId, reviewId);
                draftEditor.commit(subjectId);
                return myReviewsHandler.list(subjectId, 1, "Review updated.");
            case CANCEL_EDIT:
                return cancel(subjectId, reviewId);
            default:
                throw new IllegalArgumentException("Unsupported action " + token.action());
        }
    }

    @Override
    public BotReply handleText(long subjectId, Session session, String text) {
        String reviewId = session.getContext() == null ? null : session.getContext().getReviewId();
        if (reviewId == null) {
            throw new NotFoundException("No review being edited");
        }
        requireEdit(subjectId, reviewId);
        String input = text == null ? "" : text.trim();
        String notice;
        if (KEEP_TEXT.equalsIgnoreCase(input)) {
            notice = "Text unchanged.";
        } else if (REMOVE_TEXT.equals(input)) {
            draftEditor.setText(subjectId, null);
            notice = "Text removed.";
        } else {
            draftEditor.setText(subjectId, input);
            notice = "Text updated.";
        }
        return menu(subjectId, reviewId, notice);
    }

    private BotReply begin(long subjectId, String reviewId) {
        flow.moveTo(subjectId, ConversationState.EDITING_RECORD, SessionContext.builder().reviewId(reviewId).build());
        ReviewDraft draft = draftEditor.begin(subjectId, null, reviewId);
        return render(draft, reviewId, "Editing your review.");
    }

    private BotReply menu(long subjectId, String reviewId, String notice) {
        flow.moveTo(subjectId, ConversationState.EDITING_RECORD, editContext(subjectId, reviewId));
        return render(requireEdit(subjectId, reviewId), reviewId, notice);
    }

    private BotReply render(ReviewDraft draft, String reviewId, String notice) {
        String courseName = courseService.findCourse(draft.getTargetCourseId()).getName();
        List<List<Button>> rows = new ArrayList<>();
        for (RatingDimension dimension : RatingDimension.values()) {
            Integer value = draft.getRatings().valueOf(dimension);
            rows.add(List.of(new Button(dimension.label() + ": " + value, Tokens.editRating(reviewId, dimension))));
        }
        rows.add(List.of(new Button("Edit text", Tokens.editText(reviewId))));
        rows.add(List.of(new Button(draft.isAnonymous() ? "Show my name" : "Make anonymous", Tokens.editAnonymous(reviewId))));
        rows.add(List.of(new Button("Save", Tokens.saveReview(reviewId)), new Button("Cancel", Tokens.cancelEdit(reviewId))));
        return BotReply.success(notice + "\n\n" + formatter.draft(draft, courseName), rows);
    }

    private BotReply cancel(long subjectId, String reviewId) {
        Optional<ReviewDraft> discarded = draftEditor.current(subjectId)
                .filter(d -> reviewId.equals(d.getSourceReviewId()))
                .flatMap(d -> draftEditor.discard(subjectId));
        if (discarded.isPresent() && discarded.get().isSubmitting()) {
            return myReviewsHandler.list(subjectId, 1, "Your changes are already being saved; cancelling does not undo them.");
        }
        return myReviewsHandler.list(subjectId, 1, "Changes discarded.");
    }

    private SessionContext editContext(long subjectId, String reviewId) {
        return flow.context(subjectId).toBuilder().reviewId(reviewId).build();
    }

    private ReviewDraft requireEdit(long subjectId, String reviewId) {
        ReviewDraft draft = draftEditor.current(subjectId)
                .filter(d -> reviewId.equals(d.getSourceReviewId()))
                .orElseThrow(() -> new NotFoundException("This edit has expired, please start again"));
        ConversationState state = flow.current(subjectId).getState();
        if (!EDIT_STATES.contains(state)) {
            throw new InvalidTransitionException(state, ConversationState.EDITING_RECORD);
        }
        return draft;
    }
}
