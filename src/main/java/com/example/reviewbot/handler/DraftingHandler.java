package com.example.reviewbot.handler;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.error.InvalidTransitionException;
import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.*;
import com.example.reviewbot.router.*;
import com.example.reviewbot.service.CourseService;
import com.example.reviewbot.service.ReviewService;
import com.example.reviewbot.service.UserProfileService;
import com.example.reviewbot.session.ConversationFlow;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The new-review wizard: category, course, ratings, text, anonymity, confirmation.
 * The current step lives in the session context of the DRAFTING state.
 */
@Component
public class DraftingHandler implements CallbackHandler, TextInputHandler {

    private final ConversationFlow flow;
    private final DraftEditor draftEditor;
    private final CourseService courseService;
    private final ReviewService reviewService;
    private final UserProfileService profileService;
    private final ReviewFormatter formatter;

    public DraftingHandler(ConversationFlow flow, DraftEditor draftEditor, CourseService courseService,
                           ReviewService reviewService, UserProfileService profileService, ReviewFormatter formatter) {
        this.flow = flow;
        this.draftEditor = draftEditor;
        this.courseService = courseService;
        this.reviewService = reviewService;
        this.profileService = profileService;
        this.formatter = formatter;
    }

    @Override
    public Set<CallbackAction> actions() {
        return EnumSet.of(CallbackAction.POST_REVIEW, CallbackAction.REVIEW_CATEGORY, CallbackAction.REVIEW_COURSE,
                CallbackAction.WRITE_REVIEW, CallbackAction.RATING, CallbackAction.ADD_TEXT,
                CallbackAction.EDIT_DRAFT_TEXT, CallbackAction.SKIP_TEXT, CallbackAction.REMOVE_DRAFT_TEXT,
                CallbackAction.ANONYMITY, CallbackAction.EDIT_CURRENT, CallbackAction.EDIT_ANONYMITY,
                CallbackAction.CONFIRM_REVIEW, CallbackAction.CANCEL_REVIEW);
    }

    @Override
    public Set<ConversationState> states() {
        return EnumSet.of(ConversationState.DRAFTING);
    }

    @Override
    public BotReply handle(long subjectId, CallbackToken token) {
        switch (token.action()) {
            case POST_REVIEW:
                flow.moveTo(subjectId, ConversationState.DRAFTING, SessionContext.builder().step(DraftStep.CATEGORY).page(1).build());
                return BotReply.success("Which category is the course in?",
                        BrowseHandler.categoryKeyboard(1, Tokens::reviewCategory));
            case REVIEW_CATEGORY:
                return chooseCourse(subjectId, token.category());
            case REVIEW_COURSE:
            case WRITE_REVIEW:
                return startDraft(subjectId, token.id());
            case RATING:
                return rate(subjectId, token.dimension(), token.number());
            case ADD_TEXT:
            case EDIT_DRAFT_TEXT:
                requireDraft(subjectId);
                step(subjectId, DraftStep.TEXT);
                return BotReply.success("Send your review text (up to " + DraftEditor.MAX_TEXT_LENGTH + " characters).",
                        List.of(List.of(new Button("Skip", Tokens.SKIP_TEXT)), cancelRow()));
            case SKIP_TEXT:
                requireDraft(subjectId);
                return askAnonymity(subjectId);
            case REMOVE_DRAFT_TEXT:
                requireDraft(subjectId);
                draftEditor.setText(subjectId, null);
                return askAnonymity(subjectId);
            case ANONYMITY:
                return chooseAnonymity(subjectId, Boolean.TRUE.equals(token.flag()));
            case EDIT_CURRENT:
                return editCurrent(subjectId);
            case EDIT_ANONYMITY:
                requireDraft(subjectId);
                return askAnonymity(subjectId);
            case CONFIRM_REVIEW:
                return confirm(subjectId);
            case CANCEL_REVIEW:
                return cancel(subjectId);
            default:
                throw new IllegalArgumentException("Unsupported action " + token.action());
        }
    }

    @Override
    public BotReply handleText(long subjectId, Session session, String text) {
        SessionContext context = session.getContext();
        if (context == null || context.getStep() != DraftStep.TEXT) {
            return BotReply.of(ReplyType.UNRECOGNIZED_INPUT, "Please use the buttons to continue your review.");
        }
        draftEditor.setText(subjectId, text);
        return askAnonymity(subjectId);
    }

    /** Summary of the current draft with confirm, edit and cancel buttons. */
    public BotReply confirmation(long subjectId) {
        ReviewDraft draft = requireDraft(subjectId);
        step(subjectId, DraftStep.CONFIRM);
        String courseName = courseService.findCourse(draft.getTargetCourseId()).getName();
        List<List<Button>> rows = List.of(
                List.of(new Button("Publish", Tokens.CONFIRM_REVIEW)),
                List.of(new Button("Edit", Tokens.EDIT_CURRENT)),
                cancelRow());
        return BotReply.success("Please check your review:\n\n" + formatter.draft(draft, courseName), rows);
    }

    private BotReply chooseCourse(long subjectId, CourseCategory category) {
        List<Course> courses = courseService.coursesIn(category);
        flow.moveTo(subjectId, ConversationState.DRAFTING,
                SessionContext.builder().step(DraftStep.COURSE).category(category).build());
        List<List<Button>> rows = new ArrayList<>();
        for (Course course : courses) {
            rows.add(List.of(new Button(course.getCourseId() + " - " + course.getName(), Tokens.reviewCourse(course.getCourseId()))));
        }
        rows.add(List.of(new Button("Categories", Tokens.categoriesPage(category.page()))));
        rows.add(cancelRow());
        String text = courses.isEmpty() ? "No courses in " + category.displayName() + " yet." : "Which course?";
        return BotReply.success(text, rows);
    }

    private BotReply startDraft(long subjectId, String courseId) {
        reviewService.checkEligible(subjectId, courseId);
        Course course = courseService.findCourse(courseId);
        flow.moveTo(subjectId, ConversationState.DRAFTING, SessionContext.builder()
                .step(DraftStep.RATING).category(course.getCategory()).courseId(courseId).build());
        draftEditor.begin(subjectId, courseId, null);
        return askRating(course.getName(), RatingDimension.OVERALL);
    }

    private BotReply rate(long subjectId, RatingDimension dimension, int value) {
        requireDraft(subjectId);
        ReviewDraft draft = draftEditor.setRating(subjectId, dimension, value);
        DraftStep step = flow.context(subjectId).getStep();
        Optional<RatingDimension> missing = nextMissing(draft.getRatings());
        if (missing.isPresent()) {
            String courseName = courseService.findCourse(draft.getTargetCourseId()).getName();
            return askRating(courseName, missing.get());
        }
        if (step == DraftStep.CONFIRM) {
            return confirmation(subjectId);
        }
        return BotReply.success("Ratings saved: " + formatter.ratings(draft.getRatings()) + "\nAdd a written comment?",
                List.of(List.of(new Button("Add text", Tokens.ADD_TEXT), new Button("Skip", Tokens.SKIP_TEXT)), cancelRow()));
    }

    private BotReply askRating(String courseName, RatingDimension dimension) {
        return BotReply.success(courseName + "\nRate " + dimension.label().toLowerCase() + " (1-5):",
                List.of(Keyboards.ratingRow(dimension), cancelRow()));
    }

    private BotReply askAnonymity(long subjectId) {
        step(subjectId, DraftStep.ANONYMITY);
        return BotReply.success("Post anonymously?", List.of(
                List.of(new Button("Yes, anonymous", Tokens.anonymous(true)), new Button("No, show my name", Tokens.anonymous(false))),
                cancelRow()));
    }

    private BotReply chooseAnonymity(long subjectId, boolean anonymous) {
        requireDraft(subjectId);
        draftEditor.setAnonymous(subjectId, anonymous);
        if (!anonymous && profileService.find(subjectId).isEmpty()) {
            SessionContext context = flow.context(subjectId).toBuilder().step(DraftStep.CONFIRM).build();
            flow.moveTo(subjectId, ConversationState.COLLECTING_PROFILE_NAME, context);
            return BotReply.success("What name should appear on your reviews? ("
                    + UserProfileService.NAME_MIN + "-" + UserProfileService.NAME_MAX + " characters)", List.of(cancelRow()));
        }
        return confirmation(subjectId);
    }

    private BotReply editCurrent(long subjectId) {
        ReviewDraft draft = requireDraft(subjectId);
        step(subjectId, DraftStep.CONFIRM);
        List<List<Button>> rows = new ArrayList<>();
        for (RatingDimension dimension : RatingDimension.values()) {
            rows.add(List.of(new Button(dimension.label(), Tokens.NOOP)));
            rows.add(Keyboards.ratingRow(dimension));
        }
        rows.add(List.of(new Button("Edit text", Tokens.EDIT_DRAFT_TEXT), new Button("Remove text", Tokens.REMOVE_DRAFT_TEXT)));
        rows.add(List.of(new Button("Anonymity", Tokens.EDIT_ANONYMITY)));
        rows.add(List.of(new Button("Done", Tokens.CONFIRM_REVIEW)));
        rows.add(cancelRow());
        return BotReply.success("Current ratings: " + formatter.ratings(draft.getRatings()) + "\nWhat do you want to change?", rows);
    }

    private BotReply confirm(long subjectId) {
        requireDraft(subjectId);
        Review review = draftEditor.commit(subjectId);
        flow.reset(subjectId);
        return BotReply.success("Thank you! Your review of " + review.getCourseId() + " is published.", Keyboards.mainMenu());
    }

    private BotReply cancel(long subjectId) {
        Optional<ReviewDraft> discarded = draftEditor.discard(subjectId);
        flow.reset(subjectId);
        if (discarded.isPresent() && discarded.get().isSubmitting()) {
            return BotReply.success("Your review is already being published; cancelling does not withdraw it. "
                    + "You can delete it from My reviews.", Keyboards.mainMenu());
        }
        return BotReply.success("Review cancelled.", Keyboards.mainMenu());
    }

    private void step(long subjectId, DraftStep step) {
        Session session = flow.current(subjectId);
        SessionContext context = (session.getContext() == null ? SessionContext.empty() : session.getContext())
                .toBuilder().step(step).build();
        flow.moveTo(subjectId, ConversationState.DRAFTING, context);
    }

    /** The draft of the current wizard; buttons left over from an earlier screen are refused. */
    private ReviewDraft requireDraft(long subjectId) {
        ReviewDraft draft = draftEditor.current(subjectId)
                .filter(d -> d.getSourceReviewId() == null)
                .orElseThrow(() -> new NotFoundException("No review in progress"));
        ConversationState state = flow.current(subjectId).getState();
        if (state != ConversationState.DRAFTING) {
            throw new InvalidTransitionException(state, ConversationState.DRAFTING);
        }
        return draft;
    }

    private static Optional<RatingDimension> nextMissing(Ratings ratings) {
        for (RatingDimension dimension : RatingDimension.values()) {
            if (ratings.valueOf(dimension) == null) return Optional.of(dimension);
        }
        return Optional.empty();
    }

    private static List<Button> cancelRow() {
        return List.of(new Button("Cancel", Tokens.CANCEL_REVIEW));
    }
}
