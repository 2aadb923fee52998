package com.example.reviewbot.handler;

import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.*;
import com.example.reviewbot.router.*;
import com.example.reviewbot.service.*;
import com.example.reviewbot.session.ConversationFlow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Category and course browsing, course reviews and voting.
 */
@Component
public class BrowseHandler implements CallbackHandler {

    private static final Logger logger = LoggerFactory.getLogger(BrowseHandler.class);

    private final ConversationFlow flow;
    private final CourseService courseService;
    private final ReviewService reviewService;
    private final VoteService voteService;
    private final ReviewFormatter formatter;

    public BrowseHandler(ConversationFlow flow, CourseService courseService, ReviewService reviewService,
                         VoteService voteService, ReviewFormatter formatter) {
        this.flow = flow;
        this.courseService = courseService;
        this.reviewService = reviewService;
        this.voteService = voteService;
        this.formatter = formatter;
    }

    @Override
    public Set<CallbackAction> actions() {
        return EnumSet.of(CallbackAction.BROWSE_CATEGORIES, CallbackAction.CATEGORIES_PAGE, CallbackAction.CATEGORY,
                CallbackAction.COURSES_PAGE, CallbackAction.COURSE, CallbackAction.COURSE_DETAILS,
                CallbackAction.COURSE_FROM_REVIEW, CallbackAction.BACK_TO_CATEGORY, CallbackAction.BACK_TO_COURSE,
                CallbackAction.REVIEWS, CallbackAction.REVIEWS_PAGE, CallbackAction.VOTE);
    }

    @Override
    public BotReply handle(long subjectId, CallbackToken token) {
        switch (token.action()) {
            case BROWSE_CATEGORIES:
                return categories(subjectId, 1);
            case CATEGORIES_PAGE:
                return categoriesPage(subjectId, token.page());
            case CATEGORY:
            case COURSES_PAGE:
                return courses(subjectId, token.category(), token.page());
            case BACK_TO_CATEGORY:
                return backToCategory(subjectId);
            case COURSE:
                return course(subjectId, token.id(), false);
            case COURSE_DETAILS:
                return course(subjectId, token.id(), true);
            case COURSE_FROM_REVIEW:
                return course(subjectId, reviewService.liveReview(token.id()).getCourseId(), false);
            case BACK_TO_COURSE:
                return backToCourse(subjectId);
            case REVIEWS:
            case REVIEWS_PAGE:
                return reviews(subjectId, token.id(), token.page());
            case VOTE:
                return vote(subjectId, token.id(), token.direction());
            default:
                throw new IllegalArgumentException("Unsupported action " + token.action());
        }
    }

    private BotReply categories(long subjectId, int page) {
        flow.moveTo(subjectId, ConversationState.BROWSING, SessionContext.builder().page(page).build());
        return BotReply.success("Choose a category:", categoryKeyboard(page, Tokens::category));
    }

    /** Category paging is shared by browsing and by the review wizard. */
    private BotReply categoriesPage(long subjectId, int page) {
        Session session = flow.current(subjectId);
        if (session.getState() == ConversationState.DRAFTING) {
            SessionContext context = flow.context(subjectId).toBuilder().step(DraftStep.CATEGORY).page(page).build();
            flow.moveTo(subjectId, ConversationState.DRAFTING, context);
            return BotReply.success("Which category is the course in?", categoryKeyboard(page, Tokens::reviewCategory));
        }
        return categories(subjectId, page);
    }

    static List<List<Button>> categoryKeyboard(int page, Function<CourseCategory, String> tokenFor) {
        int current = Math.min(Math.max(page, 1), CourseCategory.PAGE_COUNT);
        List<List<Button>> rows = new ArrayList<>();
        for (CourseCategory category : CourseCategory.onPage(current)) {
            rows.add(List.of(new Button(category.name() + " - " + category.displayName(), tokenFor.apply(category))));
        }
        rows.add(Keyboards.pager(current, CourseCategory.PAGE_COUNT, Tokens::categoriesPage));
        rows.add(Keyboards.backToMenu());
        return rows;
    }

    private BotReply courses(long subjectId, CourseCategory category, int page) {
        PageSlice<Course> slice = courseService.coursesPage(category, page);
        flow.moveTo(subjectId, ConversationState.BROWSING,
                SessionContext.builder().category(category).page(slice.page()).build());
        List<List<Button>> rows = new ArrayList<>();
        for (Course course : slice.items()) {
            rows.add(List.of(new Button(course.getCourseId() + " - " + course.getName(), Tokens.course(course.getCourseId()))));
        }
        if (slice.totalPages() > 1) {
            rows.add(Keyboards.pager(slice.page(), slice.totalPages(), p -> Tokens.coursesPage(category, p)));
        }
        rows.add(List.of(new Button("Categories", Tokens.BROWSE_CATEGORIES)));
        rows.add(Keyboards.backToMenu());
        String text = slice.totalItems() == 0
                ? "No courses in " + category.displayName() + " yet."
                : category.displayName() + ": choose a course";
        return BotReply.success(text, rows);
    }

    private BotReply backToCategory(long subjectId) {
        CourseCategory category = flow.context(subjectId).getCategory();
        if (category == null) {
            return categories(subjectId, 1);
        }
        return courses(subjectId, category, 1);
    }

    private BotReply backToCourse(long subjectId) {
        String courseId = flow.context(subjectId).getCourseId();
        if (courseId == null) {
            throw new NotFoundException("No course selected");
        }
        return course(subjectId, courseId, false);
    }

    private BotReply course(long subjectId, String courseId, boolean details) {
        Course course = courseService.findCourse(courseId);
        flow.moveTo(subjectId, ConversationState.VIEWING_RECORD,
                SessionContext.builder().category(course.getCategory()).courseId(courseId).build());
        List<List<Button>> rows = new ArrayList<>();
        rows.add(List.of(new Button("Read reviews", Tokens.reviews(courseId))));
        rows.add(List.of(new Button("Write a review", Tokens.writeReview(courseId))));
        if (!details) {
            rows.add(List.of(new Button("Details", Tokens.courseDetails(courseId))));
        }
        rows.add(List.of(new Button("Back", Tokens.BACK_TO_CATEGORY)));
        rows.add(Keyboards.backToMenu());
        return BotReply.success(formatter.course(course, details), rows);
    }

    private BotReply reviews(long subjectId, String courseId, int page) {
        Course course = courseService.findCourse(courseId);
        PageSlice<RankedReview> slice = reviewService.reviewsForCourse(courseId, page);
        flow.moveTo(subjectId, ConversationState.VIEWING_RECORD,
                SessionContext.builder().category(course.getCategory()).courseId(courseId).page(slice.page()).build());

        List<List<Button>> rows = new ArrayList<>();
        StringBuilder text = new StringBuilder(course.getName()).append(" - reviews\n");
        if (slice.totalItems() == 0) {
            text.append("\nNo reviews yet. Be the first!");
        }
        int n = (slice.page() - 1) * ReviewService.REVIEWS_PER_PAGE;
        for (RankedReview ranked : slice.items()) {
            n++;
            text.append("\n").append(n).append(". ").append(formatter.review(ranked)).append("\n");
            String reviewId = ranked.review().getReviewId();
            rows.add(List.of(
                    new Button(n + " +" + ranked.upvotes(), Tokens.vote(reviewId, VoteDirection.UP)),
                    new Button(n + " -" + ranked.downvotes(), Tokens.vote(reviewId, VoteDirection.DOWN))));
        }
        if (slice.totalPages() > 1) {
            rows.add(Keyboards.pager(slice.page(), slice.totalPages(), p -> Tokens.reviewsPage(courseId, p)));
        }
        rows.add(List.of(new Button("Back to course", Tokens.BACK_TO_COURSE)));
        rows.add(Keyboards.backToMenu());
        return BotReply.success(text.toString().trim(), rows);
    }

    private BotReply vote(long subjectId, String reviewId, VoteDirection direction) {
        VoteOutcome outcome = voteService.cast(subjectId, reviewId, direction);
        logger.debug("Vote by {} on {}: {}", subjectId, reviewId, outcome);
        switch (outcome) {
            case REMOVED:
                return BotReply.of(ReplyType.SUCCESS, "Vote removed");
            case REPLACED:
                return BotReply.of(ReplyType.SUCCESS, "Vote changed");
            default:
                return BotReply.of(ReplyType.SUCCESS, "Vote recorded");
        }
    }
}
