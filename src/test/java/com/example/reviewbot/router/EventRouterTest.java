package com.example.reviewbot.router;

import com.example.reviewbot.draft.DraftEditor;
import com.example.reviewbot.draft.DraftStore;
import com.example.reviewbot.error.DuplicateSubmissionException;
import com.example.reviewbot.error.StoreUnavailableException;
import com.example.reviewbot.handler.*;
import com.example.reviewbot.model.*;
import com.example.reviewbot.quota.QuotaGate;
import com.example.reviewbot.service.CourseService;
import com.example.reviewbot.service.PageSlice;
import com.example.reviewbot.service.ReviewService;
import com.example.reviewbot.service.UserProfileService;
import com.example.reviewbot.service.VoteService;
import com.example.reviewbot.session.ConversationFlow;
import com.example.reviewbot.session.SessionStore;
import com.example.reviewbot.session.TimeoutListener;
import com.example.reviewbot.session.TimeoutSupervisor;
import com.example.reviewbot.support.InMemoryKvClient;
import com.example.reviewbot.support.InMemoryQuotaCounterStore;
import com.example.reviewbot.support.MutableClock;
import com.example.reviewbot.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventRouterTest {

    private static final long SUBJECT = 5150L;
    private static final String COURSE_ID = "MAA101";

    @Mock
    private CourseService courseService;

    @Mock
    private ReviewService reviewService;

    @Mock
    private VoteService voteService;

    @Mock
    private UserProfileService profileService;

    @Mock
    private TimeoutListener timeoutListener;

    private MutableClock clock;
    private InMemoryQuotaCounterStore counterStore;
    private SessionStore sessionStore;
    private TimeoutSupervisor supervisor;
    private QuotaGate quotaGate;
    private DraftEditor draftEditor;
    private EventRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-09-07T13:00:00Z"));
        InMemoryKvClient kvClient = new InMemoryKvClient();

        sessionStore = new SessionStore(kvClient, TestStores.objectMapper(), TestStores.storeRetry(), clock);
        ReflectionTestUtils.setField(sessionStore, "inactivityWindowMs", Duration.ofMinutes(30).toMillis());
        supervisor = new TimeoutSupervisor(sessionStore, kvClient, TestStores.storeRetry(), List.of(timeoutListener), clock);
        ReflectionTestUtils.setField(supervisor, "warningLeadMs", Duration.ofMinutes(5).toMillis());

        counterStore = new InMemoryQuotaCounterStore();
        quotaGate = new QuotaGate(counterStore, TestStores.storeRetry(), clock);
        ReflectionTestUtils.setField(quotaGate, "dailyLimit", 100);
        ReflectionTestUtils.setField(quotaGate, "lifetimeLimit", 3000L);
        ReflectionTestUtils.setField(quotaGate, "zone", "UTC");

        DraftStore draftStore = new DraftStore(kvClient, TestStores.objectMapper(), TestStores.storeRetry());
        ReflectionTestUtils.setField(draftStore, "ttlMs", Duration.ofMinutes(30).toMillis());
        draftEditor = new DraftEditor(draftStore, reviewService, clock);

        ConversationFlow flow = new ConversationFlow(sessionStore);
        ReviewFormatter formatter = new ReviewFormatter(profileService);
        NavigationHandler navigation = new NavigationHandler(flow, draftEditor);
        BrowseHandler browse = new BrowseHandler(flow, courseService, reviewService, voteService, formatter);
        DraftingHandler drafting = new DraftingHandler(flow, draftEditor, courseService, reviewService, profileService, formatter);
        ProfileHandler profile = new ProfileHandler(flow, profileService, drafting);
        MyReviewsHandler myReviews = new MyReviewsHandler(flow, reviewService, formatter);
        EditReviewHandler editReview = new EditReviewHandler(flow, draftEditor, courseService, myReviews, formatter);

        router = new EventRouter(quotaGate, supervisor, flow, draftEditor, new CallbackTokenParser(), navigation,
                List.of(navigation, browse, drafting, myReviews, editReview),
                List.of(drafting, profile, editReview));
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
    }

    private Course givenCourse() {
        Course course = Course.builder().courseId(COURSE_ID).category(CourseCategory.MAA).name("Linear Algebra").build();
        when(courseService.findCourse(COURSE_ID)).thenReturn(course);
        return course;
    }

    private void givenCategoryListing() {
        Course course = givenCourse();
        when(courseService.coursesPage(eq(CourseCategory.MAA), anyInt()))
                .thenReturn(PageSlice.of(List.of(course), 1, CourseService.COURSES_PER_PAGE));
    }

    private Review givenOwnReview() {
        givenCourse();
        Review mine = Review.builder().reviewId("review_7").courseId(COURSE_ID).userId(SUBJECT)
                .ratings(new Ratings(3, 3, 3)).text("meh").build();
        when(reviewService.ownedReview(SUBJECT, "review_7")).thenReturn(mine);
        when(reviewService.reviewsOfPage(eq(SUBJECT), anyInt()))
                .thenReturn(PageSlice.of(List.of(mine), 1, ReviewService.REVIEWS_PER_PAGE));
        return mine;
    }

    private BotReply callback(String token) {
        return router.handle(InboundEvent.callback(SUBJECT, token));
    }

    private BotReply text(String text) {
        return router.handle(InboundEvent.text(SUBJECT, text));
    }

    private ConversationState state() {
        return sessionStore.peek(SUBJECT).map(Session::getState).orElse(null);
    }

    private int dailyCount() {
        return counterStore.find(SUBJECT).map(QuotaCounter::getDailyCount).orElse(0);
    }

    @Test
    void testBrowseAndReview_EndToEnd() {
        // Given
        givenCategoryListing();
        when(profileService.find(SUBJECT)).thenReturn(Optional.of(
                UserProfile.builder().subjectId(SUBJECT).name("Alex").promotion("2027").build()));
        when(reviewService.create(eq(SUBJECT), eq(COURSE_ID), any(Ratings.class), eq("ok"), eq(false)))
                .thenAnswer(inv -> Review.builder().reviewId("review_1").courseId(COURSE_ID).userId(SUBJECT).build());

        // When / Then
        assertEquals(ReplyType.SUCCESS, router.handle(InboundEvent.command(SUBJECT, "/start")).type());
        assertEquals(ConversationState.ROOT, state());

        BotReply courses = callback("category_MAA");
        assertEquals(ConversationState.BROWSING, state());
        assertEquals(CourseCategory.MAA, sessionStore.peek(SUBJECT).orElseThrow().getContext().getCategory());
        assertTrue(courses.offers("course_" + COURSE_ID));

        BotReply card = callback("course_" + COURSE_ID);
        assertEquals(ConversationState.VIEWING_RECORD, state());
        assertTrue(card.offers("write_review_" + COURSE_ID));

        assertTrue(callback("write_review_" + COURSE_ID).offers("rating_overall_5"));
        assertEquals(ConversationState.DRAFTING, state());
        assertTrue(callback("rating_overall_4").offers("rating_quality_1"));
        assertTrue(callback("rating_quality_4").offers("rating_difficulty_1"));
        assertTrue(callback("rating_difficulty_3").offers("add_text_review"));
        callback("add_text_review");
        assertTrue(text("ok").offers("review_anonymous_no"));

        BotReply summary = callback("review_anonymous_no");
        assertTrue(summary.offers("confirm_review"));
        assertTrue(summary.text().contains("Alex (2027)"));

        BotReply published = callback("confirm_review");

        // Then
        assertEquals(ReplyType.SUCCESS, published.type());
        assertEquals(ConversationState.ROOT, state());
        assertTrue(draftEditor.current(SUBJECT).isEmpty());
        verify(reviewService).create(eq(SUBJECT), eq(COURSE_ID),
                argThat(r -> r.getOverall() == 4 && r.getQuality() == 4 && r.getDifficulty() == 3), eq("ok"), eq(false));
        assertEquals(11, dailyCount());
    }

    @Test
    void testNamedReviewWithoutProfile_CollectsNameAndPromotion() {
        // Given
        givenCategoryListing();
        when(profileService.find(SUBJECT)).thenReturn(Optional.empty());
        when(profileService.normalizeName("  Sam ")).thenReturn("Sam");
        when(profileService.normalizePromotion("2028")).thenReturn("2028");
        callback("category_MAA");
        callback("course_" + COURSE_ID);
        callback("write_review_" + COURSE_ID);
        callback("rating_overall_5");
        callback("rating_quality_5");
        callback("rating_difficulty_5");
        callback("skip_text_review");

        // When
        callback("review_anonymous_no");
        assertEquals(ConversationState.COLLECTING_PROFILE_NAME, state());
        text("  Sam ");
        assertEquals(ConversationState.COLLECTING_PROFILE_TAG, state());
        BotReply summary = text("2028");

        // Then
        verify(profileService).save(SUBJECT, "Sam", "2028");
        assertEquals(ConversationState.DRAFTING, state());
        assertTrue(summary.offers("confirm_review"));
    }

    @Test
    void testDailyLimit_RateLimitedUntilMidnight() {
        // Given
        counterStore.put(QuotaCounter.builder().subjectId(SUBJECT).dailyCount(100).lifetimeCount(250)
                .windowDate("2026-09-07").build());

        // When
        BotReply reply = router.handle(InboundEvent.command(SUBJECT, "/start"));

        // Then
        assertEquals(ReplyType.RATE_LIMITED, reply.type());
        assertTrue(reply.text().contains("2026-09-08 00:00 UTC"));
        assertEquals(250L, counterStore.find(SUBJECT).orElseThrow().getLifetimeCount());
        assertNull(state());

        // And the next day is open again
        clock.advance(Duration.ofHours(11));
        assertEquals(ReplyType.SUCCESS, router.handle(InboundEvent.command(SUBJECT, "/start")).type());
        assertEquals(1, dailyCount());
    }

    @Test
    void testDailyLimit_ResetTimeInReferenceZone() {
        // Given: 22:00 in Tokyo, so the window closes two hours later
        ReflectionTestUtils.setField(quotaGate, "zone", "Asia/Tokyo");
        counterStore.put(QuotaCounter.builder().subjectId(SUBJECT).dailyCount(100).lifetimeCount(100)
                .windowDate("2026-09-07").build());

        // When
        BotReply reply = router.handle(InboundEvent.command(SUBJECT, "/start"));

        // Then
        assertEquals(ReplyType.RATE_LIMITED, reply.type());
        assertTrue(reply.text().contains("2026-09-08 00:00 Asia/Tokyo"), reply.text());

        clock.advance(Duration.ofHours(2));
        assertEquals(ReplyType.SUCCESS, router.handle(InboundEvent.command(SUBJECT, "/start")).type());
    }

    @Test
    void testUnknownCommand() {
        BotReply reply = router.handle(InboundEvent.command(SUBJECT, "/launch"));

        assertEquals(ReplyType.UNKNOWN_COMMAND, reply.type());
        assertEquals(1, dailyCount());
    }

    @Test
    void testUnknownCallback() {
        BotReply reply = callback("launch_rockets");

        assertEquals(ReplyType.UNKNOWN_ACTION, reply.type());
        assertTrue(reply.offers(Tokens.MAIN_MENU));
    }

    @Test
    void testMalformedCallback_ValidationError() {
        assertEquals(ReplyType.VALIDATION_ERROR, callback("rating_overall_9").type());
    }

    @Test
    void testFreeTextAtRoot_UnrecognizedWithMenu() {
        // Given
        router.handle(InboundEvent.command(SUBJECT, "start"));

        // When
        BotReply reply = text("hello there");

        // Then
        assertEquals(ReplyType.UNRECOGNIZED_INPUT, reply.type());
        assertTrue(reply.offers(Tokens.BROWSE_CATEGORIES));
        assertEquals(ConversationState.ROOT, state());
    }

    @Test
    void testInvalidTransition_ResetsToRoot() {
        // Given: browsing a category, where writing a review is not reachable
        givenCategoryListing();
        callback("category_MAA");
        assertEquals(ConversationState.BROWSING, state());

        // When
        BotReply reply = callback("write_review_" + COURSE_ID);

        // Then
        assertEquals(ReplyType.RESET, reply.type());
        assertEquals(ConversationState.ROOT, state());
        assertTrue(draftEditor.current(SUBJECT).isEmpty());
    }

    @Test
    void testRatingWithoutDraft_NotFoundResets() {
        BotReply reply = callback("rating_overall_3");

        assertEquals(ReplyType.NOT_FOUND, reply.type());
        assertEquals(ConversationState.ROOT, state());
    }

    @Test
    void testOutOfStepButton_DiscardsDraftAndBlocksConfirm() {
        // Given: every rating filled in
        givenCategoryListing();
        callback("category_MAA");
        callback("course_" + COURSE_ID);
        callback("write_review_" + COURSE_ID);
        callback("rating_overall_4");
        callback("rating_quality_4");
        callback("rating_difficulty_4");

        // When
        BotReply reset = callback(Tokens.BROWSE_CATEGORIES);
        BotReply confirm = callback(Tokens.CONFIRM_REVIEW);

        // Then
        assertEquals(ReplyType.RESET, reset.type());
        assertNotEquals(ReplyType.SUCCESS, confirm.type());
        assertEquals(ConversationState.ROOT, state());
        assertTrue(draftEditor.current(SUBJECT).isEmpty());
        verify(reviewService, never()).create(anyLong(), anyString(), any(), any(), anyBoolean());
    }

    @Test
    void testConfirmOutsideDrafting_RefusedAndDiscarded() {
        // Given: a complete draft while the session sits at the main menu
        router.handle(InboundEvent.command(SUBJECT, "/start"));
        draftEditor.begin(SUBJECT, COURSE_ID, null);
        for (RatingDimension dimension : RatingDimension.values()) {
            draftEditor.setRating(SUBJECT, dimension, 5);
        }

        // When
        BotReply reply = callback(Tokens.CONFIRM_REVIEW);

        // Then
        assertEquals(ReplyType.RESET, reply.type());
        assertEquals(ConversationState.ROOT, state());
        assertTrue(draftEditor.current(SUBJECT).isEmpty());
        verify(reviewService, never()).create(anyLong(), anyString(), any(), any(), anyBoolean());
    }

    @Test
    void testEditButtonsAfterReset_DoNotSave() {
        // Given
        givenOwnReview();
        callback("my_reviews");
        callback("edit_review_review_7");
        assertEquals(ConversationState.EDITING_RECORD, state());

        // When
        BotReply reset = callback(Tokens.BROWSE_CATEGORIES);
        BotReply saved = callback("save_review_review_7");

        // Then
        assertEquals(ReplyType.RESET, reset.type());
        assertEquals(ReplyType.NOT_FOUND, saved.type());
        assertEquals(ConversationState.ROOT, state());
        verify(reviewService, never()).update(anyLong(), anyString(), any(), any(), anyBoolean());
    }

    @Test
    void testSecondReviewOfCourse_OffersEdit() {
        // Given
        givenCategoryListing();
        doThrow(new DuplicateSubmissionException(COURSE_ID, "review_old"))
                .when(reviewService).checkEligible(SUBJECT, COURSE_ID);
        callback("category_MAA");
        callback("course_" + COURSE_ID);

        // When
        BotReply reply = callback("write_review_" + COURSE_ID);

        // Then
        assertEquals(ReplyType.DUPLICATE_SUBMISSION, reply.type());
        assertTrue(reply.offers("edit_review_review_old"));
        assertEquals(ConversationState.VIEWING_OWN_RECORDS, state());
    }

    @Test
    void testEditOwnReview_TextAndRatingSaved() {
        // Given
        Review mine = givenOwnReview();
        when(reviewService.update(eq(SUBJECT), eq("review_7"), any(Ratings.class), any(), anyBoolean())).thenReturn(mine);

        // When
        assertTrue(callback("my_reviews").offers("manage_review_review_7"));
        assertTrue(callback("manage_review_review_7").offers("edit_review_review_7"));
        callback("edit_review_review_7");
        assertEquals(ConversationState.EDITING_RECORD, state());
        callback("set_rating_review_7_overall_5");
        callback("edit_text_review_7");
        assertEquals(ConversationState.EDITING_RECORD_TEXT, state());
        text("much better after the midterm");
        BotReply saved = callback("save_review_review_7");

        // Then
        assertEquals(ReplyType.SUCCESS, saved.type());
        assertEquals(ConversationState.VIEWING_OWN_RECORDS, state());
        verify(reviewService).update(eq(SUBJECT), eq("review_7"),
                argThat(r -> r.getOverall() == 5 && r.getQuality() == 3), eq("much better after the midterm"), eq(false));
        verify(reviewService, never()).create(anyLong(), anyString(), any(), any(), anyBoolean());
    }

    @Test
    void testEditText_KeepWordLeavesText() {
        // Given
        givenOwnReview();
        callback("my_reviews");
        callback("edit_review_review_7");
        callback("edit_text_review_7");

        // When
        text("cancel");

        // Then
        assertEquals("meh", draftEditor.current(SUBJECT).orElseThrow().getText());
        assertEquals(ConversationState.EDITING_RECORD, state());
    }

    @Test
    void testStoreUnavailable_NotCounted() {
        // Given
        when(courseService.coursesPage(eq(CourseCategory.PHY), anyInt()))
                .thenThrow(new StoreUnavailableException("course.byCategory", new RuntimeException("down")));

        // When
        BotReply reply = callback("category_PHY");

        // Then
        assertEquals(ReplyType.UNAVAILABLE, reply.type());
        assertEquals(0, dailyCount());
    }

    @Test
    void testCancelReview_DiscardsDraft() {
        // Given
        givenCategoryListing();
        callback("category_MAA");
        callback("course_" + COURSE_ID);
        callback("write_review_" + COURSE_ID);
        assertTrue(draftEditor.current(SUBJECT).isPresent());

        // When
        BotReply reply = callback("cancel_review");

        // Then
        assertEquals(ReplyType.SUCCESS, reply.type());
        assertEquals(ConversationState.ROOT, state());
        assertTrue(draftEditor.current(SUBJECT).isEmpty());
    }

    @Test
    void testNormalizeCommand() {
        assertEquals("start", EventRouter.normalizeCommand("/start"));
        assertEquals("start", EventRouter.normalizeCommand("/Start@review_bot payload"));
        assertEquals("help", EventRouter.normalizeCommand(" help "));
        assertEquals("", EventRouter.normalizeCommand(null));
    }
}
