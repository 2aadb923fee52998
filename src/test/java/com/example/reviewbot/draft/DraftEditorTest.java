package com.example.reviewbot.draft;

import com.example.reviewbot.error.ConflictException;
import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.error.ValidationException;
import com.example.reviewbot.model.RatingDimension;
import com.example.reviewbot.model.Ratings;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.model.ReviewDraft;
import com.example.reviewbot.service.ReviewService;
import com.example.reviewbot.support.InMemoryKvClient;
import com.example.reviewbot.support.MutableClock;
import com.example.reviewbot.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DraftEditorTest {

    private static final long SUBJECT = 42L;

    @Mock
    private ReviewService reviewService;

    private InMemoryKvClient kvClient;
    private DraftStore draftStore;
    private DraftEditor editor;

    @BeforeEach
    void setUp() {
        kvClient = new InMemoryKvClient();
        draftStore = new DraftStore(kvClient, TestStores.objectMapper(), TestStores.storeRetry());
        ReflectionTestUtils.setField(draftStore, "ttlMs", Duration.ofMinutes(30).toMillis());
        editor = new DraftEditor(draftStore, reviewService, new MutableClock(Instant.parse("2026-04-01T09:00:00Z")));
    }

    private void rateAll(int value) {
        for (RatingDimension dimension : RatingDimension.values()) {
            editor.setRating(SUBJECT, dimension, value);
        }
    }

    @Test
    void testBegin_StoresDraftWithTtl() {
        // When
        editor.begin(SUBJECT, "MAA101", null);

        // Then
        ReviewDraft draft = editor.current(SUBJECT).orElseThrow();
        assertEquals("MAA101", draft.getTargetCourseId());
        assertNull(draft.getSourceReviewId());
        assertEquals(Duration.ofMinutes(30), kvClient.ttl("draft:" + SUBJECT).orElseThrow());
    }

    @Test
    void testBegin_SeedsFromOwnReview() {
        // Given
        Review source = Review.builder()
                .reviewId("review_1").courseId("PHY200").userId(SUBJECT)
                .ratings(new Ratings(4, 3, 2)).text("solid").anonymous(true)
                .build();
        when(reviewService.ownedReview(SUBJECT, "review_1")).thenReturn(source);

        // When
        ReviewDraft draft = editor.begin(SUBJECT, null, "review_1");

        // Then
        assertEquals("PHY200", draft.getTargetCourseId());
        assertEquals("review_1", draft.getSourceReviewId());
        assertEquals(4, draft.getRatings().getOverall());
        assertEquals("solid", draft.getText());
        assertTrue(draft.isAnonymous());
    }

    @Test
    void testSetRating_OutOfRangeLeavesDraftUnchanged() {
        // Given
        editor.begin(SUBJECT, "MAA101", null);
        editor.setRating(SUBJECT, RatingDimension.OVERALL, 3);

        // When / Then
        assertThrows(ValidationException.class, () -> editor.setRating(SUBJECT, RatingDimension.OVERALL, 6));
        assertThrows(ValidationException.class, () -> editor.setRating(SUBJECT, RatingDimension.QUALITY, 0));
        Ratings ratings = editor.current(SUBJECT).orElseThrow().getRatings();
        assertEquals(3, ratings.getOverall());
        assertNull(ratings.getQuality());
    }

    @Test
    void testSetText_TooLongRejected() {
        // Given
        editor.begin(SUBJECT, "MAA101", null);
        editor.setText(SUBJECT, "first version");

        // When / Then
        String tooLong = "x".repeat(DraftEditor.MAX_TEXT_LENGTH + 1);
        assertThrows(ValidationException.class, () -> editor.setText(SUBJECT, tooLong));
        assertEquals("first version", editor.current(SUBJECT).orElseThrow().getText());
    }

    @Test
    void testSetText_TrimsAndBlankRemoves() {
        editor.begin(SUBJECT, "MAA101", null);

        assertEquals("good lectures", editor.setText(SUBJECT, "  good lectures \n").getText());
        assertNull(editor.setText(SUBJECT, "   ").getText());
    }

    @Test
    void testSetRating_WithoutDraftIsNotFound() {
        assertThrows(NotFoundException.class, () -> editor.setRating(SUBJECT, RatingDimension.OVERALL, 3));
    }

    @Test
    void testToggleAnonymous() {
        editor.begin(SUBJECT, "MAA101", null);

        assertTrue(editor.toggleAnonymous(SUBJECT).isAnonymous());
        assertFalse(editor.toggleAnonymous(SUBJECT).isAnonymous());
    }

    @Test
    void testCommit_MissingRatingRejectedBeforeWrite() {
        // Given
        editor.begin(SUBJECT, "MAA101", null);
        editor.setRating(SUBJECT, RatingDimension.OVERALL, 4);

        // When / Then
        assertThrows(ValidationException.class, () -> editor.commit(SUBJECT));
        verifyNoInteractions(reviewService);
        assertFalse(editor.current(SUBJECT).orElseThrow().isSubmitting());
    }

    @Test
    void testCommit_OutOfRangeRatingRejectedBeforeWrite() {
        // Given: a stored review whose rating no longer fits the scale
        Review source = Review.builder().reviewId("review_1").courseId("PHY200").userId(SUBJECT)
                .ratings(new Ratings(6, 3, 0)).text("fine").build();
        when(reviewService.ownedReview(SUBJECT, "review_1")).thenReturn(source);
        editor.begin(SUBJECT, null, "review_1");

        // When
        assertThrows(ValidationException.class, () -> editor.commit(SUBJECT));

        // Then
        verify(reviewService, never()).update(anyLong(), anyString(), any(), any(), anyBoolean());
        verify(reviewService, never()).create(anyLong(), anyString(), any(), any(), anyBoolean());
        ReviewDraft draft = editor.current(SUBJECT).orElseThrow();
        assertFalse(draft.isSubmitting());
        assertEquals(6, draft.getRatings().getOverall());
        assertEquals(0, draft.getRatings().getDifficulty());
        assertEquals("fine", draft.getText());
    }

    @Test
    void testCommit_OverlongTextRejectedBeforeWrite() {
        // Given
        String text = "x".repeat(DraftEditor.MAX_TEXT_LENGTH + 1);
        Review source = Review.builder().reviewId("review_1").courseId("PHY200").userId(SUBJECT)
                .ratings(new Ratings(4, 4, 4)).text(text).build();
        when(reviewService.ownedReview(SUBJECT, "review_1")).thenReturn(source);
        editor.begin(SUBJECT, null, "review_1");

        // When
        assertThrows(ValidationException.class, () -> editor.commit(SUBJECT));

        // Then
        verify(reviewService, never()).update(anyLong(), anyString(), any(), any(), anyBoolean());
        ReviewDraft draft = editor.current(SUBJECT).orElseThrow();
        assertFalse(draft.isSubmitting());
        assertEquals(text, draft.getText());
        assertEquals("review_1", draft.getSourceReviewId());
    }

    @Test
    void testCommit_NewDraftCreatesAndDeletes() {
        // Given
        editor.begin(SUBJECT, "MAA101", null);
        rateAll(4);
        editor.setText(SUBJECT, "ok");
        Review created = Review.builder().reviewId("review_9").courseId("MAA101").userId(SUBJECT).build();
        when(reviewService.create(eq(SUBJECT), eq("MAA101"), any(Ratings.class), eq("ok"), eq(false))).thenReturn(created);

        // When
        Review result = editor.commit(SUBJECT);

        // Then
        assertEquals("review_9", result.getReviewId());
        assertTrue(editor.current(SUBJECT).isEmpty());
        verify(reviewService, never()).update(anyLong(), anyString(), any(), any(), anyBoolean());
    }

    @Test
    void testCommit_EditUpdatesSourceReview() {
        // Given
        Review source = Review.builder().reviewId("review_1").courseId("PHY200").userId(SUBJECT)
                .ratings(new Ratings(2, 2, 2)).build();
        when(reviewService.ownedReview(SUBJECT, "review_1")).thenReturn(source);
        editor.begin(SUBJECT, null, "review_1");
        editor.setRating(SUBJECT, RatingDimension.OVERALL, 5);
        when(reviewService.update(eq(SUBJECT), eq("review_1"), any(Ratings.class), isNull(), eq(false))).thenReturn(source);

        // When
        editor.commit(SUBJECT);

        // Then
        verify(reviewService).update(eq(SUBJECT), eq("review_1"),
                argThat(r -> r.getOverall() == 5 && r.getQuality() == 2), isNull(), eq(false));
        assertTrue(editor.current(SUBJECT).isEmpty());
    }

    @Test
    void testCommit_FailureKeepsDraftForRetry() {
        // Given
        editor.begin(SUBJECT, "MAA101", null);
        rateAll(3);
        when(reviewService.create(anyLong(), anyString(), any(), any(), anyBoolean()))
                .thenThrow(new ConflictException("busy"));

        // When
        assertThrows(ConflictException.class, () -> editor.commit(SUBJECT));

        // Then
        ReviewDraft draft = editor.current(SUBJECT).orElseThrow();
        assertFalse(draft.isSubmitting());
        assertEquals(3, draft.getRatings().getDifficulty());
    }

    @Test
    void testDiscard_RemovesIdleDraft() {
        editor.begin(SUBJECT, "MAA101", null);

        assertTrue(editor.discard(SUBJECT).isPresent());
        assertTrue(editor.current(SUBJECT).isEmpty());
        assertTrue(editor.discard(SUBJECT).isEmpty());
    }

    @Test
    void testDiscard_KeepsDraftWithCommitInFlight() {
        // Given
        ReviewDraft draft = editor.begin(SUBJECT, "MAA101", null);
        draft.setSubmitting(true);
        draftStore.put(draft);

        // When
        ReviewDraft found = editor.discard(SUBJECT).orElseThrow();

        // Then
        assertTrue(found.isSubmitting());
        assertTrue(editor.current(SUBJECT).isPresent());
    }
}
