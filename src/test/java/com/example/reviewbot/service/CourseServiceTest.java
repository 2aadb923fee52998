package com.example.reviewbot.service;

import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.Course;
import com.example.reviewbot.model.CourseCategory;
import com.example.reviewbot.model.Ratings;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.repo.CourseRepo;
import com.example.reviewbot.repo.ReviewRepo;
import com.example.reviewbot.support.MutableClock;
import com.example.reviewbot.support.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CourseServiceTest {

    @Mock
    private CourseRepo courseRepo;

    @Mock
    private ReviewRepo reviewRepo;

    private CourseService courseService;

    @BeforeEach
    void setUp() {
        courseService = new CourseService(courseRepo, reviewRepo, TestStores.storeRetry(),
                new MutableClock(Instant.parse("2026-02-20T10:00:00Z")));
    }

    private static Review rated(int overall, int quality, int difficulty) {
        return Review.builder().courseId("PHY101").ratings(new Ratings(overall, quality, difficulty)).build();
    }

    @Test
    void testFindCourse_MissingIsNotFound() {
        when(courseRepo.findById("NOPE")).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> courseService.findCourse("NOPE"));
    }

    @Test
    void testCoursesPage_TenPerPage() {
        // Given
        List<Course> courses = new ArrayList<>();
        for (int i = 0; i < 23; i++) {
            courses.add(Course.builder().courseId("CSE" + (100 + i)).category(CourseCategory.CSE).build());
        }
        when(courseRepo.findByCategoryOrderByNameAsc(CourseCategory.CSE)).thenReturn(courses);

        // When
        PageSlice<Course> last = courseService.coursesPage(CourseCategory.CSE, 3);
        PageSlice<Course> clamped = courseService.coursesPage(CourseCategory.CSE, 9);

        // Then
        assertEquals(3, last.totalPages());
        assertEquals(3, last.items().size());
        assertEquals("CSE120", last.items().get(0).getCourseId());
        assertEquals(3, clamped.page());
        assertEquals(3, clamped.items().size());
        assertEquals(23, clamped.totalItems());
    }

    @Test
    void testRefreshAverages_RoundedToOneDecimal() {
        // Given
        Course course = Course.builder().courseId("PHY101").category(CourseCategory.PHY).build();
        when(courseRepo.findById("PHY101")).thenReturn(Optional.of(course));
        when(reviewRepo.findByCourseIdAndDeletedFalse("PHY101"))
                .thenReturn(List.of(rated(5, 4, 2), rated(4, 4, 3), rated(4, 3, 3)));

        // When
        courseService.refreshAverages("PHY101");

        // Then
        ArgumentCaptor<Course> saved = ArgumentCaptor.forClass(Course.class);
        verify(courseRepo).save(saved.capture());
        assertEquals(3, saved.getValue().getReviewCount());
        assertEquals(4.3, saved.getValue().getAverageRatings().getOverall(), 1e-9);
        assertEquals(3.7, saved.getValue().getAverageRatings().getQuality(), 1e-9);
        assertEquals(2.7, saved.getValue().getAverageRatings().getDifficulty(), 1e-9);
    }

    @Test
    void testRefreshAverages_NoReviewsClearsAverages() {
        // Given
        Course course = Course.builder().courseId("PHY101").reviewCount(1).build();
        when(courseRepo.findById("PHY101")).thenReturn(Optional.of(course));
        when(reviewRepo.findByCourseIdAndDeletedFalse("PHY101")).thenReturn(List.of());

        // When
        courseService.refreshAverages("PHY101");

        // Then
        verify(courseRepo).save(argThat((Course c) -> c.getReviewCount() == 0 && c.getAverageRatings() == null));
    }

    @Test
    void testRefreshAverages_MissingCourseSkipped() {
        when(courseRepo.findById("GONE")).thenReturn(Optional.empty());

        courseService.refreshAverages("GONE");

        verify(courseRepo, never()).save(any(Course.class));
        verifyNoInteractions(reviewRepo);
    }
}
