package com.example.reviewbot.service;

import com.example.reviewbot.error.NotFoundException;
import com.example.reviewbot.model.AverageRatings;
import com.example.reviewbot.model.Course;
import com.example.reviewbot.model.CourseCategory;
import com.example.reviewbot.model.Review;
import com.example.reviewbot.repo.CourseRepo;
import com.example.reviewbot.repo.ReviewRepo;
import com.example.reviewbot.store.StoreRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.function.ToIntFunction;

@Service
public class CourseService {

    private static final Logger logger = LoggerFactory.getLogger(CourseService.class);

    public static final int COURSES_PER_PAGE = 10;

    private final CourseRepo courseRepo;
    private final ReviewRepo reviewRepo;
    private final StoreRetry storeRetry;
    private final Clock clock;

    public CourseService(CourseRepo courseRepo, ReviewRepo reviewRepo, StoreRetry storeRetry, Clock clock) {
        this.courseRepo = courseRepo;
        this.reviewRepo = reviewRepo;
        this.storeRetry = storeRetry;
        this.clock = clock;
    }

    public Course findCourse(String courseId) {
        return storeRetry.call("course.get", () -> courseRepo.findById(courseId))
                .orElseThrow(() -> new NotFoundException("Course not found"));
    }

    public PageSlice<Course> coursesPage(CourseCategory category, int page) {
        return PageSlice.of(coursesIn(category), page, COURSES_PER_PAGE);
    }

    public List<Course> coursesIn(CourseCategory category) {
        return storeRetry.call("course.list", () -> courseRepo.findByCategoryOrderByNameAsc(category));
    }

    /** Recomputes the averages and review count of a course from its live reviews. */
    public void refreshAverages(String courseId) {
        storeRetry.run("course.averages", () -> {
            Course course = courseRepo.findById(courseId).orElse(null);
            if (course == null) {
                logger.warn("Cannot refresh averages, course {} is gone", courseId);
                return;
            }
            List<Review> reviews = reviewRepo.findByCourseIdAndDeletedFalse(courseId);
            course.setReviewCount(reviews.size());
            course.setAverageRatings(reviews.isEmpty() ? null : AverageRatings.builder()
                    .overall(average(reviews, r -> r.getRatings().getOverall()))
                    .quality(average(reviews, r -> r.getRatings().getQuality()))
                    .difficulty(average(reviews, r -> r.getRatings().getDifficulty()))
                    .build());
            course.setUpdatedAt(clock.instant());
            courseRepo.save(course);
        });
    }

    private static double average(List<Review> reviews, ToIntFunction<Review> rating) {
        double avg = reviews.stream().mapToInt(rating).average().orElse(0);
        return Math.round(avg * 10) / 10.0;
    }
}
