package com.example.reviewbot.repo;

import com.example.reviewbot.model.Review;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ReviewRepo extends MongoRepository<Review, String> {
    List<Review> findByCourseIdAndDeletedFalse(String courseId);
    List<Review> findByUserIdAndDeletedFalseOrderByCreatedAtDesc(long userId);
    Optional<Review> findFirstByUserIdAndCourseIdAndDeletedFalse(long userId, String courseId);
}
