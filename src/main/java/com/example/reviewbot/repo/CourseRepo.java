package com.example.reviewbot.repo;

import com.example.reviewbot.model.Course;
import com.example.reviewbot.model.CourseCategory;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CourseRepo extends MongoRepository<Course, String> {
    List<Course> findByCategoryOrderByNameAsc(CourseCategory category);
}
