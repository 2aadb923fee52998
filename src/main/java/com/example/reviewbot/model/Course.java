package com.example.reviewbot.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("courses")
public class Course {
    @Id
    private String courseId;
    @Indexed
    private CourseCategory category;
    private String name;
    private String description;
    private String gradingScheme;
    private AverageRatings averageRatings;
    private int reviewCount;
    private Instant updatedAt;
}
