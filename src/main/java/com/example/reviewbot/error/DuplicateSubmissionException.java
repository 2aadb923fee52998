package com.example.reviewbot.error;

public class DuplicateSubmissionException extends ReviewBotException {

    private final String courseId;
    private final String existingReviewId;

    public DuplicateSubmissionException(String courseId, String existingReviewId) {
        super("You have already reviewed this course");
        this.courseId = courseId;
        this.existingReviewId = existingReviewId;
    }

    public String getCourseId() { return courseId; }
    public String getExistingReviewId() { return existingReviewId; }
}
