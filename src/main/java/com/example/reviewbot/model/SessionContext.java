package com.example.reviewbot.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * State-specific payload of a session. Which fields are set depends on the state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionContext {
    private CourseCategory category;
    private String courseId;
    private String reviewId;
    private DraftStep step;
    private Integer page;
    private String profileName;

    public static SessionContext empty() {
        return new SessionContext();
    }
}
