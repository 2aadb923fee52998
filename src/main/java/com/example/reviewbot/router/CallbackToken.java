package com.example.reviewbot.router;

import com.example.reviewbot.model.CourseCategory;
import com.example.reviewbot.model.RatingDimension;
import com.example.reviewbot.model.VoteDirection;

/**
 * A parsed button token. Only the arguments of the given action are set:
 * {@code id} is a course or review id, {@code number} a page or rating value,
 * {@code flag} the yes/no of an anonymity choice.
 */
public record CallbackToken(CallbackAction action,
                            String id,
                            CourseCategory category,
                            RatingDimension dimension,
                            VoteDirection direction,
                            Integer number,
                            Boolean flag) {

    public static CallbackToken of(CallbackAction action) {
        return new CallbackToken(action, null, null, null, null, null, null);
    }

    public static CallbackToken withId(CallbackAction action, String id) {
        return new CallbackToken(action, id, null, null, null, null, null);
    }

    public static CallbackToken withCategory(CallbackAction action, CourseCategory category, Integer page) {
        return new CallbackToken(action, null, category, null, null, page, null);
    }

    public static CallbackToken withNumber(CallbackAction action, String id, int number) {
        return new CallbackToken(action, id, null, null, null, number, null);
    }

    public static CallbackToken rating(CallbackAction action, String id, RatingDimension dimension, Integer value) {
        return new CallbackToken(action, id, null, dimension, null, value, null);
    }

    public static CallbackToken vote(String reviewId, VoteDirection direction) {
        return new CallbackToken(CallbackAction.VOTE, reviewId, null, null, direction, null, null);
    }

    public static CallbackToken withFlag(CallbackAction action, boolean flag) {
        return new CallbackToken(action, null, null, null, null, null, flag);
    }

    public int page() {
        return number == null ? 1 : number;
    }
}
