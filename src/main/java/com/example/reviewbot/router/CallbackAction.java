package com.example.reviewbot.router;

/**
 * Closed set of button actions. See {@link CallbackTokenParser} for the token grammar.
 */
public enum CallbackAction {
    MAIN_MENU,
    HELP,
    NOOP,

    BROWSE_CATEGORIES,
    CATEGORIES_PAGE,
    CATEGORY,
    COURSES_PAGE,
    COURSE,
    COURSE_DETAILS,
    COURSE_FROM_REVIEW,
    BACK_TO_CATEGORY,
    BACK_TO_COURSE,
    REVIEWS,
    REVIEWS_PAGE,
    VOTE,

    POST_REVIEW,
    REVIEW_CATEGORY,
    REVIEW_COURSE,
    WRITE_REVIEW,
    RATING,
    ADD_TEXT,
    EDIT_DRAFT_TEXT,
    SKIP_TEXT,
    REMOVE_DRAFT_TEXT,
    ANONYMITY,
    EDIT_CURRENT,
    EDIT_ANONYMITY,
    CONFIRM_REVIEW,
    CANCEL_REVIEW,

    MY_REVIEWS,
    MANAGE_REVIEW,
    DELETE_REVIEW,
    CONFIRM_DELETE,

    EDIT_REVIEW,
    EDIT_RATING,
    SET_RATING,
    EDIT_TEXT,
    EDIT_ANONYMOUS,
    SAVE_REVIEW,
    CANCEL_EDIT
}
