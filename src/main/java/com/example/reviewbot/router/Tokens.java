package com.example.reviewbot.router;

import com.example.reviewbot.model.CourseCategory;
import com.example.reviewbot.model.RatingDimension;
import com.example.reviewbot.model.VoteDirection;

/** Builds the button tokens understood by {@link CallbackTokenParser}. */
public final class Tokens {

    public static final String MAIN_MENU = "main_menu";
    public static final String HELP = "help";
    public static final String NOOP = "noop";
    public static final String BROWSE_CATEGORIES = "browse_categories";
    public static final String BACK_TO_CATEGORY = "back_to_category";
    public static final String BACK_TO_COURSE = "back_course";
    public static final String POST_REVIEW = "post_review";
    public static final String ADD_TEXT = "add_text_review";
    public static final String SKIP_TEXT = "skip_text_review";
    public static final String EDIT_DRAFT_TEXT = "edit_review_text";
    public static final String REMOVE_DRAFT_TEXT = "remove_review_text";
    public static final String EDIT_CURRENT = "edit_current_review";
    public static final String EDIT_ANONYMITY = "edit_anonymity";
    public static final String CONFIRM_REVIEW = "confirm_review";
    public static final String CANCEL_REVIEW = "cancel_review";
    public static final String MY_REVIEWS = "my_reviews";

    private Tokens() {
    }

    public static String categoriesPage(int page) { return "categories_page_" + page; }
    public static String category(CourseCategory category) { return "category_" + category.name(); }
    public static String coursesPage(CourseCategory category, int page) { return "courses_" + category.name() + "_page_" + page; }
    public static String course(String courseId) { return "course_" + courseId; }
    public static String courseDetails(String courseId) { return "course_details_" + courseId; }
    public static String courseFromReview(String reviewId) { return "view_course_from_review_" + reviewId; }
    public static String reviews(String courseId) { return "reviews_" + courseId; }
    public static String reviewsPage(String courseId, int page) { return "reviews_" + courseId + "_page_" + page; }
    public static String vote(String reviewId, VoteDirection direction) { return "vote_" + reviewId + "_" + direction.token(); }

    public static String reviewCategory(CourseCategory category) { return "review_category_" + category.name(); }
    public static String reviewCourse(String courseId) { return "review_course_" + courseId; }
    public static String writeReview(String courseId) { return "write_review_" + courseId; }
    public static String rating(RatingDimension dimension, int value) { return "rating_" + dimension.token() + "_" + value; }
    public static String anonymous(boolean yes) { return "review_anonymous_" + (yes ? "yes" : "no"); }

    public static String myReviewsPage(int page) { return "my_reviews_page_" + page; }
    public static String manageReview(String reviewId) { return "manage_review_" + reviewId; }
    public static String deleteReview(String reviewId) { return "delete_review_" + reviewId; }
    public static String confirmDelete(String reviewId) { return "confirm_delete_" + reviewId; }

    public static String editReview(String reviewId) { return "edit_review_" + reviewId; }
    public static String editRating(String reviewId, RatingDimension dimension) { return "edit_rating_" + reviewId + "_" + dimension.token(); }
    public static String setRating(String reviewId, RatingDimension dimension, int value) {
        return "set_rating_" + reviewId + "_" + dimension.token() + "_" + value;
    }
    public static String editText(String reviewId) { return "edit_text_" + reviewId; }
    public static String editAnonymous(String reviewId) { return "edit_anonymous_" + reviewId; }
    public static String saveReview(String reviewId) { return "save_review_" + reviewId; }
    public static String cancelEdit(String reviewId) { return "cancel_edit_" + reviewId; }
}
