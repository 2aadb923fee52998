package com.example.reviewbot.router;

import com.example.reviewbot.error.ValidationException;
import com.example.reviewbot.model.CourseCategory;
import com.example.reviewbot.model.RatingDimension;
import com.example.reviewbot.model.VoteDirection;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;

/**
 * Parses button tokens into {@link CallbackToken}s.
 * <p>
 * Tokens are {@code _}-delimited and ids may themselves contain {@code _}. Exact tokens
 * are looked up first, then the longest matching prefix wins, so the result does not
 * depend on the order rules are declared in. Fixed-width trailing arguments (a rating
 * digit, a page number, a vote direction) are taken from the right and whatever is left
 * is the id.
 * <p>
 * An unknown token yields empty; a known action with bad arguments is a
 * {@link ValidationException}.
 */
@Component
public class CallbackTokenParser {

    private final Map<String, CallbackToken> exact = new HashMap<>();
    private final List<PrefixRule> prefixRules = new ArrayList<>();

    public CallbackTokenParser() {
        exact("main_menu", CallbackAction.MAIN_MENU);
        exact("back_main_menu", CallbackAction.MAIN_MENU);
        exact("help", CallbackAction.HELP);
        exact("noop", CallbackAction.NOOP);
        exact("browse_categories", CallbackAction.BROWSE_CATEGORIES);
        exact("back_categories", CallbackAction.BROWSE_CATEGORIES);
        exact("back_to_category", CallbackAction.BACK_TO_CATEGORY);
        exact("back_course", CallbackAction.BACK_TO_COURSE);
        exact("post_review", CallbackAction.POST_REVIEW);
        exact("add_text_review", CallbackAction.ADD_TEXT);
        exact("edit_review_text", CallbackAction.EDIT_DRAFT_TEXT);
        exact("skip_text_review", CallbackAction.SKIP_TEXT);
        exact("remove_review_text", CallbackAction.REMOVE_DRAFT_TEXT);
        exact("edit_current_review", CallbackAction.EDIT_CURRENT);
        exact("edit_anonymity", CallbackAction.EDIT_ANONYMITY);
        exact("confirm_review", CallbackAction.CONFIRM_REVIEW);
        exact("cancel_review", CallbackAction.CANCEL_REVIEW);
        exact("my_reviews", CallbackAction.MY_REVIEWS);

        prefix("categories_page_", rest -> CallbackToken.withNumber(CallbackAction.CATEGORIES_PAGE, null, page(rest)));
        prefix("category_", rest -> CallbackToken.withCategory(CallbackAction.CATEGORY, category(rest), null));
        prefix("back_category_", rest -> CallbackToken.withCategory(CallbackAction.CATEGORY, category(rest), null));
        prefix("courses_", rest -> {
            List<String> parts = splitRight(rest, 2);
            if (!"page".equals(parts.get(1))) throw malformed("courses_" + rest);
            return CallbackToken.withCategory(CallbackAction.COURSES_PAGE, category(parts.get(0)), page(parts.get(2)));
        });
        prefix("course_", rest -> CallbackToken.withId(CallbackAction.COURSE, id(rest)));
        prefix("back_course_", rest -> CallbackToken.withId(CallbackAction.COURSE, id(rest)));
        prefix("course_details_", rest -> CallbackToken.withId(CallbackAction.COURSE_DETAILS, id(rest)));
        prefix("view_course_from_review_", rest -> CallbackToken.withId(CallbackAction.COURSE_FROM_REVIEW, id(rest)));
        prefix("reviews_", rest -> {
            int cut = rest.lastIndexOf("_page_");
            if (cut > 0 && isNumber(rest.substring(cut + "_page_".length()))) {
                return CallbackToken.withNumber(CallbackAction.REVIEWS_PAGE, rest.substring(0, cut),
                        page(rest.substring(cut + "_page_".length())));
            }
            return CallbackToken.withId(CallbackAction.REVIEWS, id(rest));
        });
        prefix("vote_", rest -> {
            List<String> parts = splitRight(rest, 1);
            VoteDirection direction = VoteDirection.fromToken(parts.get(1))
                    .orElseThrow(() -> malformed("vote_" + rest));
            return CallbackToken.vote(id(parts.get(0)), direction);
        });

        prefix("review_category_", rest -> CallbackToken.withCategory(CallbackAction.REVIEW_CATEGORY, category(rest), null));
        prefix("review_course_", rest -> CallbackToken.withId(CallbackAction.REVIEW_COURSE, id(rest)));
        prefix("write_review_", rest -> CallbackToken.withId(CallbackAction.WRITE_REVIEW, id(rest)));
        prefix("rating_", rest -> {
            List<String> parts = splitRight(rest, 1);
            return CallbackToken.rating(CallbackAction.RATING, null, dimension(parts.get(0)), rating(parts.get(1)));
        });
        prefix("review_anonymous_", rest -> {
            if ("yes".equals(rest)) return CallbackToken.withFlag(CallbackAction.ANONYMITY, true);
            if ("no".equals(rest)) return CallbackToken.withFlag(CallbackAction.ANONYMITY, false);
            throw malformed("review_anonymous_" + rest);
        });

        prefix("my_reviews_page_", rest -> CallbackToken.withNumber(CallbackAction.MY_REVIEWS, null, page(rest)));
        prefix("manage_review_", rest -> CallbackToken.withId(CallbackAction.MANAGE_REVIEW, id(rest)));
        prefix("delete_review_", rest -> CallbackToken.withId(CallbackAction.DELETE_REVIEW, id(rest)));
        prefix("confirm_delete_", rest -> CallbackToken.withId(CallbackAction.CONFIRM_DELETE, id(rest)));

        prefix("edit_review_", rest -> CallbackToken.withId(CallbackAction.EDIT_REVIEW, id(rest)));
        prefix("edit_rating_", rest -> {
            List<String> parts = splitRight(rest, 1);
            return CallbackToken.rating(CallbackAction.EDIT_RATING, id(parts.get(0)), dimension(parts.get(1)), null);
        });
        prefix("set_rating_", rest -> {
            List<String> parts = splitRight(rest, 2);
            return CallbackToken.rating(CallbackAction.SET_RATING, id(parts.get(0)), dimension(parts.get(1)), rating(parts.get(2)));
        });
        prefix("edit_text_", rest -> CallbackToken.withId(CallbackAction.EDIT_TEXT, id(rest)));
        prefix("edit_anonymous_", rest -> CallbackToken.withId(CallbackAction.EDIT_ANONYMOUS, id(rest)));
        prefix("save_review_", rest -> CallbackToken.withId(CallbackAction.SAVE_REVIEW, id(rest)));
        prefix("cancel_edit_", rest -> CallbackToken.withId(CallbackAction.CANCEL_EDIT, id(rest)));

        prefixRules.sort(Comparator.comparingInt((PrefixRule r) -> r.prefix.length()).reversed());
    }

    public Optional<CallbackToken> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        String token = raw.trim();
        CallbackToken fixed = exact.get(token);
        if (fixed != null) return Optional.of(fixed);
        for (PrefixRule rule : prefixRules) {
            if (token.startsWith(rule.prefix)) {
                return Optional.of(rule.parser.apply(token.substring(rule.prefix.length())));
            }
        }
        return Optional.empty();
    }

    private void exact(String token, CallbackAction action) {
        exact.put(token, CallbackToken.of(action));
    }

    private void prefix(String prefix, Function<String, CallbackToken> parser) {
        prefixRules.add(new PrefixRule(prefix, parser));
    }

    /** Splits off {@code count} trailing segments: [head, tail1, ..., tailN]. */
    private static List<String> splitRight(String value, int count) {
        LinkedList<String> parts = new LinkedList<>();
        String head = value;
        for (int i = 0; i < count; i++) {
            int cut = head.lastIndexOf('_');
            if (cut <= 0 || cut == head.length() - 1) throw malformed(value);
            parts.addFirst(head.substring(cut + 1));
            head = head.substring(0, cut);
        }
        parts.addFirst(head);
        return parts;
    }

    private static String id(String value) {
        if (value.isEmpty()) throw malformed(value);
        return value;
    }

    private static CourseCategory category(String value) {
        return CourseCategory.fromCode(value).orElseThrow(() -> malformed(value));
    }

    private static RatingDimension dimension(String value) {
        return RatingDimension.fromToken(value).orElseThrow(() -> malformed(value));
    }

    private static int rating(String value) {
        if (value.length() != 1 || !isNumber(value)) throw malformed(value);
        int rating = Integer.parseInt(value);
        if (rating < 1 || rating > 5) throw new ValidationException("Rating must be between 1 and 5");
        return rating;
    }

    private static int page(String value) {
        if (!isNumber(value) || value.length() > 4) throw malformed(value);
        int page = Integer.parseInt(value);
        if (page < 1) throw malformed(value);
        return page;
    }

    private static boolean isNumber(String value) {
        if (value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) return false;
        }
        return true;
    }

    private static ValidationException malformed(String token) {
        return new ValidationException("This button is no longer valid (" + token + ")");
    }

    private static final class PrefixRule {
        private final String prefix;
        private final Function<String, CallbackToken> parser;

        PrefixRule(String prefix, Function<String, CallbackToken> parser) {
            this.prefix = prefix;
            this.parser = parser;
        }
    }
}
