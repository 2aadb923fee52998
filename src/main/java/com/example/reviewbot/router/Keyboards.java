package com.example.reviewbot.router;

import com.example.reviewbot.model.RatingDimension;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/** Keyboard layouts shared by several handlers. */
public final class Keyboards {

    private Keyboards() {
    }

    public static List<List<Button>> mainMenu() {
        return List.of(
                List.of(new Button("Browse courses", Tokens.BROWSE_CATEGORIES)),
                List.of(new Button("Post a review", Tokens.POST_REVIEW)),
                List.of(new Button("My reviews", Tokens.MY_REVIEWS)),
                List.of(new Button("Help", Tokens.HELP)));
    }

    public static List<Button> backToMenu() {
        return List.of(new Button("Main menu", Tokens.MAIN_MENU));
    }

    public static List<Button> ratingRow(IntFunction<String> tokenForValue) {
        List<Button> row = new ArrayList<>();
        for (int v = 1; v <= 5; v++) {
            row.add(new Button(String.valueOf(v), tokenForValue.apply(v)));
        }
        return row;
    }

    public static List<Button> ratingRow(RatingDimension dimension) {
        return ratingRow(v -> Tokens.rating(dimension, v));
    }

    /** Previous / position / next row; the position button is inert. */
    public static List<Button> pager(int page, int totalPages, IntFunction<String> tokenForPage) {
        List<Button> row = new ArrayList<>();
        if (page > 1) row.add(new Button("<", tokenForPage.apply(page - 1)));
        row.add(new Button(page + "/" + totalPages, Tokens.NOOP));
        if (page < totalPages) row.add(new Button(">", tokenForPage.apply(page + 1)));
        return row;
    }
}
