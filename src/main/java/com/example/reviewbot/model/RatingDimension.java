package com.example.reviewbot.model;

import java.util.Arrays;
import java.util.Optional;

public enum RatingDimension {
    OVERALL("overall", "Overall"),
    QUALITY("quality", "Teaching quality"),
    DIFFICULTY("difficulty", "Difficulty");

    private final String token;
    private final String label;

    RatingDimension(String token, String label) {
        this.token = token;
        this.label = label;
    }

    public String token() { return token; }
    public String label() { return label; }

    public static Optional<RatingDimension> fromToken(String token) {
        return Arrays.stream(values()).filter(d -> d.token.equals(token)).findFirst();
    }
}
