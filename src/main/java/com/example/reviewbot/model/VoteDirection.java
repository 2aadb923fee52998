package com.example.reviewbot.model;

import java.util.Optional;

public enum VoteDirection {
    UP,
    DOWN;

    public String token() {
        return name().toLowerCase();
    }

    public static Optional<VoteDirection> fromToken(String token) {
        if ("up".equals(token)) return Optional.of(UP);
        if ("down".equals(token)) return Optional.of(DOWN);
        return Optional.empty();
    }
}
