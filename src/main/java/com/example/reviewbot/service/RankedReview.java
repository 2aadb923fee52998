package com.example.reviewbot.service;

import com.example.reviewbot.model.Review;

public record RankedReview(Review review, int upvotes, int downvotes) {

    public int netVotes() {
        return upvotes - downvotes;
    }
}
