package com.example.reviewbot.model;

/** Sub-step of the DRAFTING state, kept in the session context. */
public enum DraftStep {
    CATEGORY,
    COURSE,
    RATING,
    TEXT,
    ANONYMITY,
    CONFIRM
}
