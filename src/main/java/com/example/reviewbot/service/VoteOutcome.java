package com.example.reviewbot.service;

public enum VoteOutcome {
    CREATED,
    REPLACED,
    REMOVED
}
