package com.example.reviewbot.quota;

public enum DenialReason {
    DAILY,
    LIFETIME
}
