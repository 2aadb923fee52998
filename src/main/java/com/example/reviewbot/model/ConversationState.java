package com.example.reviewbot.model;

public enum ConversationState {
    ROOT,
    BROWSING,
    VIEWING_RECORD,
    DRAFTING,
    COLLECTING_PROFILE_NAME,
    COLLECTING_PROFILE_TAG,
    VIEWING_OWN_RECORDS,
    EDITING_RECORD,
    EDITING_RECORD_TEXT
}
