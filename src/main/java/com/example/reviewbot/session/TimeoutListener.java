package com.example.reviewbot.session;

/**
 * Receives inactivity notices. Each notice is delivered at most once per activity epoch.
 */
public interface TimeoutListener {

    void onWarning(long subjectId, TimeoutInfo info);

    /** Called after the session has been cleared. */
    void onExpired(long subjectId);
}
