package com.example.reviewbot.error;

import com.example.reviewbot.quota.QuotaDecision;

public class RateLimitedException extends ReviewBotException {

    private final QuotaDecision decision;

    public RateLimitedException(QuotaDecision decision) {
        super("Quota exceeded: " + decision.reason());
        this.decision = decision;
    }

    public QuotaDecision getDecision() {
        return decision;
    }
}
