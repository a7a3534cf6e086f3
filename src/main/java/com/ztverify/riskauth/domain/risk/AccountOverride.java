package com.ztverify.riskauth.domain.risk;

/**
 * Pins the rule score for one account. Lower priority values are consulted first.
 */
public record AccountOverride(String username, int score, int priority, String description) {

    public AccountOverride {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("override username is required");
        }
        score = RiskScores.clamp(score);
        description = description == null || description.isBlank()
                ? "Account policy override for " + username
                : description;
    }
}
