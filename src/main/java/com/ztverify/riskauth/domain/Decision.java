package com.ztverify.riskauth.domain;

/**
 * Outcome recorded for a login attempt. {@code REVIEW} is reserved for manual review queues
 * and is never produced by the automatic decision path.
 */
public enum Decision {
    ALLOW,
    DENY,
    CHALLENGE,
    REVIEW;

    public String wireValue() {
        return name().toLowerCase();
    }

    public static Decision fromWireValue(String value) {
        return Decision.valueOf(value.trim().toUpperCase());
    }
}
