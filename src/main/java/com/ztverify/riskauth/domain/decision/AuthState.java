package com.ztverify.riskauth.domain.decision;

import com.ztverify.riskauth.domain.Decision;

import java.util.EnumSet;
import java.util.Set;

public enum AuthState {
    UNVERIFIED,
    ALLOWED,
    DENIED,
    CHALLENGED;

    public boolean canTransitionTo(AuthState next) {
        return successors().contains(next);
    }

    public Set<AuthState> successors() {
        return switch (this) {
            case UNVERIFIED -> EnumSet.of(ALLOWED, DENIED, CHALLENGED);
            case CHALLENGED -> EnumSet.of(ALLOWED, DENIED);
            case ALLOWED, DENIED -> EnumSet.noneOf(AuthState.class);
        };
    }

    public Decision toDecision() {
        return switch (this) {
            case ALLOWED -> Decision.ALLOW;
            case CHALLENGED -> Decision.CHALLENGE;
            case DENIED -> Decision.DENY;
            case UNVERIFIED -> throw new IllegalStateException("No decision for state " + this);
        };
    }
}
