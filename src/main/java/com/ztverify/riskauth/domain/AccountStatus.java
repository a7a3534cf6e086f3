package com.ztverify.riskauth.domain;

public enum AccountStatus {
    ACTIVE,
    INACTIVE,
    LOCKED,
    SUSPENDED;

    public boolean isActive() {
        return this == ACTIVE;
    }
}
