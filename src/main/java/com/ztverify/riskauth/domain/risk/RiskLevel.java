package com.ztverify.riskauth.domain.risk;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static final int MEDIUM_THRESHOLD = 30;
    public static final int HIGH_THRESHOLD = 70;

    public static RiskLevel fromScore(int score) {
        if (score >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (score >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }
}
