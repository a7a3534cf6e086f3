package com.ztverify.riskauth.domain.risk;

/**
 * Scores are integers in [0, 100] inside the engine; callers outside it (audit, HTTP) see 0.0-1.0.
 */
public final class RiskScores {

    public static final int MIN = 0;
    public static final int MAX = 100;

    private RiskScores() {
    }

    public static int clamp(int score) {
        return Math.max(MIN, Math.min(MAX, score));
    }

    public static double toExternal(int score) {
        return clamp(score) / 100.0;
    }
}
