package com.ztverify.riskauth.domain.risk;

import java.util.List;

/**
 * Result of scoring one login. Level and anomaly flag are always derived from the score.
 */
public class RiskAssessment {

    private final int score;
    private final RiskLevel level;
    private final List<String> factors;
    private final ScoreSource source;
    private final Double modelProbability;
    private final boolean jurisdictionStepUp;

    public RiskAssessment(int score, List<String> factors, ScoreSource source,
                          Double modelProbability, boolean jurisdictionStepUp) {
        this.score = RiskScores.clamp(score);
        this.level = RiskLevel.fromScore(this.score);
        this.factors = List.copyOf(factors);
        this.source = source;
        this.modelProbability = modelProbability;
        this.jurisdictionStepUp = jurisdictionStepUp;
    }

    public int getScore() {
        return score;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public boolean isAnomaly() {
        return level == RiskLevel.HIGH;
    }

    public List<String> getFactors() {
        return factors;
    }

    public ScoreSource getSource() {
        return source;
    }

    public Double getModelProbability() {
        return modelProbability;
    }

    public boolean isJurisdictionStepUp() {
        return jurisdictionStepUp;
    }

    public double externalScore() {
        return RiskScores.toExternal(score);
    }

    @Override
    public String toString() {
        return "RiskAssessment{score=" + score + ", level=" + level + ", source=" + source
                + ", jurisdictionStepUp=" + jurisdictionStepUp + ", factors=" + factors + "}";
    }
}
