package com.ztverify.riskauth.domain.risk;

public enum ScoreSource {
    RULES,
    ML,
    HYBRID
}
