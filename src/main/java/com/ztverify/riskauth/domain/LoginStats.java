package com.ztverify.riskauth.domain;

import java.time.OffsetDateTime;
import java.util.Map;

public record LoginStats(OffsetDateTime since, long total, long succeeded, Map<Decision, Long> byDecision) {

    public long count(Decision decision) {
        return byDecision.getOrDefault(decision, 0L);
    }
}
