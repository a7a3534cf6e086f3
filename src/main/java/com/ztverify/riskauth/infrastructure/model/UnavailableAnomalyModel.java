package com.ztverify.riskauth.infrastructure.model;

import com.ztverify.riskauth.domain.risk.AnomalyModel;
import com.ztverify.riskauth.domain.risk.RiskFeatures;

import java.util.OptionalDouble;

/** Used when no model is configured or the configured one failed to load. */
public class UnavailableAnomalyModel implements AnomalyModel {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public OptionalDouble predictProbability(RiskFeatures features) {
        return OptionalDouble.empty();
    }
}
