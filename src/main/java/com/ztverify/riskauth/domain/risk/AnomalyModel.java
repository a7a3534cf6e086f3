package com.ztverify.riskauth.domain.risk;

import java.util.OptionalDouble;

/**
 * Pretrained classifier estimating the probability that a login is anomalous.
 * An empty result means no opinion; the rule score then stands alone.
 */
public interface AnomalyModel {

    boolean isAvailable();

    OptionalDouble predictProbability(RiskFeatures features);
}
