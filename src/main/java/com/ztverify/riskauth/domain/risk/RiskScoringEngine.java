package com.ztverify.riskauth.domain.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Combines the rule score with the optional anomaly model, per-account overrides and the
 * jurisdiction floor. The rule score is authoritative: the model may only raise it.
 */
public class RiskScoringEngine {

    private static final Logger log = LoggerFactory.getLogger(RiskScoringEngine.class);

    private final RiskPolicy policy;
    private final RuleEngine rules;
    private final AnomalyModel model;

    public RiskScoringEngine(RiskPolicy policy, RuleEngine rules, AnomalyModel model) {
        this.policy = policy;
        this.rules = rules;
        this.model = model;
    }

    public RiskAssessment assess(String username, RiskFeatures features) {
        // Decided first so that nothing below can lift it.
        boolean stepUp = policy.requiresJurisdictionStepUp(features.countryCode());

        List<String> factors = new ArrayList<>();
        int score;
        Optional<AccountOverride> override = policy.overrideFor(username);
        if (override.isPresent()) {
            score = override.get().score();
            factors.add(override.get().description());
            log.info("Account override applied for {}: score {}", username, score);
        } else {
            RuleEngine.Result result = rules.evaluate(features);
            score = result.getScore();
            factors.addAll(result.getFactors());
        }

        ScoreSource source = ScoreSource.RULES;
        Double probability = null;
        OptionalDouble prediction = predict(features);
        if (prediction.isPresent()) {
            probability = prediction.getAsDouble();
            if (probability > policy.getModelThreshold()) {
                score = RiskScores.clamp(score + policy.getModelBonus());
                factors.add(String.format("Anomalous behaviour pattern (model probability %.2f)", probability));
                source = ScoreSource.HYBRID;
            }
        }

        if (stepUp) {
            score = Math.max(score, policy.getJurisdictionFloor());
            factors.add("Jurisdiction requires two-factor verification (" + features.countryCode() + ")");
        }

        RiskAssessment assessment = new RiskAssessment(score, factors, source, probability, stepUp);
        log.info("Risk assessment for {}: score={}, level={}, source={}, stepUp={}",
                username, assessment.getScore(), assessment.getLevel(), source, stepUp);
        return assessment;
    }

    private OptionalDouble predict(RiskFeatures features) {
        if (!model.isAvailable()) {
            return OptionalDouble.empty();
        }
        try {
            OptionalDouble p = model.predictProbability(features);
            if (p.isPresent() && (Double.isNaN(p.getAsDouble()) || p.getAsDouble() < 0.0 || p.getAsDouble() > 1.0)) {
                log.warn("Anomaly model returned out-of-range probability {}; ignoring", p.getAsDouble());
                return OptionalDouble.empty();
            }
            return p;
        } catch (RuntimeException e) {
            log.warn("Anomaly model prediction failed, falling back to rules: {}", e.getMessage(), e);
            return OptionalDouble.empty();
        }
    }
}
