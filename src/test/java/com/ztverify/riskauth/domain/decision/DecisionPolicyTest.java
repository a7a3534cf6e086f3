package com.ztverify.riskauth.domain.decision;

import com.ztverify.riskauth.domain.AccountStatus;
import com.ztverify.riskauth.domain.Decision;
import com.ztverify.riskauth.domain.risk.RiskAssessment;
import com.ztverify.riskauth.domain.risk.ScoreSource;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionPolicyTest {

    private final DecisionPolicy policy = new DecisionPolicy();

    private static RiskAssessment score(int score, boolean jurisdiction) {
        return new RiskAssessment(score, List.of(), ScoreSource.RULES, null, jurisdiction);
    }

    @Test
    void shouldDenyOnCredentialProblemsInOrder() {
        assertThat(policy.checkCredentials(null, false).reason()).isEqualTo("ACCOUNT_NOT_FOUND");
        assertThat(policy.checkCredentials(AccountStatus.LOCKED, false).reason()).isEqualTo("WRONG_SECRET");
        assertThat(policy.checkCredentials(AccountStatus.LOCKED, true).reason()).isEqualTo("ACCOUNT_LOCKED");
        assertThat(policy.checkCredentials(AccountStatus.SUSPENDED, true).state()).isEqualTo(AuthState.DENIED);
        assertThat(policy.checkCredentials(AccountStatus.ACTIVE, true)).isNull();
    }

    @Test
    void shouldChallengeJurisdictionRegardlessOfScoreOrDevice() {
        DecisionPolicy.Outcome outcome = policy.decide(score(5, true), true);

        assertThat(outcome.state()).isEqualTo(AuthState.CHALLENGED);
        assertThat(outcome.reason()).isEqualTo(DecisionPolicy.REASON_JURISDICTION);
    }

    @Test
    void shouldChallengeHighRiskEvenFromKnownDevice() {
        assertThat(policy.decide(score(70, false), true).state()).isEqualTo(AuthState.CHALLENGED);
        assertThat(policy.decide(score(100, false), true).reason()).isEqualTo(DecisionPolicy.REASON_HIGH_RISK);
    }

    @Test
    void shouldDependOnDeviceForMediumRisk() {
        assertThat(policy.decide(score(30, false), true).state()).isEqualTo(AuthState.ALLOWED);
        assertThat(policy.decide(score(69, false), false).state()).isEqualTo(AuthState.CHALLENGED);
        assertThat(policy.decide(score(45, false), false).reason()).isEqualTo(DecisionPolicy.REASON_UNKNOWN_DEVICE);
    }

    @Test
    void shouldAllowLowRiskFromUnknownDevice() {
        DecisionPolicy.Outcome outcome = policy.decide(score(29, false), false);

        assertThat(outcome.state()).isEqualTo(AuthState.ALLOWED);
        assertThat(outcome.reason()).isEqualTo(DecisionPolicy.REASON_LOW_RISK);
    }

    @Test
    void shouldOnlyAllowForwardTransitions() {
        assertThat(AuthState.UNVERIFIED.canTransitionTo(AuthState.CHALLENGED)).isTrue();
        assertThat(AuthState.CHALLENGED.canTransitionTo(AuthState.ALLOWED)).isTrue();
        assertThat(AuthState.CHALLENGED.canTransitionTo(AuthState.CHALLENGED)).isFalse();
        assertThat(AuthState.ALLOWED.successors()).isEmpty();
        assertThat(AuthState.DENIED.canTransitionTo(AuthState.ALLOWED)).isFalse();
    }

    @Test
    void shouldMapStatesToWireDecisions() {
        assertThat(AuthState.CHALLENGED.toDecision().wireValue()).isEqualTo("challenge");
        assertThat(Decision.fromWireValue("allow")).isEqualTo(Decision.ALLOW);
        assertThatThrownBy(AuthState.UNVERIFIED::toDecision).isInstanceOf(IllegalStateException.class);
    }
}
