package com.ztverify.riskauth.domain.risk;

import com.ztverify.riskauth.domain.decision.AuthState;
import com.ztverify.riskauth.domain.decision.DecisionPolicy;
import com.ztverify.riskauth.infrastructure.model.UnavailableAnomalyModel;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuleEngineTest {

    private static final String BROWSER = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) Chrome/124.0";

    private final RuleEngine engine = new RuleEngine(RiskPolicy.defaults());

    private static RiskFeatures login(String country, int asn, String ip, String userAgent, int hour) {
        return new RiskFeatures(hour, 2, 0.0, false, 24.0, false, country, "desktop", asn, ip, userAgent);
    }

    @Test
    void shouldScoreTrustedRegionWithKnownIspLowest() {
        RuleEngine.Result r = engine.evaluate(login("AE", 5384, "94.200.10.1", BROWSER, 18));

        assertThat(r.getScore()).isEqualTo(5);
        assertThat(r.getLevel()).isEqualTo(RiskLevel.LOW);
        assertThat(r.getFactors()).hasSize(1);
    }

    @Test
    void shouldGiveBusinessHoursBonusToTrustedRegionWithoutKnownIsp() {
        assertThat(engine.evaluate(login("SA", 0, "94.200.10.1", BROWSER, 10)).getScore()).isEqualTo(5);
        assertThat(engine.evaluate(login("SA", 0, "94.200.10.1", BROWSER, 18)).getScore()).isEqualTo(10);
    }

    @Test
    void shouldPenaliseSuspiciousHoursOnlyInTrustedRegion() {
        assertThat(engine.evaluate(login("QA", 0, "94.200.10.1", BROWSER, 23)).getScore()).isEqualTo(25);
        assertThat(engine.evaluate(login("QA", 0, "94.200.10.1", BROWSER, 2)).getScore()).isEqualTo(25);
        assertThat(engine.evaluate(login("QA", 0, "94.200.10.1", BROWSER, 3)).getScore()).isEqualTo(10);
        assertThat(engine.evaluate(login("JO", 0, "94.200.10.1", BROWSER, 23)).getScore()).isEqualTo(35);
    }

    @Test
    void shouldShortCircuitBotInTrustedRegion() {
        RuleEngine.Result withIsp = engine.evaluate(login("AE", 5384, "10.0.0.4", "python-requests/2.31", 23));
        RuleEngine.Result withoutIsp = engine.evaluate(login("AE", 0, "10.0.0.4", "curl/8.4.0", 23));

        assertThat(withIsp.getScore()).isEqualTo(75);
        assertThat(withIsp.getFactors()).hasSize(1);
        assertThat(withoutIsp.getScore()).isEqualTo(70);
        assertThat(withoutIsp.getLevel()).isEqualTo(RiskLevel.HIGH);
    }

    @Test
    void shouldKeepBotAtHighRiskInPartnerBusinessHours() {
        RiskPolicy policy = RiskPolicy.builder()
                .partnerBusinessHours(Map.of("US", new HourWindow(13, 22)))
                .jurisdictionStepUpCountries(List.of())
                .build();
        RiskFeatures bot = login("US", 0, "98.10.1.1", "python-requests/2.31", 15);

        RuleEngine.Result r = new RuleEngine(policy).evaluate(bot);

        assertThat(r.getScore()).isEqualTo(70);
        assertThat(r.getLevel()).isEqualTo(RiskLevel.HIGH);
        assertThat(r.getFactors()).contains("Automated client floor");

        RiskAssessment assessment = new RiskScoringEngine(policy, new RuleEngine(policy), new UnavailableAnomalyModel())
                .assess("carol", bot);
        assertThat(new DecisionPolicy().decide(assessment, true).state()).isEqualTo(AuthState.CHALLENGED);
    }

    @Test
    void shouldNotAddBotFloorWhenPenaltiesAlreadyExceedIt() {
        RuleEngine.Result r = engine.evaluate(login("DE", 0, "85.1.1.1", "Wget/1.21", 12));

        assertThat(r.getScore()).isEqualTo(75);
        assertThat(r.getFactors()).doesNotContain("Automated client floor");
    }

    @Test
    void shouldScoreHighRiskCountryAndClampAtHundred() {
        assertThat(engine.evaluate(login("RU", 0, "95.1.2.3", BROWSER, 12)).getScore()).isEqualTo(80);

        RuleEngine.Result worst = engine.evaluate(login("RU", 3280, "10.1.1.1", "HeadlessChrome", 12));
        assertThat(worst.getScore()).isEqualTo(100);
        assertThat(worst.getFactors()).hasSize(4);
    }

    @Test
    void shouldPreferHighRiskOverPartnerClassification() {
        RiskPolicy overlapping = RiskPolicy.builder()
                .partnerCountries(List.of("BR"))
                .build();

        assertThat(new RuleEngine(overlapping).evaluate(login("BR", 0, "177.1.2.3", BROWSER, 12)).getScore())
                .isEqualTo(80);
    }

    @Test
    void shouldScoreRegionalNeighbour() {
        assertThat(engine.evaluate(login("EG", 0, "41.33.1.1", BROWSER, 12)).getScore()).isEqualTo(35);
    }

    @Test
    void shouldAddCloudPenaltyForPartnerByAsnOrCidr() {
        assertThat(engine.evaluate(login("US", 0, "98.10.1.1", BROWSER, 12)).getScore()).isEqualTo(40);
        assertThat(engine.evaluate(login("US", 16509, "98.10.1.1", BROWSER, 12)).getScore()).isEqualTo(50);
        assertThat(engine.evaluate(login("GB", 0, "52.14.3.9", BROWSER, 12)).getScore()).isEqualTo(50);
    }

    @Test
    void shouldApplyPartnerLocalBusinessHours() {
        assertThat(engine.evaluate(login("IN", 0, "49.36.1.1", BROWSER, 6)).getScore()).isEqualTo(30);
        assertThat(engine.evaluate(login("IN", 0, "49.36.1.1", BROWSER, 14)).getScore()).isEqualTo(40);
        // No window configured for US.
        assertThat(engine.evaluate(login("US", 0, "98.10.1.1", BROWSER, 6)).getScore()).isEqualTo(40);
    }

    @Test
    void shouldTreatUnknownCountryAsUnrecognized() {
        assertThat(engine.evaluate(login("XX", 0, "", "", 12)).getScore()).isEqualTo(45);
        assertThat(engine.evaluate(login("KE", 0, "41.90.1.1", BROWSER, 12)).getScore()).isEqualTo(45);
    }

    @Test
    void shouldAddNetworkAndAutomationPenaltiesOutsideTrustedRegion() {
        assertThat(engine.evaluate(login("US", 0, "192.168.1.20", BROWSER, 12)).getScore()).isEqualTo(65);
        assertThat(engine.evaluate(login("DE", 62350, "85.1.1.1", BROWSER, 12)).getScore()).isEqualTo(70);
        assertThat(engine.evaluate(login("DE", 0, "85.1.1.1", "Wget/1.21", 12)).getScore()).isEqualTo(75);
    }

    @Test
    void shouldPenaliseNonRoutableAddressInTrustedRegion() {
        RuleEngine.Result r = engine.evaluate(login("AE", 5384, "127.0.0.1", BROWSER, 12));

        assertThat(r.getScore()).isEqualTo(30);
        assertThat(r.getLevel()).isEqualTo(RiskLevel.MEDIUM);
    }

    @Test
    void shouldStayWithinBoundsForEveryHour() {
        for (int hour = 0; hour < 24; hour++) {
            for (String country : new String[] {"AE", "JO", "US", "IN", "RU", "XX"}) {
                int score = engine.evaluate(login(country, 3280, "10.0.0.1", "bot", hour)).getScore();
                assertThat(score).isBetween(0, 100);
            }
        }
    }
}
