package com.ztverify.riskauth.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ztverify.riskauth.domain.decision.DecisionPolicy;
import com.ztverify.riskauth.domain.otp.OtpCodeGenerator;
import com.ztverify.riskauth.domain.ports.DeviceTrustStore;
import com.ztverify.riskauth.domain.ports.LoginAttemptRepository;
import com.ztverify.riskauth.domain.risk.AccountOverride;
import com.ztverify.riskauth.domain.risk.AnomalyModel;
import com.ztverify.riskauth.domain.risk.HourWindow;
import com.ztverify.riskauth.domain.risk.RiskFeatureExtractor;
import com.ztverify.riskauth.domain.risk.RiskPolicy;
import com.ztverify.riskauth.domain.risk.RiskScoringEngine;
import com.ztverify.riskauth.domain.risk.RuleEngine;
import com.ztverify.riskauth.infrastructure.model.LogisticAnomalyModel;
import com.ztverify.riskauth.infrastructure.model.UnavailableAnomalyModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Wires the plain-Java scoring and decision classes from {@link AppProperties}.
 */
@Configuration
public class RiskEngineConfig {

    private static final Logger log = LoggerFactory.getLogger(RiskEngineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public OtpCodeGenerator otpCodeGenerator() {
        return new OtpCodeGenerator(new SecureRandom());
    }

    @Bean
    public RiskPolicy riskPolicy(AppProperties props) {
        AppProperties.Risk r = props.getRisk();
        RiskPolicy.Builder b = RiskPolicy.builder();
        if (r.getTrustedRegionCountries() != null) b.trustedRegionCountries(r.getTrustedRegionCountries());
        if (r.getKnownIspAsns() != null) b.knownIspAsns(r.getKnownIspAsns());
        if (r.getRegionalSafeCountries() != null) b.regionalSafeCountries(r.getRegionalSafeCountries());
        if (r.getPartnerCountries() != null) b.partnerCountries(r.getPartnerCountries());
        if (r.getHighRiskCountries() != null) b.highRiskCountries(r.getHighRiskCountries());
        if (r.getMaliciousAsns() != null) b.maliciousAsns(r.getMaliciousAsns());
        if (r.getCloudAsns() != null) b.cloudAsns(r.getCloudAsns());
        if (r.getCloudCidrs() != null) b.cloudCidrs(r.getCloudCidrs());
        if (r.getBotUserAgentMarkers() != null) b.botUserAgentMarkers(r.getBotUserAgentMarkers());
        if (r.getBusinessHoursUtc() != null) b.businessHours(HourWindow.parse(r.getBusinessHoursUtc()));
        if (r.getSuspiciousHoursUtc() != null) b.suspiciousHours(HourWindow.parse(r.getSuspiciousHoursUtc()));
        if (r.getPartnerBusinessHoursUtc() != null) {
            Map<String, HourWindow> windows = new LinkedHashMap<>();
            r.getPartnerBusinessHoursUtc().forEach((country, window) -> windows.put(country, HourWindow.parse(window)));
            b.partnerBusinessHours(windows);
        }
        if (r.getJurisdictionStepUpCountries() != null) b.jurisdictionStepUpCountries(r.getJurisdictionStepUpCountries());
        if (r.getJurisdictionFloor() != null) b.jurisdictionFloor(r.getJurisdictionFloor());
        if (r.getModelThreshold() != null) b.modelThreshold(r.getModelThreshold());
        if (r.getModelBonus() != null) b.modelBonus(r.getModelBonus());
        b.accountOverrides(r.getAccountOverrides().stream()
                .map(o -> new AccountOverride(o.getUsername(), o.getScore(), o.getPriority(), o.getDescription()))
                .collect(Collectors.toList()));

        RiskPolicy policy = b.build();
        log.info("Risk policy loaded - jurisdiction floor: {}, model threshold: {}, account overrides: {}",
                policy.getJurisdictionFloor(), policy.getModelThreshold(), policy.getAccountOverrides().size());
        return policy;
    }

    @Bean
    public AnomalyModel anomalyModel(AppProperties props, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        String path = props.getRisk().getModel().getPath();
        if (path == null || path.isBlank()) {
            log.info("No anomaly model configured, scoring with rules only");
            return new UnavailableAnomalyModel();
        }
        Resource resource = resourceLoader.getResource(path);
        try (InputStream in = resource.getInputStream()) {
            return LogisticAnomalyModel.load(in, objectMapper);
        } catch (IOException | RuntimeException e) {
            log.warn("Anomaly model at {} could not be loaded, scoring with rules only: {}", path, e.getMessage());
            return new UnavailableAnomalyModel();
        }
    }

    @Bean
    public RuleEngine ruleEngine(RiskPolicy policy) {
        return new RuleEngine(policy);
    }

    @Bean
    public RiskScoringEngine riskScoringEngine(RiskPolicy policy, RuleEngine ruleEngine, AnomalyModel anomalyModel) {
        return new RiskScoringEngine(policy, ruleEngine, anomalyModel);
    }

    @Bean
    public RiskFeatureExtractor riskFeatureExtractor(LoginAttemptRepository history, DeviceTrustStore devices) {
        return new RiskFeatureExtractor(history, devices);
    }

    @Bean
    public DecisionPolicy decisionPolicy() {
        return new DecisionPolicy();
    }
}
