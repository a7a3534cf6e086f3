package com.ztverify.riskauth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured {@code app.*} settings. Scalar knobs (OTP length, timeouts) are read with
 * {@code @Value} where they are used. Unset risk lists fall back to {@code RiskPolicy} defaults.
 */
@Configuration
@ConfigurationProperties(prefix="app")
public class AppProperties {
    private Risk risk = new Risk();
    public Risk getRisk(){ return risk; }

    public static class Risk {
        private List<String> trustedRegionCountries;
        private List<Integer> knownIspAsns;
        private List<String> regionalSafeCountries;
        private List<String> partnerCountries;
        private List<String> highRiskCountries;
        private List<Integer> maliciousAsns;
        private List<Integer> cloudAsns;
        private List<String> cloudCidrs;
        private List<String> botUserAgentMarkers;
        private String businessHoursUtc;
        private String suspiciousHoursUtc;
        private Map<String, String> partnerBusinessHoursUtc;
        private List<String> jurisdictionStepUpCountries;
        private Integer jurisdictionFloor;
        private Double modelThreshold;
        private Integer modelBonus;
        private List<OverrideEntry> accountOverrides = new ArrayList<>();
        private Model model = new Model();

        public List<String> getTrustedRegionCountries(){ return trustedRegionCountries; }
        public void setTrustedRegionCountries(List<String> v){ this.trustedRegionCountries = v; }
        public List<Integer> getKnownIspAsns(){ return knownIspAsns; }
        public void setKnownIspAsns(List<Integer> v){ this.knownIspAsns = v; }
        public List<String> getRegionalSafeCountries(){ return regionalSafeCountries; }
        public void setRegionalSafeCountries(List<String> v){ this.regionalSafeCountries = v; }
        public List<String> getPartnerCountries(){ return partnerCountries; }
        public void setPartnerCountries(List<String> v){ this.partnerCountries = v; }
        public List<String> getHighRiskCountries(){ return highRiskCountries; }
        public void setHighRiskCountries(List<String> v){ this.highRiskCountries = v; }
        public List<Integer> getMaliciousAsns(){ return maliciousAsns; }
        public void setMaliciousAsns(List<Integer> v){ this.maliciousAsns = v; }
        public List<Integer> getCloudAsns(){ return cloudAsns; }
        public void setCloudAsns(List<Integer> v){ this.cloudAsns = v; }
        public List<String> getCloudCidrs(){ return cloudCidrs; }
        public void setCloudCidrs(List<String> v){ this.cloudCidrs = v; }
        public List<String> getBotUserAgentMarkers(){ return botUserAgentMarkers; }
        public void setBotUserAgentMarkers(List<String> v){ this.botUserAgentMarkers = v; }
        public String getBusinessHoursUtc(){ return businessHoursUtc; }
        public void setBusinessHoursUtc(String v){ this.businessHoursUtc = v; }
        public String getSuspiciousHoursUtc(){ return suspiciousHoursUtc; }
        public void setSuspiciousHoursUtc(String v){ this.suspiciousHoursUtc = v; }
        public Map<String, String> getPartnerBusinessHoursUtc(){ return partnerBusinessHoursUtc; }
        public void setPartnerBusinessHoursUtc(Map<String, String> v){ this.partnerBusinessHoursUtc = v == null ? null : new LinkedHashMap<>(v); }
        public List<String> getJurisdictionStepUpCountries(){ return jurisdictionStepUpCountries; }
        public void setJurisdictionStepUpCountries(List<String> v){ this.jurisdictionStepUpCountries = v; }
        public Integer getJurisdictionFloor(){ return jurisdictionFloor; }
        public void setJurisdictionFloor(Integer v){ this.jurisdictionFloor = v; }
        public Double getModelThreshold(){ return modelThreshold; }
        public void setModelThreshold(Double v){ this.modelThreshold = v; }
        public Integer getModelBonus(){ return modelBonus; }
        public void setModelBonus(Integer v){ this.modelBonus = v; }
        public List<OverrideEntry> getAccountOverrides(){ return accountOverrides; }
        public void setAccountOverrides(List<OverrideEntry> v){ this.accountOverrides = v; }
        public Model getModel(){ return model; }
    }

    public static class OverrideEntry {
        private String username;
        private int score;
        private int priority = 100;
        private String description;
        public String getUsername(){ return username; }
        public void setUsername(String username){ this.username = username; }
        public int getScore(){ return score; }
        public void setScore(int score){ this.score = score; }
        public int getPriority(){ return priority; }
        public void setPriority(int priority){ this.priority = priority; }
        public String getDescription(){ return description; }
        public void setDescription(String description){ this.description = description; }
    }

    public static class Model {
        private String path = "";
        public String getPath(){ return path; }
        public void setPath(String path){ this.path = path; }
    }
}
