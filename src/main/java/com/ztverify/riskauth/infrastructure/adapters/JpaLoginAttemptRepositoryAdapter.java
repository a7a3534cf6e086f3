package com.ztverify.riskauth.infrastructure.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ztverify.riskauth.domain.Decision;
import com.ztverify.riskauth.domain.LoginAttempt;
import com.ztverify.riskauth.domain.LoginStats;
import com.ztverify.riskauth.domain.ports.LoginAttemptRepository;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import com.ztverify.riskauth.infrastructure.jpa.LoginAttemptEntity;
import com.ztverify.riskauth.infrastructure.jpa.SpringLoginAttemptRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.OffsetDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class JpaLoginAttemptRepositoryAdapter implements LoginAttemptRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaLoginAttemptRepositoryAdapter.class);
    private static final TypeReference<List<String>> FACTOR_LIST = new TypeReference<>() {};

    private final SpringLoginAttemptRepository attempts;
    private final ObjectMapper objectMapper;

    public JpaLoginAttemptRepositoryAdapter(SpringLoginAttemptRepository attempts, ObjectMapper objectMapper) {
        this.attempts = attempts;
        this.objectMapper = objectMapper;
    }

    @Override
    public LoginAttempt append(LoginAttempt a) {
        LoginAttemptEntity e = new LoginAttemptEntity();
        e.setId(a.getId());
        e.setUsername(a.getUsername());
        e.setAttemptedAt(a.getTimestamp());
        e.setSourceIp(a.getSourceIp());
        e.setDeviceFingerprint(a.getDeviceFingerprint());
        e.setLocation(a.getLocation());
        e.setRiskScore(a.getRiskScore());
        e.setDecision(a.getDecision().wireValue());
        e.setSucceeded(a.isSucceeded());
        e.setReason(a.getReason());
        e.setRiskFactors(a.getRiskFactors().isEmpty() ? null : writeFactors(a.getRiskFactors()));
        try {
            attempts.save(e);
            return a;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to append login attempt for " + a.getUsername(), ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoginAttempt> findRecentByUsername(String username, int limit) {
        try {
            return attempts.findByUsernameOrderByAttemptedAtDesc(username, PageRequest.of(0, limit))
                    .stream().map(this::toDomain).collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to read login history for " + username, ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<LoginAttempt> findRecent(int limit) {
        try {
            return attempts.findAllByOrderByAttemptedAtDesc(PageRequest.of(0, limit))
                    .stream().map(this::toDomain).collect(Collectors.toList());
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to read login attempts", ex);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public LoginStats statsSince(OffsetDateTime since) {
        try {
            Map<Decision, Long> byDecision = new EnumMap<>(Decision.class);
            long total = 0;
            for (Object[] row : attempts.countByDecisionSince(since)) {
                long count = ((Number) row[1]).longValue();
                byDecision.put(Decision.fromWireValue((String) row[0]), count);
                total += count;
            }
            return new LoginStats(since, total, attempts.countSucceededSince(since), byDecision);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to compute login statistics", ex);
        }
    }

    private LoginAttempt toDomain(LoginAttemptEntity e) {
        return new LoginAttempt(e.getId(), e.getUsername(), e.getAttemptedAt(), e.getSourceIp(),
                e.getDeviceFingerprint(), e.getLocation(), e.getRiskScore(),
                Decision.fromWireValue(e.getDecision()), e.isSucceeded(), e.getReason(),
                readFactors(e.getRiskFactors()));
    }

    private String writeFactors(List<String> factors) {
        try {
            return objectMapper.writeValueAsString(factors);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Risk factors are not serializable", ex);
        }
    }

    private List<String> readFactors(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, FACTOR_LIST);
        } catch (JsonProcessingException ex) {
            log.warn("Unreadable risk factors on audit record, ignoring: {}", ex.getOriginalMessage());
            return List.of();
        }
    }
}
