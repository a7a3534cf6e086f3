package com.ztverify.riskauth.infrastructure.adapters;

import com.ztverify.riskauth.domain.AccountStatus;
import com.ztverify.riskauth.domain.ports.CredentialVerifierPort;
import com.ztverify.riskauth.exception.StorageUnavailableException;
import com.ztverify.riskauth.infrastructure.jpa.SpringUserAccountRepository;
import com.ztverify.riskauth.infrastructure.jpa.UserAccountEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.Set;

/**
 * Verifies secrets against BCrypt hashes held in {@code user_accounts}.
 */
@Component
public class JpaCredentialVerifierAdapter implements CredentialVerifierPort {

    private static final Logger log = LoggerFactory.getLogger(JpaCredentialVerifierAdapter.class);

    private final SpringUserAccountRepository accounts;
    private final PasswordEncoder passwordEncoder;

    public JpaCredentialVerifierAdapter(SpringUserAccountRepository accounts, PasswordEncoder passwordEncoder) {
        this.accounts = accounts;
        this.passwordEncoder = passwordEncoder;
    }

    @Override
    public boolean verify(String username, String secret) {
        if (secret == null || secret.isEmpty()) {
            return false;
        }
        return load(username)
                .map(account -> passwordEncoder.matches(secret, account.getPasswordHash()))
                .orElse(false);
    }

    @Override
    public Optional<AccountStatus> getAccountStatus(String username) {
        return load(username).map(account -> {
            try {
                return AccountStatus.valueOf(account.getStatus());
            } catch (IllegalArgumentException e) {
                log.warn("Account {} has unrecognised status '{}', treating as INACTIVE", username, account.getStatus());
                return AccountStatus.INACTIVE;
            }
        });
    }

    @Override
    public Optional<String> findContactEmail(String username) {
        return load(username).map(UserAccountEntity::getEmail).filter(email -> !email.isBlank());
    }

    @Override
    public Set<String> findRoles(String username) {
        return load(username).map(account -> Set.copyOf(account.getRoles())).orElse(Set.of());
    }

    private Optional<UserAccountEntity> load(String username) {
        try {
            return accounts.findByUsername(username);
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Failed to load account " + username, ex);
        }
    }
}
