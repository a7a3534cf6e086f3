package com.ztverify.riskauth.domain.ports;

import com.ztverify.riskauth.domain.AccountStatus;

import java.util.Optional;
import java.util.Set;

public interface CredentialVerifierPort {

    boolean verify(String username, String secret);

    Optional<AccountStatus> getAccountStatus(String username);

    Optional<String> findContactEmail(String username);

    /** Roles granted to session tokens; empty for unknown accounts. */
    Set<String> findRoles(String username);
}
