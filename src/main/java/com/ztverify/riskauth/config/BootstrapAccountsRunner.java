package com.ztverify.riskauth.config;

import com.ztverify.riskauth.infrastructure.jpa.SpringUserAccountRepository;
import com.ztverify.riskauth.infrastructure.jpa.UserAccountEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.Set;

@Configuration
public class BootstrapAccountsRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAccountsRunner.class);

    @Bean
    ApplicationRunner seedFirstAdmin(
            SpringUserAccountRepository accounts,
            PasswordEncoder encoder,
            @Value("${bootstrap.admin.username:}") String adminUsername,
            @Value("${bootstrap.admin.password:}") String adminPassword,
            @Value("${bootstrap.admin.email:}") String adminEmail
    ) {
        return args -> {
            if (adminUsername.isBlank() || adminPassword.isBlank()) {
                log.warn("Bootstrap admin not created - set bootstrap.admin.username and bootstrap.admin.password");
                return;
            }
            if (accounts.existsByUsername(adminUsername)) {
                log.info("Bootstrap admin exists: {}", adminUsername);
                return;
            }

            UserAccountEntity account = new UserAccountEntity();
            account.setUsername(adminUsername);
            account.setEmail(adminEmail.isBlank() ? null : adminEmail);
            account.setPasswordHash(encoder.encode(adminPassword));
            account.setStatus("ACTIVE");
            account.setRoles(Set.of("ADMIN", "USER"));
            accounts.save(account);

            log.info("Bootstrap admin created: {}", adminUsername);
        };
    }
}
