package com.ztverify.riskauth.infrastructure.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

public interface SpringOtpChallengeRepository extends JpaRepository<OtpChallengeEntity, UUID> {

    Optional<OtpChallengeEntity> findFirstByUsernameOrderByCreatedAtDesc(String username);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE OtpChallengeEntity c SET c.attempts = c.attempts + 1 " +
           "WHERE c.id = :id AND c.attempts < :maxAttempts AND c.verified = false AND c.invalidated = false")
    int incrementAttempts(@Param("id") UUID id, @Param("maxAttempts") int maxAttempts);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE OtpChallengeEntity c SET c.verified = true " +
           "WHERE c.id = :id AND c.verified = false AND c.invalidated = false " +
           "AND c.attempts < :maxAttempts AND c.expiresAt >= :now")
    int markVerified(@Param("id") UUID id, @Param("maxAttempts") int maxAttempts, @Param("now") OffsetDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE OtpChallengeEntity c SET c.invalidated = true " +
           "WHERE c.username = :username AND c.verified = false AND c.invalidated = false")
    int invalidateOpen(@Param("username") String username);
}
