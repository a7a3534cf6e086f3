package com.ztverify.riskauth.infrastructure.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public interface SpringLoginAttemptRepository extends JpaRepository<LoginAttemptEntity, UUID> {

    List<LoginAttemptEntity> findByUsernameOrderByAttemptedAtDesc(String username, Pageable page);

    List<LoginAttemptEntity> findAllByOrderByAttemptedAtDesc(Pageable page);

    @Query("SELECT a.decision, COUNT(a) FROM LoginAttemptEntity a WHERE a.attemptedAt >= :since GROUP BY a.decision")
    List<Object[]> countByDecisionSince(@Param("since") OffsetDateTime since);

    @Query("SELECT COUNT(a) FROM LoginAttemptEntity a WHERE a.succeeded = true AND a.attemptedAt >= :since")
    long countSucceededSince(@Param("since") OffsetDateTime since);
}
