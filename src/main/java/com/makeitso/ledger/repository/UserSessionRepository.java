package com.makeitso.ledger.repository;

import com.makeitso.ledger.domain.UserSession;
import com.makeitso.ledger.session.SessionEndReason;
import com.makeitso.ledger.session.SessionState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface UserSessionRepository extends JpaRepository<UserSession, Long> {

    Optional<UserSession> findBySessionId(String sessionId);

    List<UserSession> findByUserIdAndStatus(Long userId, SessionState status);

    /** Advances the stored activity timestamp; a stale value never overwrites a newer one. */
    @Transactional
    @Modifying
    @Query("update UserSession s set s.lastActivityTime = :ts "
            + "where s.sessionId = :sessionId and s.lastActivityTime < :ts")
    int advanceLastActivity(@Param("sessionId") String sessionId, @Param("ts") Instant ts);

    @Transactional
    @Modifying
    @Query("update UserSession s set s.mfaVerified = :verified, s.mfaFailures = :failures "
            + "where s.sessionId = :sessionId")
    int updateMfaState(@Param("sessionId") String sessionId,
                       @Param("verified") boolean verified,
                       @Param("failures") int failures);

    /** Moves a live row to a final state. Rows already ended are left alone. */
    @Transactional
    @Modifying
    @Query("update UserSession s set s.status = :status, s.endReason = :reason, s.endedAt = :endedAt "
            + "where s.sessionId = :sessionId and s.status = com.makeitso.ledger.session.SessionState.ACTIVE")
    int markEnded(@Param("sessionId") String sessionId,
                  @Param("status") SessionState status,
                  @Param("reason") SessionEndReason reason,
                  @Param("endedAt") Instant endedAt);
}
