package com.makeitso.ledger.domain;

import com.makeitso.ledger.session.SessionEndReason;
import com.makeitso.ledger.session.SessionState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Durable copy of one login.
 *
 * The live copy is held by the SessionLifecycleMonitor; this row is what a
 * restarted node reloads. Design notes:
 *
 *  lastActivityTime: only ever advanced (conditional update), never written
 *                     backwards, even by a late batch flush.
 *  status:           ACTIVE while live; EXPIRED / TERMINATED are final.
 *                     WARNING is an in-memory state and is not persisted.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "user_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uq_user_session_id", columnNames = "session_id"),
    indexes = @Index(name = "idx_user_sessions_user_status", columnList = "user_id, status")
)
public class UserSession extends BaseEntity {

    @Column(name = "session_id", nullable = false, length = 64)
    private String sessionId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "login_time", nullable = false, updatable = false)
    private Instant loginTime;

    @Column(name = "last_activity_time", nullable = false)
    private Instant lastActivityTime;

    @Builder.Default
    @Column(name = "mfa_verified", nullable = false)
    private boolean mfaVerified = false;

    @Builder.Default
    @Column(name = "mfa_failures", nullable = false)
    private int mfaFailures = 0;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SessionState status = SessionState.ACTIVE;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "end_reason", length = 32)
    private SessionEndReason endReason;

    @Column(name = "client_ip", length = 45)
    private String clientIp;

    @Column(name = "user_agent", length = 512)
    private String userAgent;
}
