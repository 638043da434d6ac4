package com.makeitso.ledger.domain;

import com.makeitso.ledger.audit.RiskLevel;
import com.makeitso.ledger.audit.SecurityEventType;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * One row of the security event log. Inserted once, never updated or deleted
 * by this service; retention is handled outside it.
 */
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Immutable
@Entity
@Table(
    name = "security_events",
    indexes = {
        @Index(name = "idx_security_events_user", columnList = "user_id"),
        @Index(name = "idx_security_events_session", columnList = "session_id"),
        @Index(name = "idx_security_events_time", columnList = "occurred_at")
    }
)
public class SecurityEventEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "event_id", nullable = false, length = 36, unique = true, updatable = false)
    private String eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 32, updatable = false)
    private SecurityEventType type;

    @Column(name = "user_id", updatable = false)
    private Long userId;

    @Column(name = "session_id", length = 64, updatable = false)
    private String sessionId;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    @Column(name = "success", nullable = false, updatable = false)
    private boolean success;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_level", nullable = false, length = 16, updatable = false)
    private RiskLevel riskLevel;

    /** JSON object; null when the event carried no details. */
    @Column(name = "details", columnDefinition = "TEXT", updatable = false)
    private String details;

    @Column(name = "client_ip", length = 45, updatable = false)
    private String clientIp;

    @Column(name = "user_agent", length = 512, updatable = false)
    private String userAgent;
}
