package com.makeitso.ledger.admin.dto;

import com.makeitso.ledger.audit.RiskLevel;
import com.makeitso.ledger.audit.SecurityEventType;
import com.makeitso.ledger.domain.SecurityEventEntry;

import java.time.Instant;

public record SecurityEventView(
        String            eventId,
        SecurityEventType type,
        Long              userId,
        String            sessionId,
        Instant           timestamp,
        boolean           success,
        RiskLevel         riskLevel,
        String            details,    // raw JSON
        String            clientIp,
        String            userAgent
) {

    public static SecurityEventView from(SecurityEventEntry entry) {
        return new SecurityEventView(
                entry.getEventId(),
                entry.getType(),
                entry.getUserId(),
                entry.getSessionId(),
                entry.getOccurredAt(),
                entry.isSuccess(),
                entry.getRiskLevel(),
                entry.getDetails(),
                entry.getClientIp(),
                entry.getUserAgent()
        );
    }
}
