package com.makeitso.ledger.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.makeitso.ledger.domain.SecurityEventEntry;
import com.makeitso.ledger.repository.SecurityEventRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Append-only security event log.
 *
 * Each append commits in its own transaction so the record survives a rollback of
 * whatever operation triggered it (a failed login, for instance). Appends never
 * throw back at the caller, whatever the store or the serialiser fails with.
 * Critical events are handed to the {@link AlertDispatcher} after the write, and
 * also when the write itself fails.
 */
@Slf4j
@Service
public class SecurityEventLog {

    private final SecurityEventRepository eventRepository;
    private final AlertDispatcher         alertDispatcher;
    private final ObjectMapper            objectMapper;
    private final TransactionTemplate     appendTransaction;

    public SecurityEventLog(SecurityEventRepository eventRepository,
                            AlertDispatcher alertDispatcher,
                            ObjectMapper objectMapper,
                            PlatformTransactionManager transactionManager) {
        this.eventRepository   = eventRepository;
        this.alertDispatcher   = alertDispatcher;
        this.objectMapper      = objectMapper;
        this.appendTransaction = new TransactionTemplate(transactionManager);
        this.appendTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public void logSecurityEvent(SecurityEvent event) {
        writeToLog(event);
        try {
            SecurityEventEntry entry = toEntry(event);
            appendTransaction.executeWithoutResult(status -> eventRepository.save(entry));
        } catch (RuntimeException e) {
            log.error("[Audit] Failed to persist {} event {} for user={} session={}: {}",
                    event.type(), event.eventId(), event.userId(), event.sessionId(), e.getMessage());
        } finally {
            if (event.isCritical()) {
                alertDispatcher.dispatch(event);
            }
        }
    }

    @Transactional(readOnly = true)
    public Page<SecurityEventEntry> recent(int page, int size) {
        return eventRepository.findAllByOrderByOccurredAtDescIdDesc(PageRequest.of(page, size));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void writeToLog(SecurityEvent event) {
        switch (event.riskLevel()) {
            case CRITICAL -> log.error("[Audit] CRITICAL {} user={} session={} success={} details={}",
                    event.type(), event.userId(), event.sessionId(), event.success(), event.details());
            case HIGH -> log.warn("[Audit] {} user={} session={} success={} details={}",
                    event.type(), event.userId(), event.sessionId(), event.success(), event.details());
            default -> log.info("[Audit] {} user={} session={} success={}",
                    event.type(), event.userId(), event.sessionId(), event.success());
        }
    }

    private SecurityEventEntry toEntry(SecurityEvent event) {
        return SecurityEventEntry.builder()
                .eventId(event.eventId())
                .type(event.type())
                .userId(event.userId())
                .sessionId(event.sessionId())
                .occurredAt(event.timestamp())
                .success(event.success())
                .riskLevel(event.riskLevel())
                .details(serialize(event))
                .clientIp(event.clientIp())
                .userAgent(event.userAgent())
                .build();
    }

    private String serialize(SecurityEvent event) {
        if (event.details().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(event.details());
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Could not serialize details of event {}: {}", event.eventId(), e.getMessage());
            return String.valueOf(event.details());
        }
    }
}
