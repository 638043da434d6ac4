package com.makeitso.ledger.audit;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Deque;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Hands critical events to the {@link SecurityAlertSink} off the caller's thread.
 *
 * Delivery goes through the "alertSink" retry and circuit breaker. Anything that
 * still fails is parked in a bounded buffer and redelivered by {@link #redeliverPending()}.
 * The event itself is already persisted by the time it reaches this class, so a dead
 * alert channel never hides the audit trail.
 */
@Slf4j
@Component
public class AlertDispatcher {

    static final int MAX_PENDING = 1_000;

    private final SecurityAlertSink alertSink;
    private final Retry             alertSinkRetry;
    private final CircuitBreaker    alertSinkCircuitBreaker;
    private final Executor          alertExecutor;

    private final Deque<SecurityEvent> pending = new ConcurrentLinkedDeque<>();
    private final AtomicInteger pendingSize = new AtomicInteger();

    public AlertDispatcher(SecurityAlertSink alertSink,
                           Retry alertSinkRetry,
                           CircuitBreaker alertSinkCircuitBreaker,
                           @Qualifier("alertExecutor") Executor alertExecutor) {
        this.alertSink               = alertSink;
        this.alertSinkRetry          = alertSinkRetry;
        this.alertSinkCircuitBreaker = alertSinkCircuitBreaker;
        this.alertExecutor           = alertExecutor;
    }

    /** Fire-and-forget from the caller's point of view. */
    public void dispatch(SecurityEvent event) {
        try {
            alertExecutor.execute(() -> deliverOrPark(event));
        } catch (RejectedExecutionException e) {
            log.warn("[Alert] Executor rejected event {}, parking for redelivery", event.eventId());
            park(event);
        }
    }

    /** Retries parked alerts in arrival order; stops at the first failure. */
    @Scheduled(fixedDelayString = "${app.security.alert-redelivery-interval-ms:60000}")
    public void redeliverPending() {
        SecurityEvent next;
        while ((next = pending.pollFirst()) != null) {
            pendingSize.decrementAndGet();
            if (!tryDeliver(next)) {
                pending.offerFirst(next);
                pendingSize.incrementAndGet();
                return;
            }
            log.info("[Alert] Redelivered parked alert {}", next.eventId());
        }
    }

    public int pendingCount() {
        return pendingSize.get();
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private void deliverOrPark(SecurityEvent event) {
        if (!tryDeliver(event)) {
            park(event);
        }
    }

    private boolean tryDeliver(SecurityEvent event) {
        Runnable guarded = CircuitBreaker.decorateRunnable(alertSinkCircuitBreaker,
                Retry.decorateRunnable(alertSinkRetry, () -> alertSink.deliver(event)));
        try {
            guarded.run();
            return true;
        } catch (RuntimeException e) {
            log.error("[Alert] Delivery failed for {} event {}: {}",
                    event.type(), event.eventId(), e.getMessage());
            return false;
        }
    }

    private void park(SecurityEvent event) {
        pending.offerLast(event);
        if (pendingSize.incrementAndGet() > MAX_PENDING) {
            SecurityEvent dropped = pending.pollFirst();
            if (dropped != null) {
                pendingSize.decrementAndGet();
                log.error("[Alert] Alert buffer full, giving up on alert for persisted event {} ({}, user={})",
                        dropped.eventId(), dropped.type(), dropped.userId());
            }
        }
    }
}
