package com.makeitso.ledger.audit;

/**
 * Receives critical security events for out-of-band alerting.
 *
 * Implementations throw on delivery failure; the caller retries and buffers.
 */
public interface SecurityAlertSink {

    void deliver(SecurityEvent event);
}
