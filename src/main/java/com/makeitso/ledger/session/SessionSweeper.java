package com.makeitso.ledger.session;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic tick for the session state machine. Sessions that nobody touches still
 * move to Warning and Expired on time.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionSweeper {

    private final SessionLifecycleMonitor monitor;

    @Scheduled(fixedDelayString = "${app.security.check-interval-ms:30000}")
    public void tick() {
        int ended = monitor.sweep();
        if (ended > 0) {
            log.info("[Session] Sweep ended {} session(s), {} tracked", ended, monitor.trackedCount());
        }
    }

    @Scheduled(fixedDelayString = "${app.security.activity-flush-interval-ms:15000}")
    public void flush() {
        int written = monitor.flushActivity();
        log.debug("[Session] Flushed activity for {} session(s)", written);
    }
}
