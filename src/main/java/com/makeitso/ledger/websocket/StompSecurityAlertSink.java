package com.makeitso.ledger.websocket;

import com.makeitso.ledger.audit.SecurityAlertSink;
import com.makeitso.ledger.audit.SecurityEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Default alert channel: critical events are broadcast on /topic/security/alerts
 * for whoever runs the security console. Exceptions propagate so the dispatcher
 * can retry and park.
 */
@Component
@RequiredArgsConstructor
public class StompSecurityAlertSink implements SecurityAlertSink {

    static final String ALERT_TOPIC = "/topic/security/alerts";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void deliver(SecurityEvent event) {
        messagingTemplate.convertAndSend(ALERT_TOPIC, event);
    }
}
