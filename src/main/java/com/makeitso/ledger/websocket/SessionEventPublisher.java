package com.makeitso.ledger.websocket;

import com.makeitso.ledger.session.SessionNotice;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Thin facade over SimpMessagingTemplate that routes SessionNotices to the
 * STOMP topic of their session.
 *
 * Topic layout:
 *   /topic/session/{sessionId}  → state changes for one session
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionEventPublisher {

    static final String TOPIC_PREFIX = "/topic/session/";

    private final SimpMessagingTemplate messagingTemplate;

    /** Fire-and-forget; a failed push never affects the session transition. */
    public void publish(SessionNotice notice) {
        String destination = TOPIC_PREFIX + notice.sessionId();
        try {
            messagingTemplate.convertAndSend(destination, notice);
        } catch (MessagingException e) {
            log.warn("[Publisher] Failed to deliver {} notice to {}: {}",
                    notice.state(), destination, e.getMessage());
        }
    }
}
