package com.makeitso.ledger.websocket;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * Spring STOMP/WebSocket configuration.
 *
 * Frontend connection flow:
 *   1. Connect to  ws://host/ws  (or SockJS fallback: http://host/ws)
 *   2. STOMP SUBSCRIBE /topic/session/{sessionId}
 *   3. Receive SessionNotice frames when the session enters Warning, resumes, or ends
 *
 * Topic design:
 *   /topic/session/{sessionId}  notices for one session
 *   /topic/security/alerts      critical security events
 *
 * The in-memory simple broker is enough for one node. For several nodes, swap in a
 * broker relay.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    @Value("${app.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
        registry.setApplicationDestinationPrefixes("/app");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint("/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                // SockJS fallback for environments that block raw WebSocket
                .withSockJS();
    }
}
