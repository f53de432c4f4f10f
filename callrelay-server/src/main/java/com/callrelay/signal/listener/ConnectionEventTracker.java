package com.callrelay.signal.listener;

import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionConnectedEvent;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Component
@RequiredArgsConstructor
public class ConnectionEventTracker {

    private final PresenceSessionManager presenceSessionManager;

    @EventListener
    public void handleConnectedEvent(SessionConnectedEvent event) {
        log.info("socket connected {}", event.getMessage().getHeaders().get("simpSessionId"));
    }

    /**
     * Spring publishes one disconnect event per session, but may publish it more
     * than once for the same session; the registry cleanup is idempotent.
     */
    @EventListener
    public void handleDisconnectEvent(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId != null) {
            presenceSessionManager.handleDisconnect(sessionId);
        }
    }
}
