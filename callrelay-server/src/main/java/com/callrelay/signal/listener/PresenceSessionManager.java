package com.callrelay.signal.listener;

import org.springframework.stereotype.Service;

import com.callrelay.signal.presence.storage.PresenceRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class PresenceSessionManager {

    private final PresenceRegistry presenceRegistry;

    /**
     * register 이벤트 (유저 ↔ 세션 연결)
     */
    public void handleRegister(String userId, String sessionId) {
        if (userId == null || userId.isBlank()) {
            log.debug("Ignoring register without userId on session {}", sessionId);
            return;
        }
        presenceRegistry.register(userId, sessionId);
        log.info("registered {} -> {}", userId, sessionId);
    }

    /**
     * register_push 이벤트 (푸시 토큰 저장)
     */
    public void handleRegisterPush(String userId, String pushToken) {
        if (userId == null || userId.isBlank() || pushToken == null || pushToken.isBlank()) {
            log.debug("Ignoring register_push with missing userId or pushToken");
            return;
        }
        presenceRegistry.registerNotificationAddress(userId, pushToken);
        log.info("push token registered for {}", userId);
    }

    /**
     * 연결 해제 시 (퇴장)
     */
    public void handleDisconnect(String sessionId) {
        presenceRegistry.clearLiveConnection(sessionId)
                .ifPresentOrElse(
                        userId -> log.info("disconnected and removed {} ({})", userId, sessionId),
                        () -> log.debug("session {} disconnected without a current registration", sessionId));
    }
}
