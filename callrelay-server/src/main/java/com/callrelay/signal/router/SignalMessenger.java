package com.callrelay.signal.router;

import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class SignalMessenger {

    static final String QUEUE_PREFIX = "/queue/";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * 특정 세션에게만 이벤트를 전송합니다.
     * 클라이언트는 /user/queue/{event} 를 구독합니다.
     */
    public void sendToSession(String sessionId, String event, Object payload) {
        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);

        // user == sessionId 이면 principal 없이 해당 세션으로 라우팅됨
        messagingTemplate.convertAndSendToUser(
                sessionId,
                QUEUE_PREFIX + event,
                payload,
                headerAccessor.getMessageHeaders()
        );
    }
}
