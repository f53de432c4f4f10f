package com.callrelay.signal.controller;

import java.util.Map;

import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import com.callrelay.signal.dto.RegisterPushRequest;
import com.callrelay.signal.dto.RegisterRequest;
import com.callrelay.signal.listener.PresenceSessionManager;
import com.callrelay.signal.router.CallSessionRouter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Inbound side of the signaling channel. Each STOMP frame sent to /app/{event}
 * is handled on its own; a failing frame never closes the connection.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class CallSignalController {

    private final PresenceSessionManager presenceSessionManager;
    private final CallSessionRouter callSessionRouter;

    @MessageMapping("/register")
    public void register(@Payload RegisterRequest request, SimpMessageHeaderAccessor accessor) {
        presenceSessionManager.handleRegister(request.userId(), accessor.getSessionId());
    }

    @MessageMapping("/register_push")
    public void registerPush(@Payload RegisterPushRequest request) {
        presenceSessionManager.handleRegisterPush(request.userId(), request.pushToken());
    }

    // caller -> server: { to: 'doctor', from: 'patient', channel, callerUid }
    @MessageMapping("/call")
    public void call(@Payload Map<String, Object> payload, SimpMessageHeaderAccessor accessor) {
        callSessionRouter.call(payload, accessor.getSessionId());
    }

    // callee -> server: { to: 'patient', from: 'doctor', channel, calleeUid }
    @MessageMapping("/accept_call")
    public void acceptCall(@Payload Map<String, Object> payload, SimpMessageHeaderAccessor accessor) {
        callSessionRouter.accept(payload, accessor.getSessionId());
    }

    @MessageMapping("/reject_call")
    public void rejectCall(@Payload Map<String, Object> payload, SimpMessageHeaderAccessor accessor) {
        callSessionRouter.reject(payload, accessor.getSessionId());
    }

    @MessageMapping("/end_call")
    public void endCall(@Payload Map<String, Object> payload, SimpMessageHeaderAccessor accessor) {
        callSessionRouter.end(payload, accessor.getSessionId());
    }

    @MessageExceptionHandler
    public void handleFailure(Exception e, SimpMessageHeaderAccessor accessor) {
        log.warn("Dropped signaling frame {} on session {}: {}",
                accessor.getDestination(), accessor.getSessionId(), e.getMessage());
    }
}
