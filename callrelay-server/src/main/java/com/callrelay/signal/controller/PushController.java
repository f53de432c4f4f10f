package com.callrelay.signal.controller;

import java.util.Map;

import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import com.callrelay.signal.dto.SendPushRequest;
import com.callrelay.signal.exception.InvalidRequestException;
import com.callrelay.signal.push.PushNotificationService;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class PushController {

    private final PushNotificationService pushNotificationService;

    @PostMapping("/sendPush")
    public Map<String, Object> sendPush(@RequestBody SendPushRequest request) {
        if (request.to() == null || request.to().isBlank()) {
            throw new InvalidRequestException("to is required");
        }
        pushNotificationService.sendIncomingCallAlert(request.to(), request.from(), request.channel());
        return Map.of("ok", true);
    }
}
