package com.callrelay.signal.dto;

public record RegisterPushRequest(String userId, String pushToken) {}
