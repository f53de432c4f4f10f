package com.callrelay.signal.dto;

public record RegisterRequest(String userId) {}
