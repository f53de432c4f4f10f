package com.callrelay.signal.dto;

public record HealthResponse(String status, String message) {}
