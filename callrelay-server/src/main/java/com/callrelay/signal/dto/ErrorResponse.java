package com.callrelay.signal.dto;

public record ErrorResponse(String error) {}
