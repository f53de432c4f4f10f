package com.callrelay.signal.dto;

public record SendPushRequest(String to, String from, String channel) {}
