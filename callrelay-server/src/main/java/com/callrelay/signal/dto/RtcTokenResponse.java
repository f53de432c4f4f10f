package com.callrelay.signal.dto;

public record RtcTokenResponse(String rtcToken, long uid, String channelName) {}
