package com.callrelay.signal.token;

public record RtcCredential(
        String token,
        String channelName,
        long uid,
        RtcRole role,
        long expiresAt
) {}
