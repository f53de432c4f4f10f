package com.callrelay.signal.token;

import java.security.GeneralSecurityException;

import io.agora.media.RtcTokenBuilder;

/**
 * Signs RTC tokens with the Agora token builder.
 * Uids cover the unsigned 32 bit range and are passed on as their int bit pattern.
 */
public class AgoraTokenSigner implements TokenSigner {

    private final String appId;
    private final String appCertificate;
    private final RtcTokenBuilder tokenBuilder = new RtcTokenBuilder();

    public AgoraTokenSigner(String appId, String appCertificate) {
        this.appId = appId;
        this.appCertificate = appCertificate;
    }

    @Override
    public String sign(String channelName, long uid, RtcRole role, long privilegeExpiredTs)
            throws GeneralSecurityException {
        if (appId == null || appId.isBlank() || appCertificate == null || appCertificate.isBlank()) {
            throw new GeneralSecurityException("appId and appCertificate must be configured");
        }

        String token = tokenBuilder.buildTokenWithUid(
                appId, appCertificate, channelName, (int) uid, toAgoraRole(role), (int) privilegeExpiredTs);

        // the builder reports failures (e.g. malformed app id) as an empty token
        if (token == null || token.isEmpty()) {
            throw new GeneralSecurityException("token builder rejected appId/appCertificate");
        }
        return token;
    }

    static RtcTokenBuilder.Role toAgoraRole(RtcRole role) {
        return switch (role) {
            case PUBLISHER -> RtcTokenBuilder.Role.Role_Publisher;
            case SUBSCRIBER -> RtcTokenBuilder.Role.Role_Subscriber;
        };
    }
}
