package com.callrelay.signal.token;

import java.security.GeneralSecurityException;

/**
 * Produces a signed media-channel access token.
 */
public interface TokenSigner {

    /**
     * @param privilegeExpiredTs absolute expiry in epoch seconds
     */
    String sign(String channelName, long uid, RtcRole role, long privilegeExpiredTs)
            throws GeneralSecurityException;
}
