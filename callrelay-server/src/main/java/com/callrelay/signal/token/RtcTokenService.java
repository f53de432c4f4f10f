package com.callrelay.signal.token;

import java.math.BigDecimal;
import java.security.GeneralSecurityException;
import java.time.Clock;

import org.springframework.stereotype.Service;

import com.callrelay.signal.exception.CredentialSigningFailedException;
import com.callrelay.signal.exception.InvalidRequestException;
import com.callrelay.signal.properties.CallRelayTokenProperties;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class RtcTokenService {

    /** Largest uid the media transport accepts (unsigned 32 bit). */
    static final long MAX_UID = 0xFFFFFFFFL;

    private final TokenSigner tokenSigner;
    private final CallRelayTokenProperties props;
    private final Clock clock;

    /**
     * Parses a client-supplied participant id. Fractions, exponents outside the
     * integral range and non-numeric text are rejected rather than truncated.
     */
    public long parseUid(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new InvalidRequestException("channelName and uid required");
        }
        try {
            BigDecimal value = new BigDecimal(raw.trim());
            long uid = value.longValueExact();
            if (uid < 0 || uid > MAX_UID) {
                throw new InvalidRequestException("uid must be numeric");
            }
            return uid;
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InvalidRequestException("uid must be numeric");
        }
    }

    public RtcCredential issue(String channelName, long uid, RtcRole role, Integer ttlSeconds) {
        if (channelName == null || channelName.isBlank()) {
            throw new InvalidRequestException("channelName and uid required");
        }
        int ttl = ttlSeconds != null ? ttlSeconds : props.getExpireSeconds();
        long privilegeExpiredTs = clock.instant().getEpochSecond() + ttl;

        try {
            String token = tokenSigner.sign(channelName, uid, role, privilegeExpiredTs);
            return new RtcCredential(token, channelName, uid, role, privilegeExpiredTs);
        } catch (GeneralSecurityException | RuntimeException e) {
            log.error("token error for channel {}: {}", channelName, e.getMessage(), e);
            throw new CredentialSigningFailedException(e);
        }
    }

    public RtcCredential issuePublisher(String channelName, long uid) {
        return issue(channelName, uid, RtcRole.PUBLISHER, null);
    }
}
