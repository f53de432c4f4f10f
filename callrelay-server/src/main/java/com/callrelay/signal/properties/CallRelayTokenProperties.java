package com.callrelay.signal.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "callrelay.token")
public class CallRelayTokenProperties {

    /** Placeholder credentials, only for local development. */
    public static final String DEV_APP_ID = "00000000000000000000000000000000";
    public static final String DEV_APP_CERTIFICATE = "00000000000000000000000000000000";

    /**
     * Media transport application id (env APP_ID)
     */
    private String appId = DEV_APP_ID;

    /**
     * Shared secret used to sign tokens (env APP_CERTIFICATE)
     */
    private String appCertificate = DEV_APP_CERTIFICATE;

    /**
     * Default token lifetime in seconds (env TOKEN_EXPIRE_S)
     */
    private int expireSeconds = 3600;

    public boolean isDevelopmentDefault() {
        return DEV_APP_ID.equals(appId) || DEV_APP_CERTIFICATE.equals(appCertificate);
    }
}
