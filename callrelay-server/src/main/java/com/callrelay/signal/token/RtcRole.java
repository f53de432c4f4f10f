package com.callrelay.signal.token;

/**
 * Capability granted by an issued token. Publishers may join and send streams,
 * subscribers may only join.
 */
public enum RtcRole {
    PUBLISHER,
    SUBSCRIBER
}
