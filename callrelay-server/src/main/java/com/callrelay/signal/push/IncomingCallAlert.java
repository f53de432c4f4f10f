package com.callrelay.signal.push;

/**
 * Data block of the out-of-band "incoming call" notification.
 */
public record IncomingCallAlert(
        String type,
        String from,
        String channel
) {

    public static final String TYPE = "incoming_call";

    public static IncomingCallAlert of(String from, String channel) {
        return new IncomingCallAlert(TYPE, from, channel);
    }
}
