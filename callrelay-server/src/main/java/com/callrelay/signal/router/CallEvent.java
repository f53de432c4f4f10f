package com.callrelay.signal.router;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A call lifecycle message as sent by a client. The payload is forwarded as-is;
 * only {@code to}, {@code from} and {@code channel} are read by the relay.
 */
public record CallEvent(CallEventKind kind, Map<String, Object> payload) {

    public CallEvent {
        payload = payload == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public String to() {
        return stringField("to");
    }

    public String from() {
        return stringField("from");
    }

    public String channel() {
        return stringField("channel");
    }

    private String stringField(String name) {
        Object value = payload.get(name);
        return value == null ? null : String.valueOf(value);
    }
}
