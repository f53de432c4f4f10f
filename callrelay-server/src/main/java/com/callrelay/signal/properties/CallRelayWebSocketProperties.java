package com.callrelay.signal.properties;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "callrelay.websocket")
public class CallRelayWebSocketProperties {

    /**
     * WebSocket endpoint path
     * 예: /ws-signal
     */
    private String endpoint = "/ws-signal";

    /**
     * Allowed origin patterns
     */
    private List<String> allowedOrigins = List.of("*");
}
