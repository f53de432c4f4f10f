package com.callrelay.signal.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

import com.callrelay.signal.properties.CallRelayWebSocketProperties;

/**
 * STOMP endpoint for the call signaling channel.
 * Inbound events go to /app/{event}, outbound ones arrive on /user/queue/{event}.
 */
@Configuration
@EnableWebSocketMessageBroker
public class SignalWebSocketConfig implements WebSocketMessageBrokerConfigurer {

    private final CallRelayWebSocketProperties props;

    public SignalWebSocketConfig(CallRelayWebSocketProperties props) {
        this.props = props;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry config) {
        config.enableSimpleBroker("/queue");
        config.setApplicationDestinationPrefixes("/app");
        config.setUserDestinationPrefix("/user");
        // 세션별 송신 순서 보장
        config.setPreservePublishOrder(true);
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        // 세션별 수신 순서 보장 (같은 연결의 이벤트는 FIFO)
        registry.setPreserveReceiveOrder(true);

        registry.addEndpoint(props.getEndpoint())
                .setAllowedOriginPatterns(props.getAllowedOrigins().toArray(new String[0]))
                .withSockJS();
    }
}
