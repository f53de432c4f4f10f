package com.callrelay.signal.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

import com.callrelay.signal.properties.CallRelayPushProperties;
import com.callrelay.signal.properties.CallRelayTokenProperties;
import com.callrelay.signal.properties.CallRelayWebSocketProperties;
import com.callrelay.signal.push.ExpoPushDeliveryClient;
import com.callrelay.signal.push.PushDeliveryClient;
import com.callrelay.signal.token.AgoraTokenSigner;
import com.callrelay.signal.token.TokenSigner;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
@EnableConfigurationProperties({
        CallRelayWebSocketProperties.class,
        CallRelayTokenProperties.class,
        CallRelayPushProperties.class
})
public class CallRelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenSigner tokenSigner(CallRelayTokenProperties props) {
        if (isBlank(props.getAppId()) || isBlank(props.getAppCertificate())) {
            throw new IllegalStateException("Set APP_ID and APP_CERTIFICATE before running.");
        }
        if (props.isDevelopmentDefault()) {
            log.warn("Using development APP_ID/APP_CERTIFICATE. Override them in any shared deployment.");
        }
        return new AgoraTokenSigner(props.getAppId(), props.getAppCertificate());
    }

    @Bean
    public PushDeliveryClient pushDeliveryClient(RestClient.Builder restClientBuilder, CallRelayPushProperties props) {
        return new ExpoPushDeliveryClient(restClientBuilder.build(), props);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
