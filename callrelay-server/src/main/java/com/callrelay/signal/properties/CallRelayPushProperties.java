package com.callrelay.signal.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@ConfigurationProperties(prefix = "callrelay.push")
public class CallRelayPushProperties {

    /**
     * Expo push API endpoint
     */
    private String endpoint = "https://exp.host/--/api/v2/push/send";

    /**
     * Notification title shown on the device
     */
    private String title = "Incoming call";
}
