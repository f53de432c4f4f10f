package com.callrelay.signal.push;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.callrelay.signal.properties.CallRelayPushProperties;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.extern.slf4j.Slf4j;

/**
 * Sends alerts through the Expo push service.
 * A 2xx response whose ticket has {@code status: "error"} is also a failure.
 */
@Slf4j
public class ExpoPushDeliveryClient implements PushDeliveryClient {

    private final RestClient restClient;
    private final CallRelayPushProperties props;

    public ExpoPushDeliveryClient(RestClient restClient, CallRelayPushProperties props) {
        this.restClient = restClient;
        this.props = props;
    }

    @Override
    public void deliver(String pushToken, IncomingCallAlert alert) throws PushDeliveryException {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("to", pushToken);
        message.put("sound", "default");
        message.put("title", props.getTitle());
        message.put("body", alert.from() + " is calling");
        message.put("priority", "high");
        message.put("data", alert);

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(props.getEndpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(message)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new PushDeliveryException("Expo push request failed: " + e.getMessage(), e);
        }

        String ticketId = "";
        if (response != null) {
            JsonNode ticket = response.path("data");
            if (ticket.isArray()) {
                ticket = ticket.path(0);
            }
            if ("error".equals(ticket.path("status").asText())) {
                throw new PushDeliveryException("Expo rejected push: " + ticket.path("message").asText());
            }
            ticketId = ticket.path("id").asText();
        }
        log.info("Expo push accepted for {} (ticket {})", pushToken, ticketId);
    }
}
