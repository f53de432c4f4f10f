package com.callrelay.signal.push;

import org.springframework.stereotype.Service;

import com.callrelay.signal.exception.NoNotificationAddressException;
import com.callrelay.signal.exception.NotificationDeliveryFailedException;
import com.callrelay.signal.presence.storage.PresenceRegistry;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class PushNotificationService {

    private final PresenceRegistry presenceRegistry;
    private final PushDeliveryClient deliveryClient;

    /**
     * Rings the recipient's device when it has no live connection.
     * Delivered at most once; failures are not retried.
     */
    public void sendIncomingCallAlert(String to, String from, String channel) {
        String pushToken = presenceRegistry.resolveNotificationAddress(to)
                .orElseThrow(NoNotificationAddressException::new);

        try {
            deliveryClient.deliver(pushToken, IncomingCallAlert.of(from, channel));
            log.info("push sent to {} for call from {}", to, from);
        } catch (PushDeliveryException e) {
            log.error("push error for {}: {}", to, e.getMessage(), e);
            throw new NotificationDeliveryFailedException(e);
        }
    }
}
