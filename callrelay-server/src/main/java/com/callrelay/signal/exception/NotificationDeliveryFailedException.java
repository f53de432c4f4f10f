package com.callrelay.signal.exception;

import org.springframework.http.HttpStatus;

public class NotificationDeliveryFailedException extends CallRelayException {

    public NotificationDeliveryFailedException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "push_failed", cause);
    }
}
