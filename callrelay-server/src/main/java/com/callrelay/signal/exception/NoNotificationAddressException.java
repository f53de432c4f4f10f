package com.callrelay.signal.exception;

import org.springframework.http.HttpStatus;

public class NoNotificationAddressException extends CallRelayException {

    public NoNotificationAddressException() {
        super(HttpStatus.BAD_REQUEST, "No push token for recipient");
    }
}
