package com.callrelay.signal.push;

public class PushDeliveryException extends Exception {

    public PushDeliveryException(String message) {
        super(message);
    }

    public PushDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
