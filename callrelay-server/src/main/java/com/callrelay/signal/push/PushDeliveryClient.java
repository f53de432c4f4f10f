package com.callrelay.signal.push;

/**
 * Hands a notification to the external push provider. Called once per alert;
 * implementations must not retry.
 */
public interface PushDeliveryClient {

    void deliver(String pushToken, IncomingCallAlert alert) throws PushDeliveryException;
}
