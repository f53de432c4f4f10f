package com.callrelay.signal.exception;

import org.springframework.http.HttpStatus;

import lombok.Getter;

/**
 * Base for failures surfaced to HTTP callers. The message is the wire error string.
 */
@Getter
public abstract class CallRelayException extends RuntimeException {

    private final HttpStatus status;

    protected CallRelayException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    protected CallRelayException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }
}
