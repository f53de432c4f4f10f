package com.callrelay.signal.exception;

import org.springframework.http.HttpStatus;

public class InvalidRequestException extends CallRelayException {

    public InvalidRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, message);
    }
}
