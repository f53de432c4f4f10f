package com.callrelay.signal.exception;

import org.springframework.http.HttpStatus;

public class CredentialSigningFailedException extends CallRelayException {

    public CredentialSigningFailedException(Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "token_generation_failed", cause);
    }
}
