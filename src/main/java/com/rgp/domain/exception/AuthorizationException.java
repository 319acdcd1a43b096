package com.rgp.domain.exception;

/**
 * Caller lacks the role or registration the operation requires
 */
public class AuthorizationException extends ProtocolException {

    public AuthorizationException(String message) {
        super(ErrorKind.AUTHORIZATION, message);
    }
}
