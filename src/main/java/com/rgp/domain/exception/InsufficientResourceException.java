package com.rgp.domain.exception;

/**
 * Stake, commitment or escrow is too low for the requested movement
 */
public class InsufficientResourceException extends ProtocolException {

    public InsufficientResourceException(String message) {
        super(ErrorKind.INSUFFICIENT_RESOURCE, message);
    }
}
