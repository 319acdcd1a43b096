package com.rgp.domain.exception;

/**
 * Operation is not allowed in the current state (duplicate, already settled,
 * already distributed, premature, re-entrant)
 */
public class StateException extends ProtocolException {

    public StateException(String message) {
        super(ErrorKind.STATE, message);
    }
}
