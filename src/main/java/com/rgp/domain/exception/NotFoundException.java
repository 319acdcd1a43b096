package com.rgp.domain.exception;

/**
 * Unknown venue, underwriter or report month
 */
public class NotFoundException extends ProtocolException {

    public NotFoundException(String message) {
        super(ErrorKind.NOT_FOUND, message);
    }
}
