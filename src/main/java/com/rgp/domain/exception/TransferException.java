package com.rgp.domain.exception;

/**
 * The collateral asset refused a transfer
 */
public class TransferException extends ProtocolException {

    public TransferException(String message) {
        super(ErrorKind.TRANSFER, message);
    }

    public TransferException(String message, Throwable cause) {
        super(ErrorKind.TRANSFER, message, cause);
    }
}
