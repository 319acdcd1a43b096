package com.rgp.domain.exception;

/**
 * Base exception for rejected ledger and guarantee operations.
 * Any instance aborts the enclosing unit of work.
 */
public abstract class ProtocolException extends RuntimeException {

    private final ErrorKind kind;

    protected ProtocolException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected ProtocolException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
