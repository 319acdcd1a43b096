package com.rgp.domain.exception;

import java.util.Collections;
import java.util.List;

/**
 * Malformed input: zero amounts, mismatched lengths, too few underwriters
 */
public class ValidationException extends ProtocolException {

    private final List<String> errors;

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
        this.errors = Collections.singletonList(message);
    }

    public ValidationException(List<String> errors) {
        super(ErrorKind.VALIDATION, "Validation failed: " + errors);
        this.errors = Collections.unmodifiableList(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
