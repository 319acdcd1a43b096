package com.rgp.application.service;

import com.rgp.domain.exception.ValidationException;

import java.util.List;

/**
 * Collected problems of an assignment command. Empty means valid.
 */
public record ValidationResult(boolean isValid, List<String> errors) {

    static ValidationResult of(List<String> errors) {
        return errors.isEmpty()
                ? new ValidationResult(true, List.of())
                : new ValidationResult(false, List.copyOf(errors));
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public void throwIfInvalid() {
        if (!isValid) {
            throw new ValidationException(errors);
        }
    }
}
