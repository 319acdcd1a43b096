package com.rgp.application.service;

import com.rgp.application.port.in.UnderwriterPoolUseCase.AssignUnderwritersCommand;
import com.rgp.domain.exception.ValidationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates caller identities, amounts and assignment commands
 */
public class GuaranteeValidator {

    static final int MIN_UNDERWRITERS = 2;
    private static final int MAX_IDENTITY_LENGTH = 128;

    /**
     * Validate an assignment command
     */
    public ValidationResult validate(AssignUnderwritersCommand command) {
        List<String> errors = new ArrayList<>();

        validateRequiredFields(command, errors);
        if (errors.isEmpty()) {
            validateRoster(command, errors);
            validateAmounts(command, errors);
        }
        return ValidationResult.of(errors);
    }

    private void validateRequiredFields(AssignUnderwritersCommand command, List<String> errors) {
        if (isBlank(command.venueId())) {
            errors.add("venueId is required");
        }
        if (command.underwriters() == null) {
            errors.add("underwriters is required");
        }
        if (command.amounts() == null) {
            errors.add("amounts is required");
        }
        if (command.fee() == null) {
            errors.add("fee is required");
        }
    }

    private void validateRoster(AssignUnderwritersCommand command, List<String> errors) {
        if (command.underwriters().size() != command.amounts().size()) {
            errors.add(String.format("underwriters (%d) and amounts (%d) must have the same length",
                    command.underwriters().size(), command.amounts().size()));
        }
        if (command.underwriters().size() < MIN_UNDERWRITERS) {
            errors.add("at least " + MIN_UNDERWRITERS + " underwriters are required");
        }

        Set<String> seen = new HashSet<>();
        for (String underwriter : command.underwriters()) {
            if (isBlank(underwriter)) {
                errors.add("underwriter identity must not be blank");
            } else if (!seen.add(underwriter)) {
                errors.add("underwriter " + underwriter + " is listed more than once");
            }
        }
    }

    private void validateAmounts(AssignUnderwritersCommand command, List<String> errors) {
        for (BigInteger amount : command.amounts()) {
            if (amount == null || amount.signum() <= 0) {
                errors.add("every committed amount must be positive");
                break;
            }
        }
        if (command.fee().signum() < 0) {
            errors.add("fee must be non-negative");
        }
    }

    public void requireIdentity(String identity, String field) {
        if (isBlank(identity)) {
            throw new ValidationException(field + " is required");
        }
        if (identity.length() > MAX_IDENTITY_LENGTH) {
            throw new ValidationException(field + " exceeds maximum length of " + MAX_IDENTITY_LENGTH + " characters");
        }
    }

    public void requirePositive(BigInteger amount, String field) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(field + " must be positive");
        }
    }

    public void requireNonNegative(BigInteger amount, String field) {
        if (amount == null || amount.signum() < 0) {
            throw new ValidationException(field + " must be non-negative");
        }
    }

    public void requireMonth(int month) {
        if (month < 1) {
            throw new ValidationException("month must be 1 or greater");
        }
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
