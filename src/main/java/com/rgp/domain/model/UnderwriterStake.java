package com.rgp.domain.model;

import com.rgp.domain.exception.InsufficientResourceException;
import com.rgp.domain.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Underwriter collateral triple across all venues.
 * Invariant: total = available + locked, all non-negative.
 */
@Getter
@ToString
@EqualsAndHashCode
public class UnderwriterStake {
    private final String underwriter;
    private BigInteger totalStake;
    private BigInteger availableStake;
    private BigInteger lockedStake;

    private UnderwriterStake(String underwriter, BigInteger total, BigInteger available, BigInteger locked) {
        this.underwriter = underwriter;
        this.totalStake = total;
        this.availableStake = available;
        this.lockedStake = locked;
    }

    public static UnderwriterStake open(String underwriter, BigInteger amount) {
        requirePositive(amount);
        return new UnderwriterStake(underwriter, amount, amount, BigInteger.ZERO);
    }

    public void deposit(BigInteger amount) {
        requirePositive(amount);
        totalStake = totalStake.add(amount);
        availableStake = availableStake.add(amount);
    }

    // available -> locked
    public void lock(BigInteger amount) {
        requirePositive(amount);
        if (amount.compareTo(availableStake) > 0) {
            throw new InsufficientResourceException(String.format(
                    "Underwriter %s has %s available, %s requested", underwriter, availableStake, amount));
        }
        availableStake = availableStake.subtract(amount);
        lockedStake = lockedStake.add(amount);
    }

    // locked -> available
    public void release(BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        if (amount.compareTo(lockedStake) > 0) {
            throw new InsufficientResourceException(String.format(
                    "Underwriter %s has %s locked, cannot release %s", underwriter, lockedStake, amount));
        }
        lockedStake = lockedStake.subtract(amount);
        availableStake = availableStake.add(amount);
    }

    /**
     * Removes forfeited collateral from the locked bucket and from the total.
     */
    public void forfeit(BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        if (amount.compareTo(lockedStake) > 0) {
            throw new InsufficientResourceException(String.format(
                    "Underwriter %s has %s locked, cannot forfeit %s", underwriter, lockedStake, amount));
        }
        lockedStake = lockedStake.subtract(amount);
        totalStake = totalStake.subtract(amount);
    }

    public void withdraw(BigInteger amount) {
        requirePositive(amount);
        if (amount.compareTo(availableStake) > 0) {
            throw new InsufficientResourceException(String.format(
                    "Underwriter %s has %s available, cannot withdraw %s", underwriter, availableStake, amount));
        }
        availableStake = availableStake.subtract(amount);
        totalStake = totalStake.subtract(amount);
    }

    public boolean isBalanced() {
        return availableStake.signum() >= 0
                && lockedStake.signum() >= 0
                && totalStake.equals(availableStake.add(lockedStake));
    }

    public UnderwriterStake copy() {
        return new UnderwriterStake(underwriter, totalStake, availableStake, lockedStake);
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("amount must be positive");
        }
    }
}
