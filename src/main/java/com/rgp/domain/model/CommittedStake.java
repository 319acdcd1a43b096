package com.rgp.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * One underwriter's commitment to one venue.
 * The committed figure never changes; forfeits and the fee claim are tracked beside it.
 */
@Getter
@ToString
public class CommittedStake {
    private final BigInteger committed;
    private BigInteger forfeited;
    private boolean feeClaimed;

    public CommittedStake(BigInteger committed) {
        this(committed, BigInteger.ZERO, false);
    }

    private CommittedStake(BigInteger committed, BigInteger forfeited, boolean feeClaimed) {
        this.committed = committed;
        this.forfeited = forfeited;
        this.feeClaimed = feeClaimed;
    }

    /**
     * Commitment still backing the venue; zero once the fee has been claimed.
     */
    public BigInteger getRemaining() {
        return feeClaimed ? BigInteger.ZERO : committed.subtract(forfeited);
    }

    public void recordForfeit(BigInteger amount) {
        forfeited = forfeited.add(amount);
    }

    public void markFeeClaimed() {
        feeClaimed = true;
    }

    public CommittedStake copy() {
        return new CommittedStake(committed, forfeited, feeClaimed);
    }
}
