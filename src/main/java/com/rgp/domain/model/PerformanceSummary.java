package com.rgp.domain.model;

import java.math.BigInteger;

/**
 * Running revenue figures of a venue guarantee.
 * The gap is signed: over-performance yields a negative value.
 */
public record PerformanceSummary(
        BigInteger totalExpected,
        BigInteger totalCollected,
        BigInteger revenueGap,
        BigInteger totalLiabilityPaid
) {
}
