package com.rgp.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Revenue attested by an operator for one period
 */
@Getter
@ToString
public class MonthlyReport {
    private final int month;
    private final BigInteger expectedRevenue;
    private final BigInteger actualRevenue;
    private final BigInteger missingRevenue;
    private final Instant timestamp;
    private boolean liabilityPaid;

    public MonthlyReport(int month, BigInteger expectedRevenue, BigInteger actualRevenue, Instant timestamp) {
        this(month, expectedRevenue, actualRevenue, expectedRevenue.subtract(actualRevenue).max(BigInteger.ZERO),
                timestamp, false);
    }

    private MonthlyReport(int month, BigInteger expectedRevenue, BigInteger actualRevenue,
                          BigInteger missingRevenue, Instant timestamp, boolean liabilityPaid) {
        this.month = month;
        this.expectedRevenue = expectedRevenue;
        this.actualRevenue = actualRevenue;
        this.missingRevenue = missingRevenue;
        this.timestamp = timestamp;
        this.liabilityPaid = liabilityPaid;
    }

    public boolean hasShortfall() {
        return missingRevenue.signum() > 0;
    }

    public void markLiabilityPaid() {
        liabilityPaid = true;
    }

    public MonthlyReport copy() {
        return new MonthlyReport(month, expectedRevenue, actualRevenue, missingRevenue, timestamp, liabilityPaid);
    }
}
