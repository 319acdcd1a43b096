package com.rgp.domain.model;

import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Frozen underwriting of one venue: roster, aggregate commitment, fee pool and maturity.
 * Per-underwriter commitments live in the (venue, underwriter) table of the repository.
 */
@Getter
@ToString
public class VenueAssignment {
    private final String venueId;
    private final List<String> roster;
    private final BigInteger totalStakeCommitted;
    private final BigInteger fee;
    private final BigInteger promisedRevenue;
    private final Instant endDate;
    private boolean active;
    private BigInteger settledTotal;
    private BigInteger unsettledResidual;
    private BigInteger feePaidOut;

    public VenueAssignment(
            String venueId,
            List<String> roster,
            BigInteger totalStakeCommitted,
            BigInteger fee,
            BigInteger promisedRevenue,
            Instant endDate
    ) {
        this(venueId, List.copyOf(roster), totalStakeCommitted, fee, promisedRevenue, endDate,
                true, BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);
    }

    private VenueAssignment(
            String venueId,
            List<String> roster,
            BigInteger totalStakeCommitted,
            BigInteger fee,
            BigInteger promisedRevenue,
            Instant endDate,
            boolean active,
            BigInteger settledTotal,
            BigInteger unsettledResidual,
            BigInteger feePaidOut
    ) {
        this.venueId = venueId;
        this.roster = roster;
        this.totalStakeCommitted = totalStakeCommitted;
        this.fee = fee;
        this.promisedRevenue = promisedRevenue;
        this.endDate = endDate;
        this.active = active;
        this.settledTotal = settledTotal;
        this.unsettledResidual = unsettledResidual;
        this.feePaidOut = feePaidOut;
    }

    public boolean isMatured(Instant now) {
        return !now.isBefore(endDate);
    }

    public void recordSettlement(BigInteger missingAmount, BigInteger paid) {
        settledTotal = settledTotal.add(paid);
        unsettledResidual = unsettledResidual.add(missingAmount.subtract(paid));
    }

    public void recordFeePaid(BigInteger amount) {
        feePaidOut = feePaidOut.add(amount);
    }

    public void deactivate() {
        active = false;
    }

    public VenueAssignment copy() {
        return new VenueAssignment(venueId, roster, totalStakeCommitted, fee, promisedRevenue, endDate,
                active, settledTotal, unsettledResidual, feePaidOut);
    }
}
