package com.rgp.application.port.in;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Input port for the global underwriter collateral pool.
 * Every mutation of an underwriter's stake goes through this port.
 */
public interface UnderwriterPoolUseCase {

    /**
     * Deposit collateral. The first call for an identity creates its record.
     * @param caller underwriter depositing
     * @param amount collateral to pull into the pool, must be positive
     * @return the underwriter's stake after the deposit
     */
    StakeView register(String caller, BigInteger amount);

    /**
     * Lock the listed stakes behind a venue. Owner only, at most once per venue.
     * @param caller must be the venue owner
     * @param command roster, per-underwriter amounts and fee
     * @return the finalized assignment
     */
    AssignmentView assignToVenue(String caller, AssignUnderwritersCommand command);

    /**
     * Forfeit locked stake pro rata and forward it to the venue vault.
     * Only the venue's guarantee engine may call this.
     * @param caller guarantee engine account of the venue
     * @param venueId venue with an active assignment
     * @param missingAmount shortfall to cover
     * @return per-underwriter shares and the undistributed truncation residual
     */
    SettlementResult settleLiability(String caller, String venueId, BigInteger missingAmount);

    /**
     * After maturity, release the caller's commitment and pay the fee share net of protocol cut.
     */
    FeePayout claimFee(String caller, String venueId);

    StakeView withdraw(String caller, BigInteger amount);

    StakeView underwriter(String underwriter);

    boolean isRegistered(String underwriter);

    /**
     * Current commitment of an underwriter at a venue, zero once claimed
     */
    BigInteger stakeOf(String venueId, String underwriter);

    List<String> rosterOf(String venueId);

    AssignmentView assignment(String venueId);

    boolean isMatured(String venueId);

    /**
     * Command object for underwriter assignment.
     * Underwriters and amounts are parallel lists.
     */
    record AssignUnderwritersCommand(
            String venueId,
            List<String> underwriters,
            List<BigInteger> amounts,
            BigInteger fee
    ) {}

    record StakeView(
            String underwriter,
            BigInteger totalStake,
            BigInteger availableStake,
            BigInteger lockedStake
    ) {}

    record AssignmentView(
            String venueId,
            List<CommitmentView> roster,
            BigInteger totalStakeCommitted,
            BigInteger fee,
            BigInteger promisedRevenue,
            Instant endDate,
            boolean active,
            boolean matured,
            BigInteger settledTotal,
            BigInteger unsettledResidual,
            BigInteger feePaidOut
    ) {}

    record CommitmentView(
            String underwriter,
            BigInteger committed,
            BigInteger forfeited,
            BigInteger remaining,
            boolean feeClaimed
    ) {}

    record LiabilityShare(String underwriter, BigInteger share) {}

    record SettlementResult(
            String venueId,
            BigInteger missingAmount,
            List<LiabilityShare> shares,
            BigInteger settled,
            BigInteger residual
    ) {}

    record FeePayout(
            String underwriter,
            BigInteger grossShare,
            BigInteger protocolCut,
            BigInteger netShare,
            BigInteger releasedStake
    ) {}
}
