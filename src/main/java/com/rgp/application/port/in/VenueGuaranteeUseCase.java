package com.rgp.application.port.in;

import com.rgp.application.port.in.UnderwriterPoolUseCase.FeePayout;
import com.rgp.application.port.in.UnderwriterPoolUseCase.SettlementResult;
import com.rgp.domain.model.GuaranteePhase;
import com.rgp.domain.model.PerformanceSummary;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Input port for the per-venue guarantee engine: roles, roster, fee escrow,
 * monthly reports and liability processing.
 * Role checks are made against the caller identity passed to each operation.
 */
public interface VenueGuaranteeUseCase {

    /**
     * Create the guarantee engine of a registered venue. Owner only, at most once per venue.
     * @param caller must be the venue owner
     * @param venueId registered venue
     * @param admin immutable admin of the engine, initially its only operator
     */
    GuaranteeView openGuarantee(String caller, String venueId, String admin);

    void addOperator(String caller, String venueId, String operator);

    void removeOperator(String caller, String venueId, String operator);

    void setFeeAmount(String caller, String venueId, BigInteger amount);

    void addUnderwriter(String caller, String venueId, String underwriter, BigInteger stake);

    void depositFee(String caller, String venueId);

    /**
     * Record the next period's revenue. Each call advances exactly one month.
     */
    ReportView submitMonthlyReport(String caller, String venueId, BigInteger actualRevenue);

    /**
     * Settle the shortfall of a reported month against the pool, at most once per month.
     */
    SettlementResult processLiability(String caller, String venueId, int month);

    /**
     * Owner deposit straight into the venue vault. Not reconciled against reports.
     */
    void ownerDepositRevenue(String caller, String venueId, int month, BigInteger amount);

    List<FeePayout> distributeFees(String caller, String venueId);

    FeePayout claimFee(String caller, String venueId);

    PerformanceSummary getPerformanceSummary(String venueId);

    ReportView report(String venueId, int month);

    GuaranteeView guarantee(String venueId);

    boolean isMatured(String venueId);

    record ReportView(
            int month,
            BigInteger expectedRevenue,
            BigInteger actualRevenue,
            BigInteger missingRevenue,
            boolean liabilityPaid,
            Instant timestamp
    ) {}

    record RosterEntryView(
            String underwriter,
            BigInteger stake,
            boolean approved,
            boolean feeClaimed
    ) {}

    record GuaranteeView(
            String venueId,
            String admin,
            Set<String> operators,
            GuaranteePhase phase,
            int currentMonth,
            BigInteger expectedRevenue,
            Instant maturityTime,
            List<RosterEntryView> roster,
            BigInteger totalStake,
            BigInteger feeAmount,
            BigInteger escrowBalance,
            boolean feesDistributed,
            Map<Integer, BigInteger> ownerDeposits
    ) {}
}
