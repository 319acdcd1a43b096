package com.rgp.domain.model;

import lombok.Getter;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Guarantee engine state of one venue: report ledger, running totals,
 * local underwriter roster and fee escrow.
 */
@Getter
public class VenueGuarantee {
    private static final String ACCOUNT_PREFIX = "guarantee:";

    private final String venueId;
    private final RoleConfiguration roles;
    private final Instant startTime;
    private final Duration contractDuration;
    private final BigInteger expectedRevenue;

    private int currentMonth;
    private final List<MonthlyReport> reports;
    private BigInteger totalExpected;
    private BigInteger totalCollected;
    private BigInteger totalLiabilityPaid;

    private final Map<String, GuaranteeUnderwriter> roster;
    private BigInteger totalStake;

    private BigInteger feeAmount;
    private boolean feeDeposited;
    private BigInteger escrowDeposited;
    private BigInteger escrowBalance;
    private boolean feesDistributed;

    private final TreeMap<Integer, BigInteger> ownerDeposits;

    public VenueGuarantee(String venueId, String admin, Instant startTime, Duration contractDuration,
                          BigInteger expectedRevenue) {
        this.venueId = venueId;
        this.roles = new RoleConfiguration(admin);
        this.startTime = startTime;
        this.contractDuration = contractDuration;
        this.expectedRevenue = expectedRevenue;
        this.currentMonth = 1;
        this.reports = new ArrayList<>();
        this.totalExpected = BigInteger.ZERO;
        this.totalCollected = BigInteger.ZERO;
        this.totalLiabilityPaid = BigInteger.ZERO;
        this.roster = new LinkedHashMap<>();
        this.totalStake = BigInteger.ZERO;
        this.feeAmount = BigInteger.ZERO;
        this.feeDeposited = false;
        this.escrowDeposited = BigInteger.ZERO;
        this.escrowBalance = BigInteger.ZERO;
        this.feesDistributed = false;
        this.ownerDeposits = new TreeMap<>();
    }

    private VenueGuarantee(VenueGuarantee source) {
        this.venueId = source.venueId;
        this.roles = source.roles.copy();
        this.startTime = source.startTime;
        this.contractDuration = source.contractDuration;
        this.expectedRevenue = source.expectedRevenue;
        this.currentMonth = source.currentMonth;
        this.reports = new ArrayList<>();
        source.reports.forEach(report -> this.reports.add(report.copy()));
        this.totalExpected = source.totalExpected;
        this.totalCollected = source.totalCollected;
        this.totalLiabilityPaid = source.totalLiabilityPaid;
        this.roster = new LinkedHashMap<>();
        source.roster.forEach((address, entry) -> this.roster.put(address, entry.copy()));
        this.totalStake = source.totalStake;
        this.feeAmount = source.feeAmount;
        this.feeDeposited = source.feeDeposited;
        this.escrowDeposited = source.escrowDeposited;
        this.escrowBalance = source.escrowBalance;
        this.feesDistributed = source.feesDistributed;
        this.ownerDeposits = new TreeMap<>(source.ownerDeposits);
    }

    /**
     * Collateral account that holds this venue's fee escrow and acts as the
     * engine's identity towards the pool ledger.
     */
    public static String accountOf(String venueId) {
        return ACCOUNT_PREFIX + venueId;
    }

    public String getAccount() {
        return accountOf(venueId);
    }

    public Instant getMaturityTime() {
        return startTime.plus(contractDuration);
    }

    public boolean isMatured(Instant now) {
        return !now.isBefore(getMaturityTime());
    }

    public GuaranteePhase phaseAt(Instant now) {
        if (feesDistributed) {
            return GuaranteePhase.FEES_DISTRIBUTED;
        }
        if (isMatured(now)) {
            return GuaranteePhase.MATURED;
        }
        if (!reports.isEmpty() || feeDeposited) {
            return GuaranteePhase.REPORTING;
        }
        return GuaranteePhase.ASSEMBLING;
    }

    public boolean isAssembling() {
        return reports.isEmpty() && !feeDeposited;
    }

    public boolean hasUnderwriter(String underwriter) {
        return roster.containsKey(underwriter);
    }

    public Optional<GuaranteeUnderwriter> findUnderwriter(String underwriter) {
        return Optional.ofNullable(roster.get(underwriter));
    }

    public Collection<GuaranteeUnderwriter> getRoster() {
        return Collections.unmodifiableCollection(roster.values());
    }

    public List<MonthlyReport> getReports() {
        return Collections.unmodifiableList(reports);
    }

    public Map<Integer, BigInteger> getOwnerDeposits() {
        return Collections.unmodifiableMap(ownerDeposits);
    }

    public void addUnderwriter(String underwriter, BigInteger stake) {
        roster.put(underwriter, new GuaranteeUnderwriter(underwriter, stake));
        totalStake = totalStake.add(stake);
    }

    public void setFeeAmount(BigInteger amount) {
        feeAmount = amount;
    }

    public void depositFee() {
        feeDeposited = true;
        escrowDeposited = escrowDeposited.add(feeAmount);
        escrowBalance = escrowBalance.add(feeAmount);
    }

    public MonthlyReport submitReport(BigInteger actualRevenue, Instant timestamp) {
        MonthlyReport report = new MonthlyReport(currentMonth, expectedRevenue, actualRevenue, timestamp);
        reports.add(report);
        totalExpected = totalExpected.add(report.getExpectedRevenue());
        totalCollected = totalCollected.add(report.getActualRevenue());
        currentMonth++;
        return report;
    }

    public Optional<MonthlyReport> findReport(int month) {
        if (month < 1 || month > reports.size()) {
            return Optional.empty();
        }
        return Optional.of(reports.get(month - 1));
    }

    public void recordLiabilityPaid(MonthlyReport report) {
        report.markLiabilityPaid();
        totalLiabilityPaid = totalLiabilityPaid.add(report.getMissingRevenue());
    }

    public void recordOwnerDeposit(int month, BigInteger amount) {
        ownerDeposits.merge(month, amount, BigInteger::add);
    }

    /**
     * Gross fee share of an underwriter, floor of escrowDeposited * stake / totalStake.
     */
    public BigInteger grossFeeShare(GuaranteeUnderwriter underwriter) {
        if (totalStake.signum() == 0) {
            return BigInteger.ZERO;
        }
        return escrowDeposited.multiply(underwriter.getStake()).divide(totalStake);
    }

    public void recordFeePaid(GuaranteeUnderwriter underwriter, BigInteger gross) {
        underwriter.markFeeClaimed();
        escrowBalance = escrowBalance.subtract(gross);
        if (roster.values().stream().noneMatch(GuaranteeUnderwriter::isEligibleForFee)) {
            feesDistributed = true;
        }
    }

    public void markFeesDistributed() {
        feesDistributed = true;
    }

    public PerformanceSummary performanceSummary() {
        return new PerformanceSummary(totalExpected, totalCollected,
                totalExpected.subtract(totalCollected), totalLiabilityPaid);
    }

    public VenueGuarantee copy() {
        return new VenueGuarantee(this);
    }
}
