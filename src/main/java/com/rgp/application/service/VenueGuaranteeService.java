package com.rgp.application.service;

import com.rgp.application.port.in.UnderwriterPoolUseCase;
import com.rgp.application.port.in.UnderwriterPoolUseCase.FeePayout;
import com.rgp.application.port.in.UnderwriterPoolUseCase.SettlementResult;
import com.rgp.application.port.in.VenueGuaranteeUseCase;
import com.rgp.application.port.out.GuaranteeEventPublisher;
import com.rgp.application.port.out.RevenueVault;
import com.rgp.application.port.out.RevenueVaultProvider;
import com.rgp.application.port.out.UnitOfWork;
import com.rgp.application.port.out.VenueGuaranteeRepository;
import com.rgp.application.port.out.VenueRegistry;
import com.rgp.domain.event.GuaranteeEvent;
import com.rgp.domain.event.GuaranteeEventType;
import com.rgp.domain.exception.AuthorizationException;
import com.rgp.domain.exception.InsufficientResourceException;
import com.rgp.domain.exception.NoShortfallException;
import com.rgp.domain.exception.NotFoundException;
import com.rgp.domain.exception.NotVenueOwnerException;
import com.rgp.domain.exception.StateException;
import com.rgp.domain.exception.ValidationException;
import com.rgp.domain.model.GuaranteeUnderwriter;
import com.rgp.domain.model.MonthlyReport;
import com.rgp.domain.model.PerformanceSummary;
import com.rgp.domain.model.ProtocolSettings;
import com.rgp.domain.model.VenueGuarantee;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Application service implementing the per-venue guarantee engine.
 * Liability settlement is delegated to the underwriter pool.
 */
@Slf4j
@RequiredArgsConstructor
public class VenueGuaranteeService implements VenueGuaranteeUseCase {

    private final VenueGuaranteeRepository guaranteeRepository;
    private final UnderwriterPoolUseCase underwriterPool;
    private final VenueRegistry venueRegistry;
    private final RevenueVaultProvider vaultProvider;
    private final CollateralTransfers transfers;
    private final UnitOfWork unitOfWork;
    private final GuaranteeEventPublisher eventPublisher;
    private final GuaranteeValidator validator;
    private final ProtocolSettings settings;
    private final Clock clock;
    private final ReentrancyGuard guard = new ReentrancyGuard("guarantee engine");

    @Override
    public GuaranteeView openGuarantee(String caller, String venueId, String admin) {
        validator.requireIdentity(caller, "caller");
        validator.requireIdentity(venueId, "venueId");
        validator.requireIdentity(admin, "admin");
        requireOwner(caller, venueId);

        return guard.guard(venueId, () -> unitOfWork.execute(() -> {
            if (guaranteeRepository.exists(venueId)) {
                throw new StateException("Guarantee for venue " + venueId + " is already open");
            }
            RevenueVault vault = resolveVault(venueId);
            VenueGuarantee guarantee = new VenueGuarantee(
                    venueId,
                    admin,
                    now(),
                    settings.contractDuration(vault.totalMonths()),
                    vault.promisedRevenue()
            );
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.GUARANTEE_OPENED, venueId, admin, vault.promisedRevenue(), now()));
            log.info("Opened guarantee for venue {} (admin={}, expectedRevenue={}, matures at {})",
                    venueId, admin, vault.promisedRevenue(), guarantee.getMaturityTime());
            return toView(guarantee);
        }));
    }

    @Override
    public void addOperator(String caller, String venueId, String operator) {
        validator.requireIdentity(operator, "operator");

        inGuarantee(venueId, guarantee -> {
            requireAdmin(caller, guarantee);
            if (!guarantee.getRoles().addOperator(operator)) {
                throw new StateException(operator + " is already an operator of venue " + venueId);
            }
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.OPERATOR_ADDED, venueId, operator, BigInteger.ZERO, now()));
            log.info("Operator {} added to venue {}", operator, venueId);
            return null;
        });
    }

    @Override
    public void removeOperator(String caller, String venueId, String operator) {
        validator.requireIdentity(operator, "operator");

        inGuarantee(venueId, guarantee -> {
            requireAdmin(caller, guarantee);
            if (guarantee.getRoles().isAdmin(operator)) {
                throw new ValidationException("The admin cannot be removed from the operators");
            }
            if (!guarantee.getRoles().removeOperator(operator)) {
                throw new NotFoundException(operator + " is not an operator of venue " + venueId);
            }
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.OPERATOR_REMOVED, venueId, operator, BigInteger.ZERO, now()));
            log.info("Operator {} removed from venue {}", operator, venueId);
            return null;
        });
    }

    @Override
    public void setFeeAmount(String caller, String venueId, BigInteger amount) {
        validator.requirePositive(amount, "amount");

        inGuarantee(venueId, guarantee -> {
            requireOwner(caller, venueId);
            if (guarantee.isFeeDeposited()) {
                throw new StateException("Fee of venue " + venueId + " is already in escrow");
            }
            guarantee.setFeeAmount(amount);
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.FEE_AMOUNT_SET, venueId, caller, amount, now()));
            log.info("Fee amount of venue {} set to {}", venueId, amount);
            return null;
        });
    }

    @Override
    public void addUnderwriter(String caller, String venueId, String underwriter, BigInteger stake) {
        validator.requireIdentity(underwriter, "underwriter");
        validator.requirePositive(stake, "stake");

        inGuarantee(venueId, guarantee -> {
            requireOperator(caller, guarantee);
            if (!underwriterPool.isRegistered(underwriter)) {
                throw new AuthorizationException("Underwriter " + underwriter + " is not registered in the pool");
            }
            if (guarantee.hasUnderwriter(underwriter)) {
                throw new StateException("Underwriter " + underwriter + " is already on the roster of venue " + venueId);
            }
            if (!guarantee.isAssembling()) {
                throw new StateException("Roster of venue " + venueId + " is closed");
            }
            guarantee.addUnderwriter(underwriter, stake);
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.UNDERWRITER_ADDED, venueId, underwriter, stake, now()));
            log.info("Underwriter {} added to venue {} with stake {} (total {})",
                    underwriter, venueId, stake, guarantee.getTotalStake());
            return null;
        });
    }

    @Override
    public void depositFee(String caller, String venueId) {
        inGuarantee(venueId, guarantee -> {
            requireOwner(caller, venueId);
            if (guarantee.isFeeDeposited()) {
                throw new StateException("Fee of venue " + venueId + " is already in escrow");
            }
            if (guarantee.getFeeAmount().signum() == 0) {
                throw new ValidationException("Fee amount of venue " + venueId + " is not set");
            }
            if (guarantee.getRoster().isEmpty()) {
                throw new StateException("Venue " + venueId + " has no underwriters");
            }

            transfers.pull(caller, guarantee.getAccount(), guarantee.getFeeAmount());
            guarantee.depositFee();
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.FEE_DEPOSITED, venueId, caller, guarantee.getFeeAmount(), now()));
            log.info("Fee {} deposited into escrow of venue {}", guarantee.getFeeAmount(), venueId);
            return null;
        });
    }

    @Override
    public ReportView submitMonthlyReport(String caller, String venueId, BigInteger actualRevenue) {
        validator.requireNonNegative(actualRevenue, "actualRevenue");

        return inGuarantee(venueId, guarantee -> {
            requireOperator(caller, guarantee);
            requireNotDistributed(guarantee);

            MonthlyReport report = guarantee.submitReport(actualRevenue, now());
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.forMonth(GuaranteeEventType.REPORT_SUBMITTED, venueId, caller,
                    actualRevenue, report.getMonth(), now()));
            log.info("Venue {} month {}: expected={}, actual={}, missing={}", venueId, report.getMonth(),
                    report.getExpectedRevenue(), report.getActualRevenue(), report.getMissingRevenue());
            return toView(report);
        });
    }

    @Override
    public SettlementResult processLiability(String caller, String venueId, int month) {
        return inGuarantee(venueId, guarantee -> {
            requireOperator(caller, guarantee);
            requireNotDistributed(guarantee);

            MonthlyReport report = guarantee.findReport(month)
                    .orElseThrow(() -> new NotFoundException("No report for venue " + venueId + " month " + month));
            if (!report.hasShortfall()) {
                throw new NoShortfallException(venueId, month);
            }
            if (report.isLiabilityPaid()) {
                throw new StateException("Liability of venue " + venueId + " month " + month + " is already paid");
            }

            guarantee.recordLiabilityPaid(report);
            guaranteeRepository.save(guarantee);

            SettlementResult result = underwriterPool.settleLiability(
                    guarantee.getAccount(), venueId, report.getMissingRevenue());

            publish(GuaranteeEvent.forMonth(GuaranteeEventType.LIABILITY_PROCESSED, venueId, caller,
                    report.getMissingRevenue(), month, now()));
            log.info("Processed liability of venue {} month {}: missing={}, settled={}",
                    venueId, month, report.getMissingRevenue(), result.settled());
            return result;
        });
    }

    @Override
    public void ownerDepositRevenue(String caller, String venueId, int month, BigInteger amount) {
        validator.requireMonth(month);
        validator.requirePositive(amount, "amount");

        inGuarantee(venueId, guarantee -> {
            requireOwner(caller, venueId);
            String vaultAddress = venueRegistry.vaultAddressOf(venueId);
            if (vaultAddress == null) {
                throw new NotFoundException("No revenue vault registered for venue " + venueId);
            }

            transfers.pull(caller, vaultAddress, amount);
            guarantee.recordOwnerDeposit(month, amount);
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.forMonth(GuaranteeEventType.OWNER_REVENUE_DEPOSITED, venueId, caller,
                    amount, month, now()));
            log.info("Owner of venue {} deposited {} for month {} into vault {}", venueId, amount, month, vaultAddress);
            return null;
        });
    }

    @Override
    public List<FeePayout> distributeFees(String caller, String venueId) {
        return inGuarantee(venueId, guarantee -> {
            requireOperator(caller, guarantee);
            if (guarantee.isFeesDistributed()) {
                throw new StateException("Fees of venue " + venueId + " were already distributed");
            }
            if (guarantee.getEscrowBalance().signum() == 0) {
                throw new InsufficientResourceException("Escrow of venue " + venueId + " is empty");
            }

            List<FeePayout> payouts = new ArrayList<>();
            for (GuaranteeUnderwriter underwriter : List.copyOf(guarantee.getRoster())) {
                if (underwriter.isEligibleForFee()) {
                    payouts.add(payFee(guarantee, underwriter));
                }
            }
            guarantee.markFeesDistributed();
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.FEES_DISTRIBUTED, venueId, caller,
                    guarantee.getEscrowDeposited().subtract(guarantee.getEscrowBalance()), now()));
            log.info("Distributed fees of venue {} to {} underwriters, escrow residual {}",
                    venueId, payouts.size(), guarantee.getEscrowBalance());
            return List.copyOf(payouts);
        });
    }

    @Override
    public FeePayout claimFee(String caller, String venueId) {
        return inGuarantee(venueId, guarantee -> {
            GuaranteeUnderwriter underwriter = guarantee.findUnderwriter(caller)
                    .filter(GuaranteeUnderwriter::isApproved)
                    .orElseThrow(() -> new AuthorizationException(caller + " is not an approved underwriter of venue " + venueId));
            if (underwriter.isFeeClaimed()) {
                throw new StateException(caller + " already claimed the fee of venue " + venueId);
            }
            if (!guarantee.isMatured(now())) {
                throw new StateException("Venue " + venueId + " matures at " + guarantee.getMaturityTime());
            }
            if (guarantee.getEscrowBalance().signum() == 0) {
                throw new InsufficientResourceException("Escrow of venue " + venueId + " is empty");
            }

            FeePayout payout = payFee(guarantee, underwriter);
            guaranteeRepository.save(guarantee);

            publish(GuaranteeEvent.of(GuaranteeEventType.FEE_CLAIMED, venueId, caller, payout.netShare(), now()));
            if (guarantee.isFeesDistributed()) {
                log.info("Last fee share of venue {} claimed", venueId);
            }
            return payout;
        });
    }

    @Override
    public PerformanceSummary getPerformanceSummary(String venueId) {
        return requireGuarantee(venueId).performanceSummary();
    }

    @Override
    public ReportView report(String venueId, int month) {
        return requireGuarantee(venueId).findReport(month)
                .map(this::toView)
                .orElseThrow(() -> new NotFoundException("No report for venue " + venueId + " month " + month));
    }

    @Override
    public GuaranteeView guarantee(String venueId) {
        return toView(requireGuarantee(venueId));
    }

    @Override
    public boolean isMatured(String venueId) {
        return requireGuarantee(venueId).isMatured(now());
    }

    /**
     * Run work against one venue's engine: re-entrancy guarded, inside one unit of work.
     */
    private <T> T inGuarantee(String venueId, Function<VenueGuarantee, T> work) {
        validator.requireIdentity(venueId, "venueId");
        return guard.guard(venueId, () -> unitOfWork.execute(() -> work.apply(requireGuarantee(venueId))));
    }

    private FeePayout payFee(VenueGuarantee guarantee, GuaranteeUnderwriter underwriter) {
        BigInteger gross = guarantee.grossFeeShare(underwriter);
        BigInteger cut = settings.protocolCut(gross);
        BigInteger net = gross.subtract(cut);

        guarantee.recordFeePaid(underwriter, gross);
        transfers.push(guarantee.getAccount(), underwriter.getUnderwriter(), net);
        transfers.push(guarantee.getAccount(), settings.getTreasuryAccount(), cut);

        log.debug("Fee share of {} at venue {}: gross={}, cut={}, net={}",
                underwriter.getUnderwriter(), guarantee.getVenueId(), gross, cut, net);
        return new FeePayout(underwriter.getUnderwriter(), gross, cut, net, BigInteger.ZERO);
    }

    private VenueGuarantee requireGuarantee(String venueId) {
        return guaranteeRepository.findByVenueId(venueId)
                .orElseThrow(() -> new NotFoundException("No guarantee for venue " + venueId));
    }

    private RevenueVault resolveVault(String venueId) {
        String address = venueRegistry.vaultAddressOf(venueId);
        if (address == null) {
            throw new NotFoundException("No revenue vault registered for venue " + venueId);
        }
        return vaultProvider.vaultAt(address)
                .orElseThrow(() -> new NotFoundException("Revenue vault not found: " + address));
    }

    private void requireOwner(String caller, String venueId) {
        if (!venueRegistry.venueExists(venueId)) {
            throw new NotFoundException("Venue not found: " + venueId);
        }
        if (caller == null || !caller.equals(venueRegistry.ownerOf(venueId))) {
            throw new NotVenueOwnerException(venueId, caller);
        }
    }

    private void requireAdmin(String caller, VenueGuarantee guarantee) {
        if (!guarantee.getRoles().isAdmin(caller)) {
            throw new AuthorizationException("Caller " + caller + " is not the admin of venue " + guarantee.getVenueId());
        }
    }

    private void requireOperator(String caller, VenueGuarantee guarantee) {
        if (!guarantee.getRoles().isOperator(caller)) {
            throw new AuthorizationException("Caller " + caller + " is not an operator of venue " + guarantee.getVenueId());
        }
    }

    private void requireNotDistributed(VenueGuarantee guarantee) {
        if (guarantee.isFeesDistributed()) {
            throw new StateException("Guarantee of venue " + guarantee.getVenueId() + " is closed, fees were distributed");
        }
    }

    private void publish(GuaranteeEvent event) {
        unitOfWork.afterCommit(() -> eventPublisher.publish(event));
    }

    private Instant now() {
        return clock.instant();
    }

    private ReportView toView(MonthlyReport report) {
        return new ReportView(
                report.getMonth(),
                report.getExpectedRevenue(),
                report.getActualRevenue(),
                report.getMissingRevenue(),
                report.isLiabilityPaid(),
                report.getTimestamp()
        );
    }

    private GuaranteeView toView(VenueGuarantee guarantee) {
        List<RosterEntryView> roster = guarantee.getRoster().stream()
                .map(entry -> new RosterEntryView(entry.getUnderwriter(), entry.getStake(), entry.isApproved(), entry.isFeeClaimed()))
                .toList();
        return new GuaranteeView(
                guarantee.getVenueId(),
                guarantee.getRoles().getAdmin(),
                Set.copyOf(guarantee.getRoles().getOperators()),
                guarantee.phaseAt(now()),
                guarantee.getCurrentMonth(),
                guarantee.getExpectedRevenue(),
                guarantee.getMaturityTime(),
                roster,
                guarantee.getTotalStake(),
                guarantee.getFeeAmount(),
                guarantee.getEscrowBalance(),
                guarantee.isFeesDistributed(),
                Map.copyOf(guarantee.getOwnerDeposits())
        );
    }
}
