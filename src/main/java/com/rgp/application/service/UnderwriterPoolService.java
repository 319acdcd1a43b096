package com.rgp.application.service;

import com.rgp.application.port.in.UnderwriterPoolUseCase;
import com.rgp.application.port.out.GuaranteeEventPublisher;
import com.rgp.application.port.out.RevenueVault;
import com.rgp.application.port.out.RevenueVaultProvider;
import com.rgp.application.port.out.UnderwriterRepository;
import com.rgp.application.port.out.UnitOfWork;
import com.rgp.application.port.out.VenueAssignmentRepository;
import com.rgp.application.port.out.VenueRegistry;
import com.rgp.domain.event.GuaranteeEvent;
import com.rgp.domain.event.GuaranteeEventType;
import com.rgp.domain.exception.AuthorizationException;
import com.rgp.domain.exception.InsufficientResourceException;
import com.rgp.domain.exception.NotFoundException;
import com.rgp.domain.exception.NotVenueOwnerException;
import com.rgp.domain.exception.StateException;
import com.rgp.domain.exception.ValidationException;
import com.rgp.domain.model.CommittedStake;
import com.rgp.domain.model.ProtocolSettings;
import com.rgp.domain.model.UnderwriterStake;
import com.rgp.domain.model.VenueAssignment;
import com.rgp.domain.model.VenueGuarantee;
import com.rgp.domain.model.VenueStakeKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * Application service implementing the underwriter pool ledger.
 * The only place underwriter stake triples change.
 */
@Slf4j
@RequiredArgsConstructor
public class UnderwriterPoolService implements UnderwriterPoolUseCase {

    private static final String POOL_SCOPE = "pool";

    private final UnderwriterRepository underwriterRepository;
    private final VenueAssignmentRepository assignmentRepository;
    private final VenueRegistry venueRegistry;
    private final RevenueVaultProvider vaultProvider;
    private final CollateralTransfers transfers;
    private final UnitOfWork unitOfWork;
    private final GuaranteeEventPublisher eventPublisher;
    private final GuaranteeValidator validator;
    private final ProtocolSettings settings;
    private final Clock clock;
    private final ReentrancyGuard guard = new ReentrancyGuard("underwriter pool");

    @Override
    public StakeView register(String caller, BigInteger amount) {
        validator.requireIdentity(caller, "caller");
        validator.requirePositive(amount, "amount");

        return transactional(() -> {
            UnderwriterStake stake = underwriterRepository.findByUnderwriter(caller)
                    .map(existing -> {
                        existing.deposit(amount);
                        return existing;
                    })
                    .orElseGet(() -> UnderwriterStake.open(caller, amount));
            underwriterRepository.save(stake);

            transfers.pull(caller, settings.getPoolAccount(), amount);

            publish(GuaranteeEvent.of(GuaranteeEventType.STAKE_REGISTERED, null, caller, amount, now()));
            log.info("Registered stake of {} for underwriter {} (total={}, available={}, locked={})",
                    amount, caller, stake.getTotalStake(), stake.getAvailableStake(), stake.getLockedStake());
            return toView(stake);
        });
    }

    @Override
    public AssignmentView assignToVenue(String caller, AssignUnderwritersCommand command) {
        validator.requireIdentity(caller, "caller");
        if (command == null) {
            throw new ValidationException("assignment command is required");
        }
        String venueId = command.venueId();
        validator.requireIdentity(venueId, "venueId");
        requireOwner(caller, venueId);

        return transactional(() -> {
            // Step 1: at most one assignment per venue
            if (assignmentRepository.exists(venueId)) {
                throw new StateException("Venue " + venueId + " already has an underwriting assignment");
            }

            // Step 2: input shape
            ValidationResult validation = validator.validate(command);
            if (validation.hasErrors()) {
                log.warn("Assignment for venue {} rejected: {}", venueId, validation.errors());
            }
            validation.throwIfInvalid();

            // Step 3: every underwriter registered with enough available stake
            List<UnderwriterStake> stakes = new ArrayList<>();
            BigInteger totalCommitted = BigInteger.ZERO;
            for (int i = 0; i < command.underwriters().size(); i++) {
                String underwriter = command.underwriters().get(i);
                BigInteger amount = command.amounts().get(i);
                UnderwriterStake stake = underwriterRepository.findByUnderwriter(underwriter)
                        .orElseThrow(() -> new AuthorizationException("Underwriter " + underwriter + " is not registered"));
                if (amount.compareTo(stake.getAvailableStake()) > 0) {
                    throw new InsufficientResourceException(String.format(
                            "Underwriter %s has %s available, %s requested", underwriter, stake.getAvailableStake(), amount));
                }
                stakes.add(stake);
                totalCommitted = totalCommitted.add(amount);
            }

            // Step 4: aggregate covers the promise
            RevenueVault vault = resolveVault(venueId);
            BigInteger promisedRevenue = vault.promisedRevenue();
            if (totalCommitted.compareTo(promisedRevenue) < 0) {
                throw new InsufficientResourceException(String.format(
                        "Committed stake %s is below promised revenue %s for venue %s", totalCommitted, promisedRevenue, venueId));
            }

            // Step 5: lock and record
            for (int i = 0; i < stakes.size(); i++) {
                UnderwriterStake stake = stakes.get(i);
                BigInteger amount = command.amounts().get(i);
                stake.lock(amount);
                underwriterRepository.save(stake);
                assignmentRepository.saveCommitment(new VenueStakeKey(venueId, stake.getUnderwriter()), new CommittedStake(amount));
                log.debug("Locked {} of underwriter {} for venue {}", amount, stake.getUnderwriter(), venueId);
            }

            Instant endDate = now().plus(settings.contractDuration(vault.totalMonths()));
            VenueAssignment assignment = new VenueAssignment(
                    venueId,
                    command.underwriters(),
                    totalCommitted,
                    command.fee(),
                    promisedRevenue,
                    endDate
            );
            assignmentRepository.save(assignment);

            transfers.pull(caller, settings.getPoolAccount(), command.fee());

            publish(GuaranteeEvent.of(GuaranteeEventType.UNDERWRITERS_ASSIGNED, venueId, caller, totalCommitted, now()));
            log.info("Assigned {} underwriters to venue {} (committed={}, fee={}, endDate={})",
                    stakes.size(), venueId, totalCommitted, command.fee(), endDate);
            return toView(assignment);
        });
    }

    @Override
    public SettlementResult settleLiability(String caller, String venueId, BigInteger missingAmount) {
        validator.requireIdentity(venueId, "venueId");
        validator.requirePositive(missingAmount, "missingAmount");
        if (!VenueGuarantee.accountOf(venueId).equals(caller)) {
            throw new AuthorizationException("Only the guarantee engine of venue " + venueId + " may settle liability");
        }

        return transactional(() -> {
            VenueAssignment assignment = requireAssignment(venueId);
            if (!assignment.isActive()) {
                throw new StateException("Assignment of venue " + venueId + " is no longer active");
            }
            String vaultAddress = requireVaultAddress(venueId);

            List<LiabilityShare> shares = new ArrayList<>();
            BigInteger settled = BigInteger.ZERO;
            for (String underwriter : assignment.getRoster()) {
                CommittedStake commitment = requireCommitment(venueId, underwriter);
                BigInteger share = missingAmount.multiply(commitment.getCommitted())
                        .divide(assignment.getTotalStakeCommitted());

                if (share.compareTo(commitment.getRemaining()) > 0) {
                    throw new InsufficientResourceException(String.format(
                            "Share %s of underwriter %s exceeds remaining commitment %s at venue %s",
                            share, underwriter, commitment.getRemaining(), venueId));
                }

                UnderwriterStake stake = requireStake(underwriter);
                stake.forfeit(share);
                commitment.recordForfeit(share);
                underwriterRepository.save(stake);
                assignmentRepository.saveCommitment(new VenueStakeKey(venueId, underwriter), commitment);

                transfers.push(settings.getPoolAccount(), vaultAddress, share);

                log.debug("Underwriter {} covers {} of {} for venue {}", underwriter, share, missingAmount, venueId);
                shares.add(new LiabilityShare(underwriter, share));
                settled = settled.add(share);
            }

            assignment.recordSettlement(missingAmount, settled);
            assignmentRepository.save(assignment);

            BigInteger residual = missingAmount.subtract(settled);
            publish(GuaranteeEvent.of(GuaranteeEventType.LIABILITY_SETTLED, venueId, vaultAddress, settled, now()));
            log.info("Settled liability of {} for venue {}: {} forwarded to vault {}, residual {}",
                    missingAmount, venueId, settled, vaultAddress, residual);
            return new SettlementResult(venueId, missingAmount, List.copyOf(shares), settled, residual);
        });
    }

    @Override
    public FeePayout claimFee(String caller, String venueId) {
        validator.requireIdentity(caller, "caller");
        validator.requireIdentity(venueId, "venueId");

        return transactional(() -> {
            VenueAssignment assignment = requireAssignment(venueId);
            if (!assignment.isMatured(now())) {
                throw new StateException("Venue " + venueId + " matures at " + assignment.getEndDate());
            }
            VenueStakeKey key = new VenueStakeKey(venueId, caller);
            CommittedStake commitment = assignmentRepository.findCommitment(key)
                    .orElseThrow(() -> new AuthorizationException(caller + " is not on the roster of venue " + venueId));
            if (commitment.isFeeClaimed()) {
                throw new StateException(caller + " already claimed the fee of venue " + venueId);
            }

            BigInteger released = commitment.getRemaining();
            UnderwriterStake stake = requireStake(caller);
            stake.release(released);
            underwriterRepository.save(stake);

            BigInteger gross = assignment.getFee().multiply(commitment.getCommitted())
                    .divide(assignment.getTotalStakeCommitted());
            BigInteger cut = settings.protocolCut(gross);
            BigInteger net = gross.subtract(cut);

            commitment.markFeeClaimed();
            assignmentRepository.saveCommitment(key, commitment);
            assignment.recordFeePaid(gross);
            if (allClaimed(assignment)) {
                assignment.deactivate();
                log.info("All underwriters of venue {} claimed, assignment closed", venueId);
            }
            assignmentRepository.save(assignment);

            transfers.push(settings.getPoolAccount(), caller, net);
            transfers.push(settings.getPoolAccount(), settings.getTreasuryAccount(), cut);

            publish(GuaranteeEvent.of(GuaranteeEventType.ASSIGNMENT_FEE_CLAIMED, venueId, caller, net, now()));
            log.info("Underwriter {} claimed fee {} (cut {}) and released {} at venue {}",
                    caller, net, cut, released, venueId);
            return new FeePayout(caller, gross, cut, net, released);
        });
    }

    @Override
    public StakeView withdraw(String caller, BigInteger amount) {
        validator.requireIdentity(caller, "caller");
        validator.requirePositive(amount, "amount");

        return transactional(() -> {
            UnderwriterStake stake = underwriterRepository.findByUnderwriter(caller)
                    .orElseThrow(() -> new AuthorizationException("Underwriter " + caller + " is not registered"));
            stake.withdraw(amount);
            underwriterRepository.save(stake);

            transfers.push(settings.getPoolAccount(), caller, amount);

            publish(GuaranteeEvent.of(GuaranteeEventType.STAKE_WITHDRAWN, null, caller, amount, now()));
            log.info("Underwriter {} withdrew {} (available now {})", caller, amount, stake.getAvailableStake());
            return toView(stake);
        });
    }

    @Override
    public StakeView underwriter(String underwriter) {
        return toView(requireStake(underwriter));
    }

    @Override
    public boolean isRegistered(String underwriter) {
        return underwriter != null && underwriterRepository.exists(underwriter);
    }

    @Override
    public BigInteger stakeOf(String venueId, String underwriter) {
        return assignmentRepository.findCommitment(new VenueStakeKey(venueId, underwriter))
                .map(CommittedStake::getRemaining)
                .orElse(BigInteger.ZERO);
    }

    @Override
    public List<String> rosterOf(String venueId) {
        return assignmentRepository.findByVenueId(venueId)
                .map(VenueAssignment::getRoster)
                .orElse(Collections.emptyList());
    }

    @Override
    public AssignmentView assignment(String venueId) {
        return toView(requireAssignment(venueId));
    }

    @Override
    public boolean isMatured(String venueId) {
        return requireAssignment(venueId).isMatured(now());
    }

    private <T> T transactional(Supplier<T> work) {
        return guard.guard(POOL_SCOPE, () -> unitOfWork.execute(work));
    }

    private void requireOwner(String caller, String venueId) {
        if (!venueRegistry.venueExists(venueId)) {
            throw new NotFoundException("Venue not found: " + venueId);
        }
        if (!caller.equals(venueRegistry.ownerOf(venueId))) {
            throw new NotVenueOwnerException(venueId, caller);
        }
    }

    private RevenueVault resolveVault(String venueId) {
        String address = requireVaultAddress(venueId);
        return vaultProvider.vaultAt(address)
                .orElseThrow(() -> new NotFoundException("Revenue vault not found: " + address));
    }

    private String requireVaultAddress(String venueId) {
        String address = venueRegistry.vaultAddressOf(venueId);
        if (address == null) {
            throw new NotFoundException("No revenue vault registered for venue " + venueId);
        }
        return address;
    }

    private VenueAssignment requireAssignment(String venueId) {
        return assignmentRepository.findByVenueId(venueId)
                .orElseThrow(() -> new NotFoundException("No underwriting assignment for venue " + venueId));
    }

    private CommittedStake requireCommitment(String venueId, String underwriter) {
        return assignmentRepository.findCommitment(new VenueStakeKey(venueId, underwriter))
                .orElseThrow(() -> new NotFoundException(
                        "No commitment of underwriter " + underwriter + " at venue " + venueId));
    }

    private UnderwriterStake requireStake(String underwriter) {
        return underwriterRepository.findByUnderwriter(underwriter)
                .orElseThrow(() -> new NotFoundException("Underwriter not found: " + underwriter));
    }

    private boolean allClaimed(VenueAssignment assignment) {
        return assignment.getRoster().stream()
                .map(underwriter -> assignmentRepository.findCommitment(new VenueStakeKey(assignment.getVenueId(), underwriter)))
                .allMatch(commitment -> commitment.map(CommittedStake::isFeeClaimed).orElse(true));
    }

    private void publish(GuaranteeEvent event) {
        unitOfWork.afterCommit(() -> eventPublisher.publish(event));
    }

    private Instant now() {
        return clock.instant();
    }

    private StakeView toView(UnderwriterStake stake) {
        return new StakeView(stake.getUnderwriter(), stake.getTotalStake(), stake.getAvailableStake(), stake.getLockedStake());
    }

    private AssignmentView toView(VenueAssignment assignment) {
        List<CommitmentView> roster = new ArrayList<>();
        for (String underwriter : assignment.getRoster()) {
            CommittedStake commitment = requireCommitment(assignment.getVenueId(), underwriter);
            roster.add(new CommitmentView(underwriter, commitment.getCommitted(), commitment.getForfeited(),
                    commitment.getRemaining(), commitment.isFeeClaimed()));
        }
        return new AssignmentView(
                assignment.getVenueId(),
                List.copyOf(roster),
                assignment.getTotalStakeCommitted(),
                assignment.getFee(),
                assignment.getPromisedRevenue(),
                assignment.getEndDate(),
                assignment.isActive(),
                assignment.isMatured(now()),
                assignment.getSettledTotal(),
                assignment.getUnsettledResidual(),
                assignment.getFeePaidOut()
        );
    }
}
