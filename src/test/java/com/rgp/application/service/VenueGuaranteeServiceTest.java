package com.rgp.application.service;

import com.rgp.adapter.out.persistence.InMemoryUnderwriterPersistenceAdapter;
import com.rgp.adapter.out.persistence.InMemoryVenueAssignmentPersistenceAdapter;
import com.rgp.adapter.out.persistence.InMemoryVenueGuaranteePersistenceAdapter;
import com.rgp.adapter.out.persistence.SnapshotUnitOfWork;
import com.rgp.adapter.out.registry.InMemoryRevenueVault;
import com.rgp.adapter.out.registry.InMemoryVenueRegistryAdapter;
import com.rgp.adapter.out.token.InMemoryCollateralTokenAdapter;
import com.rgp.application.port.in.UnderwriterPoolUseCase.AssignUnderwritersCommand;
import com.rgp.application.port.in.UnderwriterPoolUseCase.FeePayout;
import com.rgp.application.port.in.UnderwriterPoolUseCase.SettlementResult;
import com.rgp.application.port.in.VenueGuaranteeUseCase.GuaranteeView;
import com.rgp.application.port.in.VenueGuaranteeUseCase.ReportView;
import com.rgp.application.port.out.GuaranteeEventPublisher;
import com.rgp.domain.event.GuaranteeEventType;
import com.rgp.domain.exception.AuthorizationException;
import com.rgp.domain.exception.InsufficientResourceException;
import com.rgp.domain.exception.NoShortfallException;
import com.rgp.domain.exception.NotFoundException;
import com.rgp.domain.exception.NotVenueOwnerException;
import com.rgp.domain.exception.StateException;
import com.rgp.domain.exception.ValidationException;
import com.rgp.domain.model.GuaranteePhase;
import com.rgp.domain.model.PerformanceSummary;
import com.rgp.domain.model.ProtocolSettings;
import com.rgp.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verify;

/**
 * Unit test for VenueGuaranteeService
 * The engine runs on top of a real pool ledger so liability settlement is exercised end to end
 */
class VenueGuaranteeServiceTest {

    private static final String OWNER = "venue-owner";
    private static final String ADMIN = "admin";
    private static final String VENUE = "venue-1";
    private static final String UNASSIGNED_VENUE = "venue-2";
    private static final String TREASURY = ProtocolSettings.DEFAULT_TREASURY_ACCOUNT;

    @Mock
    private GuaranteeEventPublisher eventPublisher;

    private AutoCloseable mocks;
    private MutableClock clock;
    private InMemoryCollateralTokenAdapter token;
    private UnderwriterPoolService pool;
    private VenueGuaranteeService service;

    @BeforeEach
    void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        clock = new MutableClock(Instant.parse("2025-03-01T00:00:00Z"));

        token = new InMemoryCollateralTokenAdapter();
        token.mint("alice", amount(10_000));
        token.mint("bob", amount(10_000));
        token.mint(OWNER, amount(5_000));

        InMemoryVenueRegistryAdapter registry = new InMemoryVenueRegistryAdapter();
        registry.register(VENUE, OWNER, new InMemoryRevenueVault("vault-1", amount(900), 6));
        registry.register(UNASSIGNED_VENUE, OWNER, new InMemoryRevenueVault("vault-2", amount(500), 6));

        InMemoryUnderwriterPersistenceAdapter underwriterRepository = new InMemoryUnderwriterPersistenceAdapter();
        InMemoryVenueAssignmentPersistenceAdapter assignmentRepository = new InMemoryVenueAssignmentPersistenceAdapter();
        InMemoryVenueGuaranteePersistenceAdapter guaranteeRepository = new InMemoryVenueGuaranteePersistenceAdapter();
        SnapshotUnitOfWork unitOfWork = new SnapshotUnitOfWork()
                .enlist(underwriterRepository)
                .enlist(assignmentRepository)
                .enlist(guaranteeRepository)
                .enlist(token);
        CollateralTransfers transfers = new CollateralTransfers(token);
        GuaranteeValidator validator = new GuaranteeValidator();
        ProtocolSettings settings = ProtocolSettings.defaults();

        pool = new UnderwriterPoolService(underwriterRepository, assignmentRepository, registry, registry,
                transfers, unitOfWork, eventPublisher, validator, settings, clock);
        service = new VenueGuaranteeService(guaranteeRepository, pool, registry, registry,
                transfers, unitOfWork, eventPublisher, validator, settings, clock);

        pool.register("alice", amount(1_000));
        pool.register("bob", amount(1_000));
        pool.assignToVenue(OWNER, new AssignUnderwritersCommand(
                VENUE, List.of("alice", "bob"), List.of(amount(600), amount(300)), BigInteger.ZERO));
        service.openGuarantee(OWNER, VENUE, ADMIN);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (mocks != null) {
            mocks.close();
        }
    }

    @Test
    void openGuarantee_shouldStartAssemblingWithAdminAsOperator() {
        GuaranteeView view = service.guarantee(VENUE);

        assertEquals(ADMIN, view.admin());
        assertEquals(Set.of(ADMIN), view.operators());
        assertEquals(GuaranteePhase.ASSEMBLING, view.phase());
        assertEquals(1, view.currentMonth());
        assertEquals(amount(900), view.expectedRevenue());
        assertEquals(clock.instant().plus(Duration.ofDays(180)), view.maturityTime());
        verify(eventPublisher).publish(argThat(event -> event.getType() == GuaranteeEventType.GUARANTEE_OPENED
                && VENUE.equals(event.getVenueId())));
    }

    @Test
    void openGuarantee_shouldRejectDuplicatesStrangersAndUnknownVenues() {
        assertThrows(StateException.class, () -> service.openGuarantee(OWNER, VENUE, ADMIN));
        assertThrows(NotVenueOwnerException.class, () -> service.openGuarantee("alice", UNASSIGNED_VENUE, ADMIN));
        assertThrows(NotFoundException.class, () -> service.openGuarantee(OWNER, "unknown", ADMIN));
    }

    @Test
    void operators_shouldBeManagedByAdminOnly() {
        assertThrows(AuthorizationException.class, () -> service.addOperator("alice", VENUE, "ops"));

        service.addOperator(ADMIN, VENUE, "ops");
        assertTrue(service.guarantee(VENUE).operators().contains("ops"));
        assertThrows(StateException.class, () -> service.addOperator(ADMIN, VENUE, "ops"));

        assertThrows(ValidationException.class, () -> service.removeOperator(ADMIN, VENUE, ADMIN));
        assertThrows(NotFoundException.class, () -> service.removeOperator(ADMIN, VENUE, "nobody"));

        service.removeOperator(ADMIN, VENUE, "ops");
        assertThrows(AuthorizationException.class,
                () -> service.submitMonthlyReport("ops", VENUE, amount(900)));
    }

    @Test
    void addUnderwriter_shouldRequirePoolRegistrationAndOpenRoster() {
        assertThrows(AuthorizationException.class,
                () -> service.addUnderwriter(ADMIN, VENUE, "carol", amount(10)));
        assertThrows(AuthorizationException.class,
                () -> service.addUnderwriter("alice", VENUE, "alice", amount(10)));

        service.addUnderwriter(ADMIN, VENUE, "alice", amount(60));
        assertThrows(StateException.class, () -> service.addUnderwriter(ADMIN, VENUE, "alice", amount(60)));

        service.submitMonthlyReport(ADMIN, VENUE, amount(900));
        assertThrows(StateException.class, () -> service.addUnderwriter(ADMIN, VENUE, "bob", amount(40)));
    }

    @Test
    void depositFee_shouldMoveFeeIntoEscrowOnce() {
        assertThrows(ValidationException.class, () -> service.setFeeAmount(OWNER, VENUE, BigInteger.ZERO));
        assertThrows(NotVenueOwnerException.class, () -> service.setFeeAmount(ADMIN, VENUE, amount(100)));
        assertThrows(ValidationException.class, () -> service.depositFee(OWNER, VENUE));

        service.setFeeAmount(OWNER, VENUE, amount(100));
        assertThrows(StateException.class, () -> service.depositFee(OWNER, VENUE));

        service.addUnderwriter(ADMIN, VENUE, "alice", amount(60));
        service.depositFee(OWNER, VENUE);

        GuaranteeView view = service.guarantee(VENUE);
        assertEquals(amount(100), view.escrowBalance());
        assertEquals(GuaranteePhase.REPORTING, view.phase());
        assertEquals(amount(4_900), token.balanceOf(OWNER));
        assertEquals(amount(100), token.balanceOf("guarantee:" + VENUE));

        assertThrows(StateException.class, () -> service.depositFee(OWNER, VENUE));
        assertThrows(StateException.class, () -> service.setFeeAmount(OWNER, VENUE, amount(200)));
    }

    @Test
    void submitMonthlyReport_shouldAdvanceMonthAndComputeShortfall() {
        ReportView first = service.submitMonthlyReport(ADMIN, VENUE, amount(1_000));
        ReportView second = service.submitMonthlyReport(ADMIN, VENUE, amount(810));

        assertEquals(1, first.month());
        assertEquals(BigInteger.ZERO, first.missingRevenue());
        assertEquals(2, second.month());
        assertEquals(amount(90), second.missingRevenue());
        assertEquals(3, service.guarantee(VENUE).currentMonth());
        assertEquals(second, service.report(VENUE, 2));
        assertThrows(NotFoundException.class, () -> service.report(VENUE, 3));
        assertThrows(ValidationException.class, () -> service.submitMonthlyReport(ADMIN, VENUE, amount(-1)));

        PerformanceSummary summary = service.getPerformanceSummary(VENUE);
        assertEquals(amount(1_800), summary.totalExpected());
        assertEquals(amount(1_810), summary.totalCollected());
        assertEquals(amount(-10), summary.revenueGap());
    }

    @Test
    void processLiability_shouldSettleShortfallThroughPoolOnce() {
        service.submitMonthlyReport(ADMIN, VENUE, amount(900));
        service.submitMonthlyReport(ADMIN, VENUE, amount(810));

        SettlementResult result = service.processLiability(ADMIN, VENUE, 2);

        assertEquals(amount(90), result.settled());
        assertEquals(amount(540), pool.underwriter("alice").lockedStake());
        assertEquals(amount(270), pool.underwriter("bob").lockedStake());
        assertEquals(amount(90), token.balanceOf("vault-1"));
        assertTrue(service.report(VENUE, 2).liabilityPaid());
        assertEquals(amount(90), service.getPerformanceSummary(VENUE).totalLiabilityPaid());

        assertThrows(StateException.class, () -> service.processLiability(ADMIN, VENUE, 2));
        assertThrows(NoShortfallException.class, () -> service.processLiability(ADMIN, VENUE, 1));
        assertThrows(NotFoundException.class, () -> service.processLiability(ADMIN, VENUE, 5));
        assertThrows(AuthorizationException.class, () -> service.processLiability("alice", VENUE, 2));
        assertEquals(amount(540), pool.underwriter("alice").lockedStake());
    }

    @Test
    void processLiability_shouldRollBackWhenPoolRejectsSettlement() {
        service.openGuarantee(OWNER, UNASSIGNED_VENUE, ADMIN);
        service.submitMonthlyReport(ADMIN, UNASSIGNED_VENUE, amount(400));

        assertThrows(NotFoundException.class, () -> service.processLiability(ADMIN, UNASSIGNED_VENUE, 1));

        assertFalse(service.report(UNASSIGNED_VENUE, 1).liabilityPaid());
        assertEquals(BigInteger.ZERO, service.getPerformanceSummary(UNASSIGNED_VENUE).totalLiabilityPaid());
    }

    @Test
    void ownerDepositRevenue_shouldPayIntoVaultAndRecordMonth() {
        service.ownerDepositRevenue(OWNER, VENUE, 1, amount(200));
        service.ownerDepositRevenue(OWNER, VENUE, 1, amount(50));

        assertEquals(amount(250), token.balanceOf("vault-1"));
        assertEquals(Map.of(1, amount(250)), service.guarantee(VENUE).ownerDeposits());
        assertThrows(NotVenueOwnerException.class, () -> service.ownerDepositRevenue(ADMIN, VENUE, 1, amount(10)));
        assertThrows(ValidationException.class, () -> service.ownerDepositRevenue(OWNER, VENUE, 0, amount(10)));
    }

    @Test
    void distributeFees_shouldPayProportionallyMinusProtocolCut() {
        fundEscrow();

        List<FeePayout> payouts = service.distributeFees(ADMIN, VENUE);

        assertEquals(2, payouts.size());
        FeePayout alice = payouts.get(0);
        assertEquals("alice", alice.underwriter());
        assertEquals(amount(60), alice.grossShare());
        assertEquals(amount(3), alice.protocolCut());
        assertEquals(amount(57), alice.netShare());
        FeePayout bob = payouts.get(1);
        assertEquals(amount(40), bob.grossShare());
        assertEquals(amount(2), bob.protocolCut());
        assertEquals(amount(38), bob.netShare());

        assertEquals(amount(9_057), token.balanceOf("alice"));
        assertEquals(amount(9_038), token.balanceOf("bob"));
        assertEquals(amount(5), token.balanceOf(TREASURY));

        GuaranteeView view = service.guarantee(VENUE);
        assertTrue(view.feesDistributed());
        assertEquals(GuaranteePhase.FEES_DISTRIBUTED, view.phase());
        assertEquals(BigInteger.ZERO, view.escrowBalance());
        verify(eventPublisher).publish(argThat(event -> event.getType() == GuaranteeEventType.FEES_DISTRIBUTED));

        assertThrows(StateException.class, () -> service.distributeFees(ADMIN, VENUE));
        assertThrows(StateException.class, () -> service.submitMonthlyReport(ADMIN, VENUE, amount(900)));
    }

    @Test
    void processLiability_shouldRejectOutstandingShortfallAfterFeesDistributed() {
        fundEscrow();
        service.submitMonthlyReport(ADMIN, VENUE, amount(810));
        service.distributeFees(ADMIN, VENUE);

        assertThrows(StateException.class, () -> service.processLiability(ADMIN, VENUE, 1));

        assertFalse(service.report(VENUE, 1).liabilityPaid());
        assertEquals(BigInteger.ZERO, service.getPerformanceSummary(VENUE).totalLiabilityPaid());
        assertEquals(amount(600), pool.underwriter("alice").lockedStake());
        assertEquals(amount(300), pool.underwriter("bob").lockedStake());
        assertEquals(BigInteger.ZERO, token.balanceOf("vault-1"));
    }

    @Test
    void distributeFees_shouldRequireFundedEscrow() {
        service.addUnderwriter(ADMIN, VENUE, "alice", amount(60));

        assertThrows(InsufficientResourceException.class, () -> service.distributeFees(ADMIN, VENUE));
        assertFalse(service.guarantee(VENUE).feesDistributed());
    }

    @Test
    void claimFee_shouldPayIndividualShareAfterMaturity() {
        fundEscrow();

        assertThrows(StateException.class, () -> service.claimFee("alice", VENUE));
        clock.advance(Duration.ofDays(180));
        assertTrue(service.isMatured(VENUE));
        assertEquals(GuaranteePhase.MATURED, service.guarantee(VENUE).phase());

        FeePayout payout = service.claimFee("alice", VENUE);

        assertEquals(amount(57), payout.netShare());
        assertEquals(amount(40), service.guarantee(VENUE).escrowBalance());
        assertFalse(service.guarantee(VENUE).feesDistributed());
        assertThrows(StateException.class, () -> service.claimFee("alice", VENUE));
        assertThrows(AuthorizationException.class, () -> service.claimFee("carol", VENUE));

        service.claimFee("bob", VENUE);
        assertTrue(service.guarantee(VENUE).feesDistributed());
        assertThrows(StateException.class, () -> service.distributeFees(ADMIN, VENUE));
    }

    @Test
    void distributeFees_shouldSkipUnderwritersWhoAlreadyClaimed() {
        fundEscrow();
        clock.advance(Duration.ofDays(180));
        service.claimFee("alice", VENUE);

        List<FeePayout> payouts = service.distributeFees(ADMIN, VENUE);

        assertEquals(1, payouts.size());
        assertEquals("bob", payouts.get(0).underwriter());
        assertEquals(BigInteger.ZERO, service.guarantee(VENUE).escrowBalance());
    }

    private void fundEscrow() {
        service.addUnderwriter(ADMIN, VENUE, "alice", amount(60));
        service.addUnderwriter(ADMIN, VENUE, "bob", amount(40));
        service.setFeeAmount(OWNER, VENUE, amount(100));
        service.depositFee(OWNER, VENUE);
    }

    private static BigInteger amount(long value) {
        return BigInteger.valueOf(value);
    }
}
