package com.work.escrow.core.claim;

import com.work.escrow.core.chain.ChainErrorKind;
import com.work.escrow.core.chain.ChainSubmissionException;
import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.exception.ChainRejectionException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.StaleChainViewException;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.OnChainMilestone;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;
import com.work.escrow.core.result.OperationResult;
import com.work.escrow.core.result.Outcome;
import com.work.escrow.core.support.EscrowFixture;
import com.work.escrow.core.support.InMemoryLedgerStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static com.work.escrow.core.support.EscrowFixture.FREELANCER;
import static com.work.escrow.core.support.EscrowFixture.RECRUITER;
import static com.work.escrow.core.support.EscrowFixture.SOL;
import static com.work.escrow.core.support.EscrowFixture.freelancer;
import static com.work.escrow.core.support.EscrowFixture.recruiter;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ClaimCoordinatorTest {

    private static List<TransactionRecord> payments(EscrowFixture f, String jobId) {
        return f.ledger.listTransactions(jobId).stream()
                .filter(t -> t.getType() == TransactionType.PAYMENT)
                .collect(Collectors.toList());
    }

    private static EscrowFixture approvedStageOne() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        f.approvals.approve("job1", 0, null, recruiter());
        return f;
    }

    @Test
    public void claim_approved_stage_pays_freelancer() {
        EscrowFixture f = approvedStageOne();

        OperationResult r = f.claims.claim("job1", 0, freelancer());

        assertEquals(Outcome.APPLIED, r.getOutcome());
        Milestone m = f.milestone("job1", 1);
        assertEquals(MilestoneStatus.CLAIMED, m.getStatus());
        assertTrue(m.isPaymentReleased());
        List<TransactionRecord> payments = payments(f, "job1");
        assertEquals(1, payments.size());
        assertEquals(SOL, payments.get(0).getAmount());
        assertEquals(FREELANCER, payments.get(0).getToWallet());
        assertEquals(r.getSignature(), payments.get(0).getSignature());
        assertFalse(payments.get(0).isSynthetic());
        assertEquals(2 * SOL, f.chain.readAccount("job1").get().getStakedBalance());
        assertEquals(JobStatus.ACTIVE, f.job("job1").getStatus());
    }

    @Test
    public void applied_result_carries_balance_after_claim() {
        EscrowFixture f = approvedStageOne();

        OperationResult r = f.claims.claim("job1", 0, freelancer());

        assertEquals(2 * SOL, r.getView().getStakedBalance());
        assertTrue(r.getView().stage(0).isClaimed());
        assertEquals(0L, r.getView().claimableAmount());
    }

    @Test
    public void failed_payment_write_is_replayed_with_chain_signature() {
        LedgerStore ledger = spy(new InMemoryLedgerStore());
        EscrowFixture f = new EscrowFixture(null, ledger, null, null);
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        f.approvals.approve("job1", 0, null, recruiter());
        doThrow(new IllegalStateException("ledger unavailable"))
                .doCallRealMethod()
                .when(ledger).appendTransaction(argThat(t -> t.getType() == TransactionType.PAYMENT));

        OperationResult r = f.claims.claim("job1", 0, freelancer());

        assertTrue(r.isMirrorLagging());
        assertTrue(payments(f, "job1").isEmpty());
        assertFalse(f.milestone("job1", 1).isPaymentReleased());

        f.engine.reconcile("job1");

        List<TransactionRecord> payments = payments(f, "job1");
        assertEquals(1, payments.size());
        assertEquals(r.getSignature(), payments.get(0).getSignature());
        assertFalse(payments.get(0).isSynthetic());
        assertTrue(f.milestone("job1", 1).isPaymentReleased());
        assertEquals(MilestoneStatus.CLAIMED, f.milestone("job1", 1).getStatus());
    }

    @Test
    public void claim_before_approval_never_reaches_chain() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.claims.claim("job1", 0, freelancer()));

        assertEquals(GuardViolation.NOT_APPROVED, e.getReason());
        assertEquals(0, f.chain.getClaimSubmissions());
        assertTrue(payments(f, "job1").isEmpty());
    }

    @Test
    public void only_chain_freelancer_can_claim() {
        EscrowFixture f = approvedStageOne();

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.claims.claim("job1", 0, recruiter()));

        assertEquals(GuardViolation.NOT_FREELANCER, e.getReason());
        assertEquals(0, f.chain.getClaimSubmissions());
    }

    @Test
    public void second_claim_converges() {
        EscrowFixture f = approvedStageOne();
        f.claims.claim("job1", 0, freelancer());

        OperationResult again = f.claims.claim("job1", 0, freelancer());

        assertEquals(Outcome.CONVERGED, again.getOutcome());
        assertEquals(ClaimCoordinator.REASON_ALREADY_CLAIMED, again.getReason());
        assertEquals(1, f.chain.getClaimSubmissions());
        assertEquals(1, payments(f, "job1").size());
    }

    @Test
    public void claiming_last_stage_completes_job() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL);
        f.markSubmitted("job1", 1);
        f.approvals.approve("job1", 0, null, recruiter());

        f.claims.claim("job1", 0, freelancer());

        assertEquals(JobStatus.COMPLETED, f.job("job1").getStatus());
    }

    @Test
    public void chain_not_approved_means_stale_view() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        Milestone m = f.milestone("job1", 1);
        m.setStatus(MilestoneStatus.APPROVED);
        f.ledger.saveMilestone(m);
        when(client.readAccount("job1")).thenReturn(Optional.of(view(true, false)));
        when(client.submitClaim(eq("job1"), eq(0), any()))
                .thenThrow(new ChainSubmissionException(ChainErrorKind.NOT_APPROVED, "MilestoneNotApproved"));

        assertThrows(StaleChainViewException.class, () -> f.claims.claim("job1", 0, freelancer()));
        verify(client, times(1)).submitClaim(eq("job1"), eq(0), any());
        assertFalse(f.milestone("job1", 1).isPaymentReleased());
    }

    @Test
    public void chain_already_claimed_converges_with_single_payment() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        Milestone m = f.milestone("job1", 1);
        m.setStatus(MilestoneStatus.APPROVED);
        f.ledger.saveMilestone(m);
        when(client.readAccount("job1")).thenReturn(
                Optional.of(view(true, false)),
                Optional.of(view(true, true)));
        when(client.submitClaim(eq("job1"), eq(0), any()))
                .thenThrow(new ChainSubmissionException(ChainErrorKind.ALREADY_CLAIMED, "MilestoneAlreadyClaimed"));

        OperationResult r = f.claims.claim("job1", 0, freelancer());

        assertEquals(Outcome.CONVERGED, r.getOutcome());
        assertEquals(1, payments(f, "job1").size());
        assertTrue(payments(f, "job1").get(0).isSynthetic());
        assertTrue(f.milestone("job1", 1).isPaymentReleased());
    }

    @Test
    public void insufficient_funds_is_rejection() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        Milestone m = f.milestone("job1", 1);
        m.setStatus(MilestoneStatus.APPROVED);
        f.ledger.saveMilestone(m);
        when(client.readAccount("job1")).thenReturn(Optional.of(view(true, false)));
        when(client.submitClaim(eq("job1"), eq(0), any()))
                .thenThrow(new ChainSubmissionException(ChainErrorKind.INSUFFICIENT_FUNDS, "InsufficientEscrowBalance"));

        ChainRejectionException e = assertThrows(ChainRejectionException.class,
                () -> f.claims.claim("job1", 0, freelancer()));
        assertEquals(ChainErrorKind.INSUFFICIENT_FUNDS, e.getKind());
    }

    private static EscrowAccountView view(boolean firstApproved, boolean firstClaimed) {
        long balance = firstClaimed ? 2 * SOL : 3 * SOL;
        return new EscrowAccountView("job1", "escrow1", balance, RECRUITER, FREELANCER,
                Arrays.asList(new OnChainMilestone(0, SOL, firstApproved, firstClaimed),
                        new OnChainMilestone(1, 2 * SOL, false, false)),
                Instant.now());
    }
}
