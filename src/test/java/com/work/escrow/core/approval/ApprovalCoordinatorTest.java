package com.work.escrow.core.approval;

import com.work.escrow.core.chain.ChainErrorKind;
import com.work.escrow.core.chain.ChainSubmissionException;
import com.work.escrow.core.chain.ChainTimeoutException;
import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.exception.ChainRejectionException;
import com.work.escrow.core.exception.DriftDetectedException;
import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.StateViolationException;
import com.work.escrow.core.exception.TransientFailureException;
import com.work.escrow.core.ledger.LedgerStore;
import com.work.escrow.core.model.EscrowAccountView;
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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.work.escrow.core.support.EscrowFixture.FREELANCER;
import static com.work.escrow.core.support.EscrowFixture.RECRUITER;
import static com.work.escrow.core.support.EscrowFixture.SOL;
import static com.work.escrow.core.support.EscrowFixture.freelancer;
import static com.work.escrow.core.support.EscrowFixture.recruiter;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

public class ApprovalCoordinatorTest {

    private static long markers(EscrowFixture f, String jobId) {
        return f.ledger.listTransactions(jobId).stream()
                .filter(t -> t.getType() == TransactionType.APPROVAL_MARKER)
                .count();
    }

    @Test
    public void approve_submitted_stage_updates_mirror() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL, 3 * SOL);
        f.markSubmitted("job1", 1);

        OperationResult r = f.approvals.approve("job1", 0, "looks good", recruiter());

        assertEquals(Outcome.APPLIED, r.getOutcome());
        assertFalse(r.isMirrorLagging());
        assertNotNull(r.getSignature());
        Milestone m = f.milestone("job1", 1);
        assertEquals(MilestoneStatus.APPROVED, m.getStatus());
        assertEquals("looks good", m.getReviewerComments());
        assertNotNull(m.getReviewedAt());
        assertFalse(m.isPaymentReleased());
        assertEquals(1, markers(f, "job1"));
        assertEquals(6 * SOL, f.chain.readAccount("job1").get().getStakedBalance());
        assertEquals(1, f.chain.getApproveSubmissions());
    }

    @Test
    public void out_of_sequence_makes_no_chain_call() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        f.markSubmitted("job1", 2);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.approvals.approve("job1", 1, null, recruiter()));

        assertEquals(GuardViolation.OUT_OF_SEQUENCE, e.getReason());
        assertEquals(0, f.chain.totalSubmissions());
        assertEquals(MilestoneStatus.SUBMITTED, f.milestone("job1", 2).getStatus());
    }

    @Test
    public void only_chain_recruiter_can_approve() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL);
        f.markSubmitted("job1", 1);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.approvals.approve("job1", 0, null, freelancer()));

        assertEquals(GuardViolation.NOT_RECRUITER, e.getReason());
        assertEquals(0, f.chain.totalSubmissions());
    }

    @Test
    public void stage_out_of_range() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.approvals.approve("job1", 3, null, recruiter()));
        assertEquals(GuardViolation.STAGE_OUT_OF_RANGE, e.getReason());
    }

    @Test
    public void unsubmitted_milestone_cannot_be_approved() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL);

        assertThrows(StateViolationException.class, () -> f.approvals.approve("job1", 0, null, recruiter()));
        assertEquals(0, f.chain.totalSubmissions());
    }

    @Test
    public void already_approved_on_chain_converges_without_submission() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        f.chain.approveOutOfBand("job1", 0);

        OperationResult r = f.approvals.approve("job1", 0, null, recruiter());

        assertEquals(Outcome.CONVERGED, r.getOutcome());
        assertEquals(ApprovalCoordinator.REASON_ALREADY_APPROVED, r.getReason());
        assertEquals(0, f.chain.getApproveSubmissions());
        assertEquals(MilestoneStatus.APPROVED, f.milestone("job1", 1).getStatus());
    }

    @Test
    public void claimed_stage_cannot_be_approved_again() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL);
        f.chain.claimOutOfBand("job1", 0);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.approvals.approve("job1", 0, null, recruiter()));
        assertEquals(GuardViolation.ALREADY_CLAIMED, e.getReason());
    }

    @Test
    public void drift_blocks_approval() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL);
        Milestone m = f.milestone("job1", 2);
        m.setStatus(MilestoneStatus.APPROVED);
        f.ledger.saveMilestone(m);
        f.markSubmitted("job1", 1);

        assertThrows(DriftDetectedException.class, () -> f.approvals.approve("job1", 0, null, recruiter()));
        assertEquals(0, f.chain.totalSubmissions());
    }

    @Test
    public void concurrent_double_approve_applies_once_and_both_succeed() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 20; round++) {
                EscrowFixture f = new EscrowFixture();
                String jobId = "job" + round;
                f.fundedJob(jobId, SOL, 2 * SOL);
                f.markSubmitted(jobId, 1);

                CountDownLatch start = new CountDownLatch(1);
                Callable<OperationResult> task = () -> {
                    start.await();
                    return f.approvals.approve(jobId, 0, null, recruiter());
                };
                List<Future<OperationResult>> futures = new ArrayList<>();
                futures.add(pool.submit(task));
                futures.add(pool.submit(task));
                start.countDown();

                int applied = 0;
                for (Future<OperationResult> fu : futures) {
                    OperationResult r = fu.get(5, TimeUnit.SECONDS);
                    if (r.isApplied()) {
                        applied++;
                    }
                }
                assertEquals(1, applied);
                assertEquals(1, f.chain.getAppliedApprovals());
                assertEquals(1, markers(f, jobId));
                assertEquals(MilestoneStatus.APPROVED, f.milestone(jobId, 1).getStatus());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    public void chain_already_approved_error_converges() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        when(client.readAccount("job1")).thenReturn(
                Optional.of(view(false)),
                Optional.of(view(true)));
        when(client.submitApprove(eq("job1"), eq(0), any()))
                .thenThrow(new ChainSubmissionException(ChainErrorKind.ALREADY_APPROVED, "MilestoneAlreadyApproved"));

        OperationResult r = f.approvals.approve("job1", 0, null, recruiter());

        assertEquals(Outcome.CONVERGED, r.getOutcome());
        verify(client, times(1)).submitApprove(eq("job1"), eq(0), any());
        assertEquals(MilestoneStatus.APPROVED, f.milestone("job1", 1).getStatus());
    }

    @Test
    public void other_chain_errors_are_rejections() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        when(client.readAccount("job1")).thenReturn(Optional.of(view(false)));
        when(client.submitApprove(eq("job1"), eq(0), any()))
                .thenThrow(new ChainSubmissionException(ChainErrorKind.INSUFFICIENT_FUNDS, "insufficient funds"));

        ChainRejectionException e = assertThrows(ChainRejectionException.class,
                () -> f.approvals.approve("job1", 0, null, recruiter()));
        assertEquals(ChainErrorKind.INSUFFICIENT_FUNDS, e.getKind());
        assertEquals(MilestoneStatus.SUBMITTED, f.milestone("job1", 1).getStatus());
    }

    @Test
    public void timeout_then_chain_shows_approved_converges() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        when(client.readAccount("job1")).thenReturn(
                Optional.of(view(false)),
                Optional.of(view(true)));
        when(client.submitApprove(eq("job1"), eq(0), any()))
                .thenThrow(new ChainTimeoutException("approve", "timed out", null));

        OperationResult r = f.approvals.approve("job1", 0, null, recruiter());

        assertEquals(Outcome.CONVERGED, r.getOutcome());
        assertEquals("CONFIRMED_AFTER_TIMEOUT", r.getReason());
    }

    @Test
    public void timeout_without_confirmation_leaves_mirror_untouched() {
        EscrowClient client = mock(EscrowClient.class);
        EscrowFixture f = new EscrowFixture(client, null, null, null);
        f.registerJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        when(client.readAccount("job1")).thenReturn(Optional.of(view(false)));
        when(client.submitApprove(eq("job1"), eq(0), any()))
                .thenThrow(new ChainTimeoutException("approve", "timed out", null));

        assertThrows(TransientFailureException.class, () -> f.approvals.approve("job1", 0, null, recruiter()));
        assertEquals(MilestoneStatus.SUBMITTED, f.milestone("job1", 1).getStatus());
        assertEquals(0, markers(f, "job1"));
    }

    @Test
    public void mirror_failure_after_chain_success_is_lagging_and_queued() {
        LedgerStore ledger = spy(new InMemoryLedgerStore());
        EscrowFixture f = new EscrowFixture(null, ledger, null, null);
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);
        doThrow(new IllegalStateException("ledger unavailable"))
                .doCallRealMethod()
                .when(ledger).appendTransaction(argThat(t -> t.getType() == TransactionType.APPROVAL_MARKER));

        OperationResult r = f.approvals.approve("job1", 0, null, recruiter());

        assertEquals(Outcome.APPLIED, r.getOutcome());
        assertTrue(r.isMirrorLagging());
        assertTrue(f.resyncQueue.contains("job1"));
        assertEquals(1, f.resyncQueue.pendingRecords("job1").size());
        assertTrue(f.chain.readAccount("job1").get().stage(0).isApproved());
        assertEquals(0, markers(f, "job1"));

        f.engine.reconcile("job1");
        assertEquals(MilestoneStatus.APPROVED, f.milestone("job1", 1).getStatus());
        TransactionRecord marker = f.ledger.findTransactionBySignature(r.getSignature()).get();
        assertEquals(TransactionType.APPROVAL_MARKER, marker.getType());
        assertFalse(marker.isSynthetic());
    }

    @Test
    public void applied_result_carries_view_after_approval() {
        EscrowFixture f = new EscrowFixture();
        f.fundedJob("job1", SOL, 2 * SOL);
        f.markSubmitted("job1", 1);

        OperationResult r = f.approvals.approve("job1", 0, null, recruiter());

        assertTrue(r.getView().stage(0).isApproved());
        assertEquals(SOL, r.getView().claimableAmount());
    }

    private static EscrowAccountView view(boolean firstApproved) {
        return new EscrowAccountView("job1", "escrow1", 3 * SOL, RECRUITER, FREELANCER,
                Arrays.asList(new OnChainMilestone(0, SOL, firstApproved, false),
                        new OnChainMilestone(1, 2 * SOL, false, false)),
                Instant.now());
    }
}
