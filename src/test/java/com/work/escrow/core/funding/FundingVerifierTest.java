package com.work.escrow.core.funding;

import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.TransactionRecord;
import com.work.escrow.core.model.TransactionType;
import com.work.escrow.core.support.EscrowFixture;
import org.junit.jupiter.api.Test;

import static com.work.escrow.core.support.EscrowFixture.FREELANCER;
import static com.work.escrow.core.support.EscrowFixture.RECRUITER;
import static com.work.escrow.core.support.EscrowFixture.SOL;
import static org.junit.jupiter.api.Assertions.*;

public class FundingVerifierTest {

    private final EscrowFixture f = new EscrowFixture();

    @Test
    public void verified_funding_activates_job_and_records_stake() {
        f.fundedJob("job1", SOL, 2 * SOL);

        FundingVerification v = f.funding.verifyFunding("job1", 3 * SOL, "sig_fund_1");

        assertTrue(v.isVerified());
        assertEquals(3 * SOL, v.getStakedBalance());
        Job job = f.job("job1");
        assertEquals(JobStatus.ACTIVE, job.getStatus());
        assertEquals("escrow_" + RECRUITER + "_job1", job.getEscrowAddress());
        TransactionRecord stake = f.ledger.findJobTransaction("job1", TransactionType.STAKE).get();
        assertEquals("sig_fund_1", stake.getSignature());
        assertEquals(3 * SOL, stake.getAmount());
        assertFalse(stake.isSynthetic());
    }

    @Test
    public void repeated_verification_keeps_one_stake_record() {
        f.fundedJob("job1", SOL);

        f.funding.verifyFunding("job1", SOL, null);
        f.funding.verifyFunding("job1", SOL, null);

        long stakes = f.ledger.listTransactions("job1").stream()
                .filter(t -> t.getType() == TransactionType.STAKE)
                .count();
        assertEquals(1, stakes);
        assertTrue(f.ledger.findJobTransaction("job1", TransactionType.STAKE).get().isSynthetic());
    }

    @Test
    public void missing_account_is_not_verified() {
        f.registerJob("job1", SOL);

        FundingVerification v = f.funding.verifyFunding("job1", SOL, null);

        assertFalse(v.isVerified());
        assertEquals(JobStatus.OPEN, f.job("job1").getStatus());
    }

    @Test
    public void milestone_total_below_expected_is_not_verified() {
        f.fundedJob("job1", SOL);

        FundingVerification v = f.funding.verifyFunding("job1", 2 * SOL, null);

        assertFalse(v.isVerified());
        assertFalse(f.ledger.findJobTransaction("job1", TransactionType.STAKE).isPresent());
    }

    @Test
    public void partially_claimed_escrow_still_verifies() {
        f.fundedJob("job1", SOL, 2 * SOL);
        f.chain.claimOutOfBand("job1", 0);

        FundingVerification v = f.funding.verifyFunding("job1", 3 * SOL, null);

        assertTrue(v.isVerified());
        assertEquals(2 * SOL, v.getRemainingAmount());
    }

    @Test
    public void unknown_job_and_bad_amount_rejected() {
        f.chain.fund("job9", RECRUITER, FREELANCER, SOL);
        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.funding.verifyFunding("job9", SOL, null));
        assertEquals(GuardViolation.JOB_NOT_FOUND, e.getReason());

        assertThrows(IllegalArgumentException.class, () -> f.funding.verifyFunding("job9", 0L, null));
    }
}
