package com.work.escrow.core.review;

import com.work.escrow.core.exception.GuardViolation;
import com.work.escrow.core.exception.GuardViolationException;
import com.work.escrow.core.exception.StateViolationException;
import com.work.escrow.core.model.Job;
import com.work.escrow.core.model.JobStatus;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.MilestoneSubmission;
import com.work.escrow.core.support.EscrowFixture;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static com.work.escrow.core.support.EscrowFixture.FREELANCER;
import static com.work.escrow.core.support.EscrowFixture.RECRUITER;
import static com.work.escrow.core.support.EscrowFixture.SOL;
import static org.junit.jupiter.api.Assertions.*;

public class MilestoneReviewServiceTest {

    private final EscrowFixture f = new EscrowFixture();

    private static MilestoneSubmission work(String description) {
        return new MilestoneSubmission(description, Arrays.asList("https://example.com/pr/1"), null);
    }

    @Test
    public void start_submit_revise_resubmit() {
        f.registerJob("job1", SOL, 2 * SOL);

        assertEquals(MilestoneStatus.IN_PROGRESS, f.reviews.start("job1", 1, FREELANCER).getStatus());
        Milestone submitted = f.reviews.submit("job1", 1, FREELANCER, work("first cut"));
        assertEquals(MilestoneStatus.SUBMITTED, submitted.getStatus());
        assertNotNull(submitted.getSubmittedAt());

        Milestone revised = f.reviews.requestRevision("job1", 1, RECRUITER, "missing tests");
        assertEquals(MilestoneStatus.REVISION_REQUESTED, revised.getStatus());
        assertEquals("missing tests", revised.getReviewerComments());

        Milestone resubmitted = f.reviews.submit("job1", 1, FREELANCER, work("with tests"));
        assertEquals(MilestoneStatus.SUBMITTED, resubmitted.getStatus());
        assertEquals("with tests", f.milestone("job1", 1).getSubmission().getDescription());
        assertEquals(1, f.milestone("job1", 1).getSubmission().getLinks().size());
    }

    @Test
    public void only_assigned_freelancer_works_on_milestones() {
        f.registerJob("job1", SOL);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.reviews.submit("job1", 1, RECRUITER, work("x")));
        assertEquals(GuardViolation.NOT_FREELANCER, e.getReason());
        assertEquals(MilestoneStatus.PENDING, f.milestone("job1", 1).getStatus());
    }

    @Test
    public void only_recruiter_requests_revision_with_comments() {
        f.registerJob("job1", SOL);
        f.reviews.submit("job1", 1, FREELANCER, work("x"));

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.reviews.requestRevision("job1", 1, FREELANCER, "redo"));
        assertEquals(GuardViolation.NOT_RECRUITER, e.getReason());
        assertThrows(IllegalArgumentException.class, () -> f.reviews.requestRevision("job1", 1, RECRUITER, " "));
    }

    @Test
    public void approved_milestone_cannot_be_resubmitted() {
        f.registerJob("job1", SOL);
        Milestone m = f.milestone("job1", 1);
        m.setStatus(MilestoneStatus.APPROVED);
        f.ledger.saveMilestone(m);

        assertThrows(StateViolationException.class, () -> f.reviews.submit("job1", 1, FREELANCER, work("late")));
    }

    @Test
    public void terminal_job_rejects_workflow_changes() {
        f.registerJob("job1", SOL);
        Job job = f.job("job1");
        job.setStatus(JobStatus.CANCELLED);
        f.ledger.saveJob(job);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.reviews.start("job1", 1, FREELANCER));
        assertEquals(GuardViolation.JOB_NOT_ACTIVE, e.getReason());
    }

    @Test
    public void unknown_milestone() {
        f.registerJob("job1", SOL);

        GuardViolationException e = assertThrows(GuardViolationException.class,
                () -> f.reviews.start("job1", 4, FREELANCER));
        assertEquals(GuardViolation.MILESTONE_NOT_FOUND, e.getReason());
    }
}
