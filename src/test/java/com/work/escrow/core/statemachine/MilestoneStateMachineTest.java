package com.work.escrow.core.statemachine;

import com.work.escrow.core.exception.StateViolationException;
import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.MilestoneStatus;
import com.work.escrow.core.model.OnChainMilestone;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class MilestoneStateMachineTest {

    private final MilestoneStateMachine sm = new MilestoneStateMachine();

    private static EscrowAccountView view(OnChainMilestone... stages) {
        return new EscrowAccountView("job1", "escrow1", 6L, "r", "f", Arrays.asList(stages), Instant.now());
    }

    @Test
    public void off_chain_workflow_transitions() {
        assertEquals(MilestoneStatus.IN_PROGRESS,
                sm.transition(MilestoneStatus.PENDING, MilestoneStatus.IN_PROGRESS, TransitionContext.offChain()));
        assertEquals(MilestoneStatus.SUBMITTED,
                sm.transition(MilestoneStatus.IN_PROGRESS, MilestoneStatus.SUBMITTED, TransitionContext.offChain()));
        assertEquals(MilestoneStatus.REVISION_REQUESTED,
                sm.transition(MilestoneStatus.SUBMITTED, MilestoneStatus.REVISION_REQUESTED, TransitionContext.offChain()));
        assertEquals(MilestoneStatus.SUBMITTED,
                sm.transition(MilestoneStatus.REVISION_REQUESTED, MilestoneStatus.SUBMITTED, TransitionContext.offChain()));
    }

    @Test
    public void claimed_is_terminal() {
        for (MilestoneStatus target : MilestoneStatus.values()) {
            assertFalse(sm.canTransition(MilestoneStatus.CLAIMED, target));
        }
    }

    @Test
    public void approve_requires_submission() {
        EscrowAccountView v = view(new OnChainMilestone(0, 1L, false, false));
        StateViolationException e = assertThrows(StateViolationException.class,
                () -> sm.transition(MilestoneStatus.IN_PROGRESS, MilestoneStatus.APPROVED, TransitionContext.forApproval(v, 0)));
        assertEquals(MilestoneStatus.IN_PROGRESS, e.getCurrent());
        assertEquals(MilestoneStatus.APPROVED, e.getAttempted());
    }

    @Test
    public void approve_rejected_when_prior_stage_not_approved_on_chain() {
        EscrowAccountView v = view(new OnChainMilestone(0, 1L, false, false), new OnChainMilestone(1, 2L, false, false));
        assertThrows(StateViolationException.class,
                () -> sm.transition(MilestoneStatus.SUBMITTED, MilestoneStatus.APPROVED, TransitionContext.forApproval(v, 1)));
        assertEquals(MilestoneStatus.APPROVED,
                sm.transition(MilestoneStatus.SUBMITTED, MilestoneStatus.APPROVED, TransitionContext.forApproval(v, 0)));
    }

    @Test
    public void claim_requires_chain_freelancer() {
        EscrowAccountView v = view(new OnChainMilestone(0, 1L, true, false));
        assertThrows(StateViolationException.class,
                () -> sm.transition(MilestoneStatus.APPROVED, MilestoneStatus.CLAIMED, TransitionContext.forClaim(v, 0, "someone")));
        assertEquals(MilestoneStatus.CLAIMED,
                sm.transition(MilestoneStatus.APPROVED, MilestoneStatus.CLAIMED, TransitionContext.forClaim(v, 0, "f")));
    }

    @Test
    public void claim_rejected_when_already_claimed_on_chain() {
        EscrowAccountView v = view(new OnChainMilestone(0, 1L, true, true));
        assertThrows(StateViolationException.class,
                () -> sm.transition(MilestoneStatus.APPROVED, MilestoneStatus.CLAIMED, TransitionContext.forClaim(v, 0, "f")));
    }

    @Test
    public void accepts_submission_only_before_review() {
        assertTrue(sm.acceptsSubmission(MilestoneStatus.PENDING));
        assertTrue(sm.acceptsSubmission(MilestoneStatus.REVISION_REQUESTED));
        assertFalse(sm.acceptsSubmission(MilestoneStatus.SUBMITTED));
        assertFalse(sm.acceptsSubmission(MilestoneStatus.APPROVED));
    }
}
