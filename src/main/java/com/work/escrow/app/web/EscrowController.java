package com.work.escrow.app.web;

import com.work.escrow.app.service.JobLedgerService;
import com.work.escrow.app.web.dto.ApproveRequest;
import com.work.escrow.app.web.dto.CancelRequest;
import com.work.escrow.app.web.dto.CreateJobRequest;
import com.work.escrow.app.web.dto.JobLedgerView;
import com.work.escrow.app.web.dto.OperationView;
import com.work.escrow.app.web.dto.ReconcileView;
import com.work.escrow.app.web.dto.RevisionRequest;
import com.work.escrow.app.web.dto.SubmitMilestoneRequest;
import com.work.escrow.app.web.dto.VerifyFundingRequest;
import com.work.escrow.app.web.dto.WalletRequest;
import com.work.escrow.core.approval.ApprovalCoordinator;
import com.work.escrow.core.cache.InFlightGuard;
import com.work.escrow.core.cancel.CancellationDecision;
import com.work.escrow.core.cancel.CancellationDecisionEngine;
import com.work.escrow.core.cancel.CancellationResult;
import com.work.escrow.core.chain.WalletSigner;
import com.work.escrow.core.claim.ClaimCoordinator;
import com.work.escrow.core.funding.FundingVerification;
import com.work.escrow.core.funding.FundingVerifier;
import com.work.escrow.core.model.Milestone;
import com.work.escrow.core.model.MilestoneSubmission;
import com.work.escrow.core.model.OnChainMilestone;
import com.work.escrow.core.reconcile.Correction;
import com.work.escrow.core.reconcile.DriftRecord;
import com.work.escrow.core.reconcile.ReconcileOutcome;
import com.work.escrow.core.reconcile.ReconciliationEngine;
import com.work.escrow.core.result.OperationResult;
import com.work.escrow.core.review.MilestoneReviewService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * job/milestone 对外接口。路径中的 stageNumber 从 1 开始，核心接口使用 0-based stageIndex。
 *
 * 身份认证不在本服务范围内：请求中的 wallet 直接作为签名方地址传给链客户端。
 */
@RestController
@RequestMapping("/api/v1/jobs")
public class EscrowController {

    private final JobLedgerService jobLedgerService;
    private final ReconciliationEngine reconciliationEngine;
    private final ApprovalCoordinator approvalCoordinator;
    private final ClaimCoordinator claimCoordinator;
    private final CancellationDecisionEngine cancellationEngine;
    private final FundingVerifier fundingVerifier;
    private final MilestoneReviewService reviewService;
    private final InFlightGuard inFlightGuard;

    public EscrowController(JobLedgerService jobLedgerService,
                            ReconciliationEngine reconciliationEngine,
                            ApprovalCoordinator approvalCoordinator,
                            ClaimCoordinator claimCoordinator,
                            CancellationDecisionEngine cancellationEngine,
                            FundingVerifier fundingVerifier,
                            MilestoneReviewService reviewService,
                            InFlightGuard inFlightGuard) {
        this.jobLedgerService = jobLedgerService;
        this.reconciliationEngine = reconciliationEngine;
        this.approvalCoordinator = approvalCoordinator;
        this.claimCoordinator = claimCoordinator;
        this.cancellationEngine = cancellationEngine;
        this.fundingVerifier = fundingVerifier;
        this.reviewService = reviewService;
        this.inFlightGuard = inFlightGuard;
    }

    @PostMapping
    public ResponseEntity<JobLedgerView> register(@Validated @RequestBody CreateJobRequest req) {
        JobLedgerView view = jobLedgerService.register(req.getJobId(), req.getRecruiterWallet(),
                req.getFreelancerWallet(), req.getMilestoneAmounts());
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<JobLedgerView> get(@PathVariable String jobId) {
        return ResponseEntity.ok(jobLedgerService.view(jobId));
    }

    @PostMapping("/{jobId}/reconcile")
    public ResponseEntity<ReconcileView> reconcile(@PathVariable String jobId) {
        return ResponseEntity.ok(toView(reconciliationEngine.reconcile(jobId)));
    }

    @PostMapping("/{jobId}/verify-funding")
    public ResponseEntity<FundingVerification> verifyFunding(@PathVariable String jobId,
                                                             @Validated @RequestBody VerifyFundingRequest req) {
        return ResponseEntity.ok(fundingVerifier.verifyFunding(jobId, req.getExpectedTotal(), req.getFundingSignature()));
    }

    @PostMapping("/{jobId}/milestones/{stageNumber}/start")
    public ResponseEntity<Milestone> start(@PathVariable String jobId,
                                           @PathVariable int stageNumber,
                                           @Validated @RequestBody WalletRequest req) {
        return ResponseEntity.ok(reviewService.start(jobId, stageNumber, req.getWallet()));
    }

    @PostMapping("/{jobId}/milestones/{stageNumber}/submit")
    public ResponseEntity<Milestone> submit(@PathVariable String jobId,
                                            @PathVariable int stageNumber,
                                            @Validated @RequestBody SubmitMilestoneRequest req) {
        MilestoneSubmission submission = new MilestoneSubmission(req.getDescription(),
                req.getLinks() == null ? Collections.emptyList() : req.getLinks(),
                req.getFileReferences() == null ? Collections.emptyList() : req.getFileReferences());
        return ResponseEntity.ok(reviewService.submit(jobId, stageNumber, req.getWallet(), submission));
    }

    @PostMapping("/{jobId}/milestones/{stageNumber}/request-revision")
    public ResponseEntity<Milestone> requestRevision(@PathVariable String jobId,
                                                     @PathVariable int stageNumber,
                                                     @Validated @RequestBody RevisionRequest req) {
        return ResponseEntity.ok(reviewService.requestRevision(jobId, stageNumber, req.getWallet(), req.getComments()));
    }

    @PostMapping("/{jobId}/milestones/{stageNumber}/approve")
    public ResponseEntity<OperationView> approve(@PathVariable String jobId,
                                                 @PathVariable int stageNumber,
                                                 @Validated @RequestBody ApproveRequest req) {
        int stageIndex = stageNumber - 1;
        OperationResult result = guarded(jobId, stageIndex, "approve",
                () -> approvalCoordinator.approve(jobId, stageIndex, req.getComments(), WalletSigner.of(req.getWallet())));
        return ResponseEntity.ok(toView(result));
    }

    @PostMapping("/{jobId}/milestones/{stageNumber}/claim")
    public ResponseEntity<OperationView> claim(@PathVariable String jobId,
                                               @PathVariable int stageNumber,
                                               @Validated @RequestBody WalletRequest req) {
        int stageIndex = stageNumber - 1;
        OperationResult result = guarded(jobId, stageIndex, "claim",
                () -> claimCoordinator.claim(jobId, stageIndex, WalletSigner.of(req.getWallet())));
        return ResponseEntity.ok(toView(result));
    }

    @GetMapping("/{jobId}/cancellation")
    public ResponseEntity<CancellationDecision> evaluateCancellation(@PathVariable String jobId) {
        return ResponseEntity.ok(cancellationEngine.evaluate(jobId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<CancellationResult> cancel(@PathVariable String jobId,
                                                     @Validated @RequestBody CancelRequest req) {
        CancellationResult result = guarded(jobId, null, "cancel",
                () -> cancellationEngine.cancel(jobId, WalletSigner.of(req.getWallet()), req.getContact(), req.getNote()));
        return ResponseEntity.ok(result);
    }

    private <T> T guarded(String jobId, Integer stageIndex, String operation, Supplier<T> action) {
        if (!inFlightGuard.tryAcquire(jobId, stageIndex, operation)) {
            throw new InFlightConflictException(operation + " already in flight for job " + jobId
                    + (stageIndex == null ? "" : " stage " + (stageIndex + 1)));
        }
        try {
            return action.get();
        } finally {
            inFlightGuard.release(jobId, stageIndex, operation);
        }
    }

    private static OperationView toView(OperationResult r) {
        OperationView v = new OperationView();
        v.setJobId(r.getJobId());
        v.setStageNumber(r.getStageIndex() + 1);
        v.setOutcome(r.getOutcome().name());
        v.setReason(r.getReason());
        v.setSignature(r.getSignature());
        v.setMirrorLagging(r.isMirrorLagging());
        if (r.getView() != null) {
            v.setStakedBalance(r.getView().getStakedBalance());
            v.setClaimableAmount(r.getView().claimableAmount());
        }
        return v;
    }

    private static ReconcileView toView(ReconcileOutcome outcome) {
        ReconcileView v = new ReconcileView();
        v.setJobId(outcome.getReport().getJobId());
        v.setSyncStatus(outcome.getReport().getStatus().name());
        v.setStakedBalance(outcome.getView().getStakedBalance());
        List<String> corrections = new ArrayList<>();
        for (Correction c : outcome.getReport().getCorrections()) {
            corrections.add(c.toString());
        }
        v.setCorrections(corrections);
        List<String> drifts = new ArrayList<>();
        for (DriftRecord d : outcome.getReport().getDrifts()) {
            drifts.add(d.getKind() + (d.getStageNumber() == null ? "" : " stage " + d.getStageNumber()));
        }
        v.setDrifts(drifts);
        List<ReconcileView.StageView> stages = new ArrayList<>();
        for (OnChainMilestone m : outcome.getView().getMilestones()) {
            stages.add(new ReconcileView.StageView(m.getStageNumber(), m.getAmount(), m.isApproved(), m.isClaimed()));
        }
        v.setStages(stages);
        return v;
    }
}
