package com.work.escrow.app.web.dto;

import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;

import java.util.List;

/**
 * 登记 job 镜像（链下），milestone 金额按阶段顺序给出。
 */
public class CreateJobRequest {

    @NotBlank(message = "jobId 不能为空")
    private String jobId;

    @NotBlank(message = "recruiterWallet 不能为空")
    private String recruiterWallet;

    /**
     * 可选，选定 freelancer 之前为空
     */
    private String freelancerWallet;

    @NotEmpty(message = "milestoneAmounts 不能为空")
    private List<Long> milestoneAmounts;

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
    }

    public String getRecruiterWallet() {
        return recruiterWallet;
    }

    public void setRecruiterWallet(String recruiterWallet) {
        this.recruiterWallet = recruiterWallet;
    }

    public String getFreelancerWallet() {
        return freelancerWallet;
    }

    public void setFreelancerWallet(String freelancerWallet) {
        this.freelancerWallet = freelancerWallet;
    }

    public List<Long> getMilestoneAmounts() {
        return milestoneAmounts;
    }

    public void setMilestoneAmounts(List<Long> milestoneAmounts) {
        this.milestoneAmounts = milestoneAmounts;
    }
}
