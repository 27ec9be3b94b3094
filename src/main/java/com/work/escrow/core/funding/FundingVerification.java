package com.work.escrow.core.funding;

/**
 * 注资核验结果。
 */
public final class FundingVerification {

    private final String jobId;
    private final boolean verified;
    private final long stakedBalance;
    private final long remainingAmount;
    private final long expectedTotal;
    private final String message;

    public FundingVerification(String jobId, boolean verified, long stakedBalance, long remainingAmount,
                               long expectedTotal, String message) {
        this.jobId = jobId;
        this.verified = verified;
        this.stakedBalance = stakedBalance;
        this.remainingAmount = remainingAmount;
        this.expectedTotal = expectedTotal;
        this.message = message;
    }

    public String getJobId() {
        return jobId;
    }

    public boolean isVerified() {
        return verified;
    }

    public long getStakedBalance() {
        return stakedBalance;
    }

    public long getRemainingAmount() {
        return remainingAmount;
    }

    public long getExpectedTotal() {
        return expectedTotal;
    }

    public String getMessage() {
        return message;
    }
}
