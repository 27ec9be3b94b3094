package com.work.escrow.core.exception;

/**
 * 链上金额无法无损换算为组件使用的整数金额单位（超出 long 范围，或不是单位的整数倍）。
 * 不可重试：同一账户再读一次结果相同，需要调整金额单位配置。
 */
public class AmountOutOfRangeException extends EscrowException {

    private final String jobId;

    public AmountOutOfRangeException(String jobId, String message) {
        super(message);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
