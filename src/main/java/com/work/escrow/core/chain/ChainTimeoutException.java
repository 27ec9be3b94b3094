package com.work.escrow.core.chain;

import com.work.escrow.core.exception.EscrowException;

/**
 * 链上调用超时且没有确定的成功/失败信号（灰区）。提交类调用遇到此异常时结果未知，
 * 不得乐观更新镜像，必须重新读取链上状态确认真实结果。
 */
public class ChainTimeoutException extends EscrowException {

    private final String operation;

    public ChainTimeoutException(String operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
