package com.work.escrow.core.chain;

import com.work.escrow.core.exception.EscrowException;

/**
 * 链上提交被明确拒绝（已得到确定的失败信号）。
 */
public class ChainSubmissionException extends EscrowException {

    private final ChainErrorKind kind;

    public ChainSubmissionException(ChainErrorKind kind, String message) {
        super(message);
        this.kind = kind == null ? ChainErrorKind.UNKNOWN : kind;
    }

    public ChainSubmissionException(ChainErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? ChainErrorKind.UNKNOWN : kind;
    }

    public ChainErrorKind getKind() {
        return kind;
    }
}
