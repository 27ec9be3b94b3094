package com.work.escrow.core.exception;

import com.work.escrow.core.chain.ChainErrorKind;

/**
 * 合约层拒绝且无法用“已收敛”解释（例如余额不足），原样透传给调用方。
 */
public class ChainRejectionException extends EscrowException {

    private final ChainErrorKind kind;

    public ChainRejectionException(ChainErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ChainErrorKind getKind() {
        return kind;
    }
}
