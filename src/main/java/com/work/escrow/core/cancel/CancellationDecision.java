package com.work.escrow.core.cancel;

public enum CancellationDecision {
    /**
     * 没有任何阶段被批准：可以直接取消并全额退款。
     */
    CANCELLABLE,
    /**
     * 至少一个阶段已批准：合约拒绝取消，只能提交人工退款请求。
     */
    RECLAIM_ONLY
}
