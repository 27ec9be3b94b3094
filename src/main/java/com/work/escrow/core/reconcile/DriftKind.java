package com.work.escrow.core.reconcile;

/**
 * 不可自动修正的镜像/链上冲突类型。
 */
public enum DriftKind {
    /**
     * 镜像声称的状态强于链上（例如镜像已 CLAIMED，链上未领取）。
     */
    MIRROR_AHEAD_OF_CHAIN,
    /**
     * 链上出现跳阶段批准（合约本身不强制顺序）。
     */
    NON_SEQUENTIAL_CHAIN_APPROVAL,
    /**
     * 已领取总额超过初始质押。
     */
    CLAIMED_EXCEEDS_STAKE,
    /**
     * 链上存在阶段而镜像缺少对应 milestone。
     */
    MIRROR_MISSING_MILESTONE
}
