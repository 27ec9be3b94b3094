package com.work.escrow.core.result;

public enum Outcome {
    /**
     * 本次调用把链上状态推进到了目标状态。
     */
    APPLIED,
    /**
     * 目标状态已由其他调用（或之前的调用）达成，本次只做了同步。
     */
    CONVERGED
}
