package com.work.escrow.core.metrics;

/**
 * 可观测性端口（不强依赖 Micrometer/Prometheus）。
 *
 * 核心路径只调用接口；平台可通过自定义 Bean 接入具体实现。
 */
public interface EscrowMetrics {

    default void reconcile(String status) {
    }

    default void drift(String kind) {
    }

    default void approval(String outcome) {
    }

    default void claim(String outcome) {
    }

    default void cancellation(String outcome) {
    }

    default void mirrorWriteFailed(String op) {
    }

    default void resync(String result) {
    }
}
