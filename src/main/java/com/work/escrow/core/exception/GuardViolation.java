package com.work.escrow.core.exception;

/**
 * 以最新链上视图校验前置条件失败的原因。调用方需要换一种做法（例如先批准前一阶段），不会自动重试。
 */
public enum GuardViolation {
    JOB_NOT_FOUND,
    MILESTONE_NOT_FOUND,
    ESCROW_NOT_FOUND,
    ESCROW_NOT_FUNDED,
    STAGE_OUT_OF_RANGE,
    NOT_RECRUITER,
    NOT_FREELANCER,
    ALREADY_APPROVED,
    ALREADY_CLAIMED,
    OUT_OF_SEQUENCE,
    NOT_APPROVED,
    JOB_NOT_ACTIVE
}
