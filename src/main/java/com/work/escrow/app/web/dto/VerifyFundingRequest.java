package com.work.escrow.app.web.dto;

import javax.validation.constraints.Positive;

public class VerifyFundingRequest {

    /**
     * 约定总金额（base units）
     */
    @Positive(message = "expectedTotal 必须大于0")
    private long expectedTotal;

    /**
     * 注资交易签名（可选）
     */
    private String fundingSignature;

    public long getExpectedTotal() {
        return expectedTotal;
    }

    public void setExpectedTotal(long expectedTotal) {
        this.expectedTotal = expectedTotal;
    }

    public String getFundingSignature() {
        return fundingSignature;
    }

    public void setFundingSignature(String fundingSignature) {
        this.fundingSignature = fundingSignature;
    }
}
