package com.work.escrow.app.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 批准 milestone 请求。
 */
public class ApproveRequest {

    /**
     * recruiter 钱包
     */
    @NotBlank(message = "wallet 不能为空")
    private String wallet;

    /**
     * 审阅意见（可选）
     */
    private String comments;

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }
}
