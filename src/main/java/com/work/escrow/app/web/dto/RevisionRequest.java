package com.work.escrow.app.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 请求修改。
 */
public class RevisionRequest {

    /**
     * recruiter 钱包
     */
    @NotBlank(message = "wallet 不能为空")
    private String wallet;

    @NotBlank(message = "comments 不能为空")
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
