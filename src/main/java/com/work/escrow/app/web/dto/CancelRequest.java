package com.work.escrow.app.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 取消 job；已有阶段批准时转为人工退款请求。
 */
public class CancelRequest {

    /**
     * recruiter 钱包
     */
    @NotBlank(message = "wallet 不能为空")
    private String wallet;

    /**
     * 联系方式（仅退款请求使用，可选）
     */
    private String contact;

    private String note;

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }

    public String getContact() {
        return contact;
    }

    public void setContact(String contact) {
        this.contact = contact;
    }

    public String getNote() {
        return note;
    }

    public void setNote(String note) {
        this.note = note;
    }
}
