package com.work.escrow.app.web.dto;

import javax.validation.constraints.NotBlank;

/**
 * 只携带调用方钱包的请求（开始/领取）。
 */
public class WalletRequest {

    @NotBlank(message = "wallet 不能为空")
    private String wallet;

    public String getWallet() {
        return wallet;
    }

    public void setWallet(String wallet) {
        this.wallet = wallet;
    }
}
