package com.work.escrow.core.chain;

/**
 * 外部签名能力。组件只使用调用方的钱包地址做身份校验，并把 signer 原样交给 EscrowClient；
 * 私钥材料永远不进入组件。
 */
public interface WalletSigner {

    String getWalletAddress();

    static WalletSigner of(String walletAddress) {
        return () -> walletAddress;
    }
}
