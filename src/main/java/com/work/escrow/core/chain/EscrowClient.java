package com.work.escrow.core.chain;

import com.work.escrow.core.model.EscrowAccountView;

import java.util.Optional;

/**
 * escrow 合约的最小能力端口：读账户状态 + 提交签名指令。组件视其为权威状态。
 *
 * 约定：
 * - 明确被拒绝时抛 {@link ChainSubmissionException}（带分类）
 * - 超时/结果未知时抛 {@link ChainTimeoutException}
 * - 其余异常视为临时失败
 */
public interface EscrowClient {

    /**
     * 读取 job 对应的 escrow 账户。账户不存在（未注资或已关闭）返回 empty。
     */
    Optional<EscrowAccountView> readAccount(String jobId);

    /**
     * 提交批准指令，返回链上签名。
     */
    String submitApprove(String jobId, int stageIndex, WalletSigner signer);

    /**
     * 提交领取指令，返回链上签名。
     */
    String submitClaim(String jobId, int stageIndex, WalletSigner signer);

    /**
     * 提交取消指令（全额退款并关闭账户），返回链上签名。
     */
    String submitCancel(String jobId, WalletSigner signer);
}
