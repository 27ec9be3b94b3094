package com.work.escrow.app.chain.web3j;

import com.work.escrow.core.chain.ChainErrorClassifier;
import com.work.escrow.core.chain.ChainErrorKind;
import com.work.escrow.core.chain.ChainSubmissionException;
import com.work.escrow.core.chain.ChainTimeoutException;
import com.work.escrow.core.chain.EscrowClient;
import com.work.escrow.core.chain.WalletSigner;
import com.work.escrow.core.exception.AmountOutOfRangeException;
import com.work.escrow.core.exception.TransientFailureException;
import com.work.escrow.core.model.EscrowAccountView;
import com.work.escrow.core.model.OnChainMilestone;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.core.DefaultBlockParameter;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.tx.ClientTransactionManager;
import org.web3j.tx.TransactionManager;
import org.web3j.tx.gas.ContractGasProvider;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.tx.response.TransactionReceiptProcessor;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * 基于 Web3j 的 escrow 合约客户端：
 * - 读：eth_call getEscrow(string)
 * - 写：approveMilestone / claimMilestone / cancelJob，经 ClientTransactionManager 由节点侧签名
 * - 回执：轮询 eth_getTransactionReceipt；失败回执在同一区块重放 eth_call 取 revert reason 再分类
 *
 * 说明：组件不持有私钥，WalletSigner 的地址必须是节点可签名的账户。
 * 金额：合约以 wei 记账，读出后除以 10^amountScale 换算为组件的整数金额单位；不能无损换算时抛 {@link AmountOutOfRangeException}。
 */
public class Web3jEscrowClient implements EscrowClient {

    private static final Logger log = LoggerFactory.getLogger(Web3jEscrowClient.class);

    private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private final Web3j web3j;
    private final String contractAddress;
    private final ContractGasProvider gasProvider;
    private final TransactionReceiptProcessor receiptProcessor;
    private final BigInteger amountUnit;

    public Web3jEscrowClient(Web3j web3j,
                             String contractAddress,
                             ContractGasProvider gasProvider,
                             long receiptPollIntervalMs,
                             int receiptPollAttempts,
                             int amountScale) {
        if (amountScale < 0 || amountScale > 18) {
            throw new IllegalArgumentException("amountScale 必须在 0~18 之间");
        }
        this.web3j = web3j;
        this.contractAddress = contractAddress;
        this.gasProvider = gasProvider;
        this.receiptProcessor = new PollingTransactionReceiptProcessor(web3j, receiptPollIntervalMs, receiptPollAttempts);
        this.amountUnit = BigInteger.TEN.pow(amountScale);
    }

    @Override
    public Optional<EscrowAccountView> readAccount(String jobId) {
        Function fn = new Function("getEscrow",
                Collections.singletonList(new Utf8String(jobId)),
                Arrays.asList(
                        new TypeReference<Address>() {
                        },
                        new TypeReference<Address>() {
                        },
                        new TypeReference<Uint256>() {
                        },
                        new TypeReference<DynamicArray<Uint256>>() {
                        },
                        new TypeReference<DynamicArray<Bool>>() {
                        },
                        new TypeReference<DynamicArray<Bool>>() {
                        }));
        String data = FunctionEncoder.encode(fn);
        EthCall resp;
        try {
            resp = web3j.ethCall(Transaction.createEthCallTransaction(ZERO_ADDRESS, contractAddress, data),
                    DefaultBlockParameterName.LATEST).send();
        } catch (IOException e) {
            log.warn("Web3j getEscrow failed. jobId={} err={}", jobId, e.getMessage());
            throw new TransientFailureException("escrow read failed jobId=" + jobId, e);
        }
        if (resp.hasError()) {
            throw new TransientFailureException("escrow read rpc error jobId=" + jobId + ": " + resp.getError().getMessage());
        }
        if (resp.isReverted() || resp.getValue() == null || "0x".equals(resp.getValue())) {
            return Optional.empty();
        }

        List<?> out = FunctionReturnDecoder.decode(resp.getValue(), fn.getOutputParameters());
        if (out == null || out.size() < 6) {
            return Optional.empty();
        }
        String recruiter = ((Address) out.get(0)).getValue();
        if (ZERO_ADDRESS.equalsIgnoreCase(recruiter)) {
            // 合约对不存在的账户返回零值结构体
            return Optional.empty();
        }
        String freelancer = ((Address) out.get(1)).getValue();
        long balance = toUnits(jobId, "balance", ((Uint256) out.get(2)).getValue());
        List<?> amounts = ((DynamicArray<?>) out.get(3)).getValue();
        List<?> approved = ((DynamicArray<?>) out.get(4)).getValue();
        List<?> claimed = ((DynamicArray<?>) out.get(5)).getValue();
        if (approved.size() != amounts.size() || claimed.size() != amounts.size()) {
            throw new TransientFailureException("escrow read returned inconsistent milestone arrays jobId=" + jobId);
        }

        List<OnChainMilestone> milestones = new ArrayList<>(amounts.size());
        for (int i = 0; i < amounts.size(); i++) {
            long amount = toUnits(jobId, "milestone[" + i + "]", ((Uint256) amounts.get(i)).getValue());
            milestones.add(new OnChainMilestone(i, amount,
                    ((Bool) approved.get(i)).getValue(), ((Bool) claimed.get(i)).getValue()));
        }
        return Optional.of(new EscrowAccountView(jobId, contractAddress, balance, recruiter, freelancer,
                milestones, Instant.now()));
    }

    private long toUnits(String jobId, String field, BigInteger wei) {
        BigInteger[] qr = wei.divideAndRemainder(amountUnit);
        if (qr[1].signum() != 0 || qr[0].bitLength() > 63) {
            log.error("escrow amount not representable jobId={} field={} wei={} unit={}", jobId, field, wei, amountUnit);
            throw new AmountOutOfRangeException(jobId, "escrow " + field + " of " + wei
                    + " wei is not a whole number of units (unit=" + amountUnit + " wei) within range, jobId=" + jobId);
        }
        return qr[0].longValue();
    }

    @Override
    public String submitApprove(String jobId, int stageIndex, WalletSigner signer) {
        Function fn = new Function("approveMilestone",
                Arrays.asList(new Utf8String(jobId), new Uint8(BigInteger.valueOf(stageIndex))),
                Collections.emptyList());
        return send("approve", fn, signer);
    }

    @Override
    public String submitClaim(String jobId, int stageIndex, WalletSigner signer) {
        Function fn = new Function("claimMilestone",
                Arrays.asList(new Utf8String(jobId), new Uint8(BigInteger.valueOf(stageIndex))),
                Collections.emptyList());
        return send("claim", fn, signer);
    }

    @Override
    public String submitCancel(String jobId, WalletSigner signer) {
        Function fn = new Function("cancelJob",
                Collections.singletonList(new Utf8String(jobId)),
                Collections.emptyList());
        return send("cancel", fn, signer);
    }

    private String send(String operation, Function fn, WalletSigner signer) {
        String from = signer.getWalletAddress();
        String data = FunctionEncoder.encode(fn);
        TransactionManager tm = new ClientTransactionManager(web3j, from);

        EthSendTransaction sent;
        try {
            sent = tm.sendTransaction(gasProvider.getGasPrice(fn.getName()), gasProvider.getGasLimit(fn.getName()),
                    contractAddress, data, BigInteger.ZERO);
        } catch (IOException e) {
            // 发送阶段的 IO 异常无法确定交易是否已进入节点
            throw new ChainTimeoutException(operation, "send " + operation + " io error: " + e.getMessage(), e);
        }
        if (sent.hasError()) {
            String msg = sent.getError().getMessage();
            throw new ChainSubmissionException(ChainErrorClassifier.classify(msg), msg);
        }

        String txHash = sent.getTransactionHash();
        TransactionReceipt receipt;
        try {
            receipt = receiptProcessor.waitForTransactionReceipt(txHash);
        } catch (IOException | TransactionException e) {
            log.warn("Web3j receipt not available. op={} txHash={} err={}", operation, txHash, e.getMessage());
            throw new ChainTimeoutException(operation, "receipt not available for " + txHash, e);
        }
        if (!receipt.isStatusOK()) {
            String reason = revertReason(from, data, receipt);
            ChainErrorKind kind = ChainErrorClassifier.classify(reason);
            log.warn("Web3j tx reverted. op={} txHash={} reason={} kind={}", operation, txHash, reason, kind);
            throw new ChainSubmissionException(kind, reason == null ? "transaction reverted: " + txHash : reason);
        }
        return txHash;
    }

    private String revertReason(String from, String data, TransactionReceipt receipt) {
        if (receipt.getRevertReason() != null) {
            return receipt.getRevertReason();
        }
        try {
            EthCall replay = web3j.ethCall(Transaction.createEthCallTransaction(from, contractAddress, data),
                    DefaultBlockParameter.valueOf(receipt.getBlockNumber())).send();
            return replay.getRevertReason();
        } catch (IOException e) {
            log.warn("Web3j revert replay failed. txHash={} err={}", receipt.getTransactionHash(), e.getMessage());
            return null;
        }
    }
}
