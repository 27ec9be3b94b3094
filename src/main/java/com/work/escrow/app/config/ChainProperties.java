package com.work.escrow.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 链连接配置（宿主侧）。
 *
 * mode=mock: 使用内存 escrow 合约 MockEscrowClient
 * mode=web3j: 使用 Web3jEscrowClient
 */
@ConfigurationProperties(prefix = "chain")
public class ChainProperties {

    /**
     * mock 或 web3j
     */
    private String mode = "mock";

    /**
     * Web3j HTTP RPC 地址，例如 http://localhost:8545
     */
    private String rpcUrl = "http://localhost:8545";

    /**
     * escrow 合约地址（web3j 模式必填）
     */
    private String contractAddress = null;

    private BigInteger gasPrice = BigInteger.valueOf(20_000_000_000L);

    private BigInteger gasLimit = BigInteger.valueOf(300_000L);

    /**
     * receipt 轮询间隔与次数；两者乘积应小于 escrow.chain-submit-timeout
     */
    private Duration receiptPollInterval = Duration.ofSeconds(1);

    private int receiptPollAttempts = 40;

    /**
     * 金额单位：合约里的 wei 除以 10^amountScale 后作为组件内的整数金额。
     * 默认 9（gwei），long 可表示约 92 亿 ETH。
     */
    private int amountScale = 9;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getRpcUrl() {
        return rpcUrl;
    }

    public void setRpcUrl(String rpcUrl) {
        this.rpcUrl = rpcUrl;
    }

    public String getContractAddress() {
        return contractAddress;
    }

    public void setContractAddress(String contractAddress) {
        this.contractAddress = contractAddress;
    }

    public BigInteger getGasPrice() {
        return gasPrice;
    }

    public void setGasPrice(BigInteger gasPrice) {
        this.gasPrice = gasPrice;
    }

    public BigInteger getGasLimit() {
        return gasLimit;
    }

    public void setGasLimit(BigInteger gasLimit) {
        this.gasLimit = gasLimit;
    }

    public Duration getReceiptPollInterval() {
        return receiptPollInterval;
    }

    public void setReceiptPollInterval(Duration receiptPollInterval) {
        this.receiptPollInterval = receiptPollInterval;
    }

    public int getReceiptPollAttempts() {
        return receiptPollAttempts;
    }

    public void setReceiptPollAttempts(int receiptPollAttempts) {
        this.receiptPollAttempts = receiptPollAttempts;
    }

    public int getAmountScale() {
        return amountScale;
    }

    public void setAmountScale(int amountScale) {
        this.amountScale = amountScale;
    }
}
