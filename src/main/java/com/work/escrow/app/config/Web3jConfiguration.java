package com.work.escrow.app.config;

import com.work.escrow.app.chain.web3j.Web3jEscrowClient;
import com.work.escrow.core.chain.EscrowClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.gas.StaticGasProvider;

import static com.work.escrow.core.support.ValidationUtils.requireNonEmpty;

/**
 * Web3j 装配：
 * 当 chain.mode=web3j 时启用。
 */
@Configuration
@ConditionalOnProperty(prefix = "chain", name = "mode", havingValue = "web3j")
public class Web3jConfiguration {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(ChainProperties properties) {
        return Web3j.build(new HttpService(properties.getRpcUrl()));
    }

    @Bean(name = "chainEscrowClient")
    public EscrowClient web3jEscrowClient(Web3j web3j, ChainProperties properties) {
        requireNonEmpty(properties.getContractAddress(), "chain.contract-address");
        return new Web3jEscrowClient(web3j, properties.getContractAddress(),
                new StaticGasProvider(properties.getGasPrice(), properties.getGasLimit()),
                properties.getReceiptPollInterval().toMillis(), properties.getReceiptPollAttempts(),
                properties.getAmountScale());
    }
}
