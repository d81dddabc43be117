package com.slb.staking_backend.modules.chain.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 链上中继网关配置（存款合约调用、原生币转账与入账交易查询）。
 */
@Component
@ConfigurationProperties(prefix = "app.chain-gateway")
@Data
public class ChainGatewayProperties {

    private boolean enabled = false;
    private String baseUrl = "http://localhost:8545";
    private String apiKey;
    private Endpoints endpoints = new Endpoints();
    private Limits limits = new Limits();

    @Data
    public static class Endpoints {
        private String deposit = "/v1/deposit-contract/deposit";
        private String transfer = "/v1/transfers";
        private String transaction = "/v1/transactions/{txHash}";
    }

    @Data
    public static class Limits {
        private double perHostQps = 2.0d;
        private long timeoutMs = 15_000L;
    }
}
