package com.slb.staking_backend.modules.chain.service;

import com.google.common.util.concurrent.RateLimiter;
import com.slb.staking_backend.common.exception.ExternalCallFailureException;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.modules.chain.config.ChainGatewayProperties;
import com.slb.staking_backend.modules.chain.model.AssetKind;
import com.slb.staking_backend.modules.chain.model.ChainCallResult;
import com.slb.staking_backend.modules.chain.model.IncomingTransfer;
import com.slb.staking_backend.modules.credential.model.DepositData;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.math.BigInteger;
import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 链上中继网关客户端，实现 {@link DepositSink}、{@link ValueTransfer} 与 {@link PaymentLookup}。
 * <p>价值转移不可幂等，因此这里不做任何重试；失败以 success=false 返回，由调用方回滚事务。</p>
 */
@Component
@Slf4j
public class ChainGatewayClient implements DepositSink, ValueTransfer, PaymentLookup {

    private static final int ERROR_BODY_MAX = 300;

    private final ChainGatewayProperties properties;
    private final ChainResponseParser parser;
    private final WebClient http;
    private final RateLimiter limiter;

    public ChainGatewayClient(WebClient.Builder builder, ChainGatewayProperties properties, ChainResponseParser parser) {
        this.properties = properties;
        this.parser = parser;
        this.http = builder
                .defaultHeader(HttpHeaders.USER_AGENT, "StakingBackend/ChainGatewayClient")
                .build();
        double permitsPerSecond = Math.max(0.1d, properties.getLimits().getPerHostQps());
        this.limiter = RateLimiter.create(permitsPerSecond);
    }

    @Override
    public ChainCallResult deposit(DepositData data, byte[] depositDataRoot, BigInteger valueWei) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pubkey", HexUtils.encode(data.getPubkey()));
        payload.put("withdrawalCredentials", HexUtils.encode(data.getWithdrawalCredentials()));
        payload.put("signature", HexUtils.encode(data.getSignature()));
        payload.put("depositDataRoot", HexUtils.encode(depositDataRoot));
        payload.put("amountGwei", data.getAmountGwei());
        payload.put("valueWei", valueWei.toString());
        return postJson(properties.getEndpoints().getDeposit(), payload);
    }

    @Override
    public ChainCallResult send(String toAddress, BigInteger amountWei, AssetKind kind) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("to", toAddress);
        payload.put("amountWei", amountWei.toString());
        payload.put("asset", kind.name());
        return postJson(properties.getEndpoints().getTransfer(), payload);
    }

    @Override
    public Optional<IncomingTransfer> findTransfer(String txHash) {
        String endpoint = properties.getEndpoints().getTransaction();
        if (!properties.isEnabled() || !StringUtils.hasText(endpoint)) {
            throw new ExternalCallFailureException("chain.lookup", "chain gateway disabled");
        }
        limiter.acquire();
        URI uri = buildUri(endpoint.replace("{txHash}", txHash));
        Duration timeout = Duration.ofMillis(Math.max(1000L, properties.getLimits().getTimeoutMs()));
        try {
            String body = http.get()
                    .uri(uri)
                    .headers(this::applyHeaders)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return parser.parseTransfer(body);
        } catch (WebClientResponseException.NotFound ex) {
            return Optional.empty();
        } catch (WebClientResponseException ex) {
            logRequestError(endpoint, ex);
            throw new ExternalCallFailureException("chain.lookup",
                    "HTTP " + ex.getStatusCode().value() + ": " + trimBody(ex.getResponseBodyAsString()), ex);
        } catch (Exception ex) {
            logRequestError(endpoint, ex);
            throw new ExternalCallFailureException("chain.lookup", "transaction lookup failed: " + trimBody(ex.getMessage()), ex);
        }
    }

    private ChainCallResult postJson(String endpoint, Map<String, Object> payload) {
        if (!properties.isEnabled()) {
            return ChainCallResult.failure("chain gateway disabled");
        }
        if (!StringUtils.hasText(endpoint)) {
            return ChainCallResult.failure("chain gateway endpoint not configured");
        }
        limiter.acquire();
        URI uri = buildUri(endpoint);
        Duration timeout = Duration.ofMillis(Math.max(1000L, properties.getLimits().getTimeoutMs()));
        try {
            String body = http.post()
                    .uri(uri)
                    .headers(this::applyHeaders)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(timeout)
                    .block();
            return parser.parse(body);
        } catch (WebClientResponseException ex) {
            logRequestError(endpoint, ex);
            String error = "HTTP " + ex.getStatusCode().value() + ": " + trimBody(ex.getResponseBodyAsString());
            return ChainCallResult.failure(error);
        } catch (Exception ex) {
            logRequestError(endpoint, ex);
            return ChainCallResult.failure(trimBody(ex.getMessage()));
        }
    }

    private void applyHeaders(HttpHeaders headers) {
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (StringUtils.hasText(properties.getApiKey())) {
            headers.add("X-API-KEY", properties.getApiKey());
        }
    }

    private URI buildUri(String endpoint) {
        if (endpoint.startsWith("http")) {
            return URI.create(endpoint);
        }
        String base = StringUtils.hasText(properties.getBaseUrl()) ? properties.getBaseUrl() : "";
        String normalizedBase = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        String normalizedEndpoint = endpoint.startsWith("/") ? endpoint : "/" + endpoint;
        return URI.create(normalizedBase + normalizedEndpoint);
    }

    private void logRequestError(String endpoint, Throwable err) {
        Integer statusCode = null;
        if (err instanceof WebClientResponseException wcre) {
            statusCode = wcre.getStatusCode().value();
        }
        log.warn("Chain gateway request failed (endpoint={}, statusCode={}, message={})",
                endpoint, statusCode, trimBody(err.getMessage()));
    }

    private String trimBody(String body) {
        if (!StringUtils.hasText(body)) {
            return null;
        }
        String trimmed = body.trim();
        if (trimmed.length() <= ERROR_BODY_MAX) {
            return trimmed;
        }
        return trimmed.substring(0, ERROR_BODY_MAX) + "...";
    }
}
