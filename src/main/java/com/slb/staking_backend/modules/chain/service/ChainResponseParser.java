package com.slb.staking_backend.modules.chain.service;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.slb.staking_backend.modules.chain.model.ChainCallResult;
import com.slb.staking_backend.modules.chain.model.IncomingTransfer;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.util.Optional;

/**
 * 解析中继网关响应：{"success":true,"txHash":"0x...","error":null}
 * <p>缺少 success 字段或非布尔值一律视为失败。</p>
 * <p>交易查询响应：{"found":true,"txHash":"0x...","from":"0x...","to":"0x...","valueWei":"...","confirmations":12,"status":"SUCCESS"}</p>
 */
@Component
public class ChainResponseParser {

    public ChainCallResult parse(String json) {
        if (!StringUtils.hasText(json)) {
            return ChainCallResult.failure("empty gateway response");
        }
        DocumentContext ctx;
        try {
            ctx = JsonPath.parse(json);
        } catch (Exception ex) {
            return ChainCallResult.failure("malformed gateway response");
        }
        Object success = read(ctx, "$.success");
        String txHash = asText(read(ctx, "$.txHash"));
        String error = asText(read(ctx, "$.error"));
        if (Boolean.TRUE.equals(success)) {
            return ChainCallResult.ok(txHash);
        }
        return ChainCallResult.failure(StringUtils.hasText(error) ? error : "gateway reported failure");
    }

    /**
     * found=false 返回 empty；结构不完整的响应抛出 IllegalArgumentException。
     */
    public Optional<IncomingTransfer> parseTransfer(String json) {
        if (!StringUtils.hasText(json)) {
            throw new IllegalArgumentException("empty gateway response");
        }
        DocumentContext ctx;
        try {
            ctx = JsonPath.parse(json);
        } catch (Exception ex) {
            throw new IllegalArgumentException("malformed gateway response", ex);
        }
        if (Boolean.FALSE.equals(read(ctx, "$.found"))) {
            return Optional.empty();
        }
        String txHash = asText(read(ctx, "$.txHash"));
        String from = asText(read(ctx, "$.from"));
        String to = asText(read(ctx, "$.to"));
        String value = asText(read(ctx, "$.valueWei"));
        Object confirmations = read(ctx, "$.confirmations");
        if (!StringUtils.hasText(txHash) || !StringUtils.hasText(from) || !StringUtils.hasText(to)
                || !StringUtils.hasText(value) || !(confirmations instanceof Number)) {
            throw new IllegalArgumentException("incomplete transaction in gateway response");
        }
        boolean success = "SUCCESS".equalsIgnoreCase(asText(read(ctx, "$.status")));
        return Optional.of(new IncomingTransfer(txHash, from, to, new BigInteger(value),
                ((Number) confirmations).longValue(), success));
    }

    private Object read(DocumentContext ctx, String path) {
        try {
            return ctx.read(path);
        } catch (RuntimeException ex) {
            // 路径不存在或根节点不是对象
            return null;
        }
    }

    private String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
