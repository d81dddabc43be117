package com.slb.staking_backend.modules.chain.model;

/**
 * 外部链调用结果。success=false 即视为失败，无论是否抛出异常。
 */
public record ChainCallResult(boolean success, String txHash, String error) {

    public static ChainCallResult ok(String txHash) {
        return new ChainCallResult(true, txHash, null);
    }

    public static ChainCallResult failure(String error) {
        return new ChainCallResult(false, null, error);
    }
}
