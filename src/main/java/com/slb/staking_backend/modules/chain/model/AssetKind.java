package com.slb.staking_backend.modules.chain.model;

/**
 * 转账资产类型，随转账请求传给网关。目前只有链原生币（wei）。
 */
public enum AssetKind {
    NATIVE
}
