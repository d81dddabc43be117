package com.slb.staking_backend.modules.vault.enums;

/**
 * 金库请求方向
 */
public enum VaultRequestKind {
    DEPOSIT,  // 存入质押单位，领取后铸造份额
    REDEEM    // 锁定份额，验证者退出后领取质押单位
}
