package com.slb.staking_backend.modules.deposit.enums;

/**
 * 存款记录生命周期状态
 */
public enum DepositState {
    NONE,       // 无记录（未创建或已取消删除）
    REQUESTED,  // 已付款，等待运营方分配验证者密钥
    ASSIGNED,   // 已写入 pubkey/signature，等待凭证持有人确认
    CONFIRMED,  // 凭证持有人已确认 deposit_data_root
    FINALIZED,  // 已提交至存款合约（终态）
    CANCELLED;  // 已取消并退款（终态）

    public boolean isOpen() {
        return this == REQUESTED || this == ASSIGNED || this == CONFIRMED;
    }
}
