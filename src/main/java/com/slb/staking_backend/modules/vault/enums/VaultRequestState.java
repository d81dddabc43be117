package com.slb.staking_backend.modules.vault.enums;

/**
 * 金库请求状态
 */
public enum VaultRequestState {
    PENDING,     // 已提交，等待 keeper 处理（可取消）
    PROCESSING,  // keeper 已开始处理（不可取消）
    CLAIMABLE,   // 处理完成，等待领取
    CLAIMED,     // 已领取（终态）
    CANCELLED    // 已取消（终态）
}
