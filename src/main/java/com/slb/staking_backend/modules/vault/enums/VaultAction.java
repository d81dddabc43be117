package com.slb.staking_backend.modules.vault.enums;

/**
 * 金库请求上的生命周期动作
 */
public enum VaultAction {
    PROCESS,
    COMPLETE,
    CLAIM,
    CANCEL
}
