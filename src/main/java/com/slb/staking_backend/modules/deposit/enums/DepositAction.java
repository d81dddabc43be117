package com.slb.staking_backend.modules.deposit.enums;

/**
 * 存款记录上的生命周期动作
 */
public enum DepositAction {
    CREATE,
    ASSIGN,
    CONFIRM,
    FINALIZE,
    CANCEL
}
