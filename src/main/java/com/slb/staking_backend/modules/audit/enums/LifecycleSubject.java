package com.slb.staking_backend.modules.audit.enums;

/**
 * 生命周期事件的主体类型
 */
public enum LifecycleSubject {
    DEPOSIT,        // deposit_records
    VAULT_REQUEST   // vault_requests
}
