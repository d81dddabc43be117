package com.slb.staking_backend.modules.vault.entity;

import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 金库份额余额, 对应 'vault_share_balances' 表。份额与 wei 1:1。
 */
@Data
public class VaultShareBalance {
    private String ownerAddress;
    /** 可用份额 */
    private BigInteger available;
    /** 赎回请求锁定中的份额 */
    private BigInteger locked;
    private LocalDateTime updatedAt;
}
