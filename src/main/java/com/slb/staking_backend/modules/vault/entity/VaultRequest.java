package com.slb.staking_backend.modules.vault.entity;

import com.slb.staking_backend.modules.vault.enums.VaultRequestKind;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 金库异步请求实体类, 对应 'vault_requests' 表
 */
@Data
public class VaultRequest {
    private Long id;
    private VaultRequestKind kind;
    private VaultRequestState state;

    /** 金额 (wei)；赎回方向同时是锁定的份额数 */
    private BigInteger amount;

    /** 请求所有人（份额归属 / 赎回收款人） */
    private String ownerRef;

    /** 控制人：可代为领取或取消 */
    private String controllerRef;

    /** 关联的验证者存款记录 ID */
    private Long linkedValidatorId;

    /** 赎回方向：验证者退出 epoch */
    private Long exitEpoch;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime claimedAt;
}
