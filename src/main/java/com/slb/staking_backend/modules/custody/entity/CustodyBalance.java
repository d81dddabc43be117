package com.slb.staking_backend.modules.custody.entity;

import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 托管余额汇总, 对应 'custody_balance' 表（单行，id=1）
 */
@Data
public class CustodyBalance {
    private Long id;

    /** 未终结存款记录占用的质押金 (wei) */
    private BigInteger pending;

    /** 已转入存款合约、验证者尚未退出的质押金 (wei) */
    private BigInteger committed;

    /** 已退出验证者返还、等待赎回领取的金额 (wei) */
    private BigInteger exited;

    private LocalDateTime updatedAt;
}
