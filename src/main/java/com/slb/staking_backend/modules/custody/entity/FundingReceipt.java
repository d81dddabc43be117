package com.slb.staking_backend.modules.custody.entity;

import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 已消费的入账交易, 对应 'funding_receipt' 表。tx_hash 唯一，记录取消后也不删除，同一笔付款只能开一条存款记录。
 */
@Data
public class FundingReceipt {
    private String txHash;
    private String payer;
    private BigInteger amount;
    /** 由该付款创建的存款记录 ID */
    private Long depositId;
    private LocalDateTime consumedAt;
}
