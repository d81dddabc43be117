package com.slb.staking_backend.modules.custody.entity;

import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 托管流水, 对应 'custody_journal' 表。每次台账变动追加一行，记录变动后的三项计数。
 */
@Data
public class CustodyJournal {
    private Long id;
    /** 变动类型：reserve / release / refund / exit / payout */
    private String refType;
    /** 关联业务主键（存款记录 ID 或金库请求 ID） */
    private Long refId;
    private BigInteger amount;
    private BigInteger pendingAfter;
    private BigInteger committedAfter;
    private BigInteger exitedAfter;
    private LocalDateTime eventTime;
}
