package com.slb.staking_backend.modules.deposit.entity;

import com.slb.staking_backend.modules.deposit.enums.DepositState;
import lombok.Data;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * 验证者存款记录实体类, 对应 'deposit_records' 表
 */
@Data
public class DepositRecord {
    private Long id;
    private DepositState state;

    /** 记录句柄持有人（终态后可转让） */
    private String ownerRef;

    /** 付款方，取消时的退款接收人 */
    private String depositorRef;

    /** 提款地址（0x 小写 20 字节） */
    private String withdrawalAddress;

    /** 提款凭证（0x + 32 字节十六进制） */
    private String withdrawalCredentials;

    /** 验证者公钥（0x + 48 字节十六进制），ASSIGNED 起不可变 */
    private String pubkey;

    /** BLS 签名（0x + 96 字节十六进制），ASSIGNED 起不可变 */
    private String signature;

    /** 确认时写入的 deposit_data_root */
    private String committedRoot;

    /** 质押金额 (wei) */
    private BigInteger amount;

    private String assignedOperator;

    private LocalDateTime createdAt;
    private LocalDateTime assignedAt;
    private LocalDateTime confirmedAt;
    private LocalDateTime finalizedAt;

    /** 验证者退出的 epoch；仅由金库赎回流程写入 */
    private Long exitEpoch;

    private LocalDateTime updatedAt;
}
