package com.slb.staking_backend.modules.operator.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 运营方白名单条目, 对应 'operator_set' 表
 */
@Data
public class OperatorEntry {
    private Long id;
    /** 运营方地址（0x 小写） */
    private String address;
    private Boolean enabled;
    /** 最近一次修改人（拥有者地址） */
    private String updatedBy;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
