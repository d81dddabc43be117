package com.slb.staking_backend.modules.audit.entity;

import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 生命周期转移审计记录, 对应 'lifecycle_events' 表（只追加）。
 * 取消后被删除的存款记录仍可通过这里追溯。
 */
@Data
public class LifecycleEvent {
    private Long id;
    private LifecycleSubject subjectType;
    private Long subjectId;
    private String action;
    private String fromState;
    private String toState;
    private String actor;
    /** 附加信息（如交易哈希、退出 epoch） */
    private String detail;
    private LocalDateTime eventTime;
}
