package com.slb.staking_backend.modules.account.entity;

import lombok.Data;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * 对应表：accounts
 * <p>address 即调用方身份，所有生命周期守卫都以它比对。</p>
 */
@Data
public class Account implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    /** 0x 小写 20 字节地址，唯一 */
    private String address;

    private String passwordHash;

    /** USER / OWNER */
    private String role;

    /** 1=正常, 0=禁用 */
    private Integer status;

    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
