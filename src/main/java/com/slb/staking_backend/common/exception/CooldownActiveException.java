package com.slb.staking_backend.common.exception;

import java.time.LocalDateTime;

/**
 * 已确认记录处于冷静期内，暂不可取消。属于暂时性失败：availableAt 之后重新调用即可。
 */
public class CooldownActiveException extends StateViolationException {

    public static final String CANCEL_COOLDOWN_ACTIVE = "CANCEL_COOLDOWN_ACTIVE";

    private final LocalDateTime availableAt;

    public CooldownActiveException(String actualState, LocalDateTime availableAt) {
        super(CANCEL_COOLDOWN_ACTIVE, "cancel.cooldown", "cooldown elapsed at " + availableAt, actualState);
        this.availableAt = availableAt;
    }

    public LocalDateTime getAvailableAt() {
        return availableAt;
    }
}
