package com.slb.staking_backend.modules.deposit.service;

import com.slb.staking_backend.common.exception.CooldownActiveException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.deposit.entity.DepositRecord;
import com.slb.staking_backend.modules.deposit.enums.DepositAction;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import com.slb.staking_backend.modules.deposit.statemachine.DepositStateMachine;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 取消策略：
 * <ul>
 *     <li>REQUESTED / ASSIGNED：随时可取消；</li>
 *     <li>CONFIRMED：confirmedAt + cooldown 之后才可取消，之前抛出 {@link CooldownActiveException}；</li>
 *     <li>FINALIZED / CANCELLED / NONE：永不可取消。</li>
 * </ul>
 * 时间由调用方在调用时传入，这里不做任何调度。
 */
@Component
public class CancellationPolicy {

    private static final String GUARD = "deposit.cancel";

    private final StakingProperties stakingProperties;
    private final DepositStateMachine stateMachine;

    public CancellationPolicy(StakingProperties stakingProperties, DepositStateMachine stateMachine) {
        this.stakingProperties = stakingProperties;
        this.stateMachine = stateMachine;
    }

    /**
     * 最早可取消时间；永不可取消时返回 empty。
     */
    public Optional<LocalDateTime> availableAt(DepositRecord record) {
        DepositState state = record != null ? record.getState() : DepositState.NONE;
        if (state == DepositState.REQUESTED) {
            return Optional.of(record.getCreatedAt());
        }
        if (state == DepositState.ASSIGNED) {
            return Optional.of(record.getAssignedAt() != null ? record.getAssignedAt() : record.getCreatedAt());
        }
        if (state == DepositState.CONFIRMED) {
            return Optional.of(record.getConfirmedAt().plus(stakingProperties.getCancelCooldown()));
        }
        return Optional.empty();
    }

    /**
     * 校验在 now 时刻是否允许取消，不允许时抛出异常。
     */
    public void check(DepositRecord record, LocalDateTime now) {
        DepositState state = record != null ? record.getState() : DepositState.NONE;
        Optional<LocalDateTime> availableAt = availableAt(record);
        if (availableAt.isEmpty()) {
            throw new StateViolationException(GUARD, stateMachine.table().statesAllowing(DepositAction.CANCEL), state);
        }
        if (state == DepositState.CONFIRMED && now.isBefore(availableAt.get())) {
            throw new CooldownActiveException(state.name(), availableAt.get());
        }
    }

    public boolean isCancellable(DepositRecord record, LocalDateTime now) {
        return availableAt(record).map(at -> !now.isBefore(at)).orElse(false);
    }
}
