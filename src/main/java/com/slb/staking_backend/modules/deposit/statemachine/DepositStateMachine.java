package com.slb.staking_backend.modules.deposit.statemachine;

import com.slb.staking_backend.common.lifecycle.LifecycleStateMachine;
import com.slb.staking_backend.modules.deposit.enums.DepositAction;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import org.springframework.stereotype.Component;

import static com.slb.staking_backend.modules.deposit.enums.DepositAction.*;
import static com.slb.staking_backend.modules.deposit.enums.DepositState.*;

/**
 * 存款记录转移表：
 * NONE → REQUESTED → ASSIGNED → CONFIRMED → FINALIZED，任一未终结状态可取消至 CANCELLED。
 * 不允许跳步；终态无出边。
 */
@Component
public class DepositStateMachine {

    private final LifecycleStateMachine<DepositState, DepositAction> machine =
            LifecycleStateMachine.builder("deposit", DepositState.class, DepositAction.class)
                    .on(NONE, CREATE, REQUESTED)
                    .on(REQUESTED, ASSIGN, ASSIGNED)
                    .on(ASSIGNED, CONFIRM, CONFIRMED)
                    .on(CONFIRMED, FINALIZE, FINALIZED)
                    .on(REQUESTED, CANCEL, CANCELLED)
                    .on(ASSIGNED, CANCEL, CANCELLED)
                    .on(CONFIRMED, CANCEL, CANCELLED)
                    .terminal(FINALIZED)
                    .terminal(CANCELLED)
                    .build();

    public DepositState next(DepositState current, DepositAction action) {
        return machine.next(current, action);
    }

    public boolean isTerminal(DepositState state) {
        return machine.isTerminal(state);
    }

    public LifecycleStateMachine<DepositState, DepositAction> table() {
        return machine;
    }
}
