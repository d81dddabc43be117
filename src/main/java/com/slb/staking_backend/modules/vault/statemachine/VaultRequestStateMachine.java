package com.slb.staking_backend.modules.vault.statemachine;

import com.slb.staking_backend.common.lifecycle.LifecycleStateMachine;
import com.slb.staking_backend.modules.vault.enums.VaultAction;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import org.springframework.stereotype.Component;

import static com.slb.staking_backend.modules.vault.enums.VaultAction.*;
import static com.slb.staking_backend.modules.vault.enums.VaultRequestState.*;

/**
 * 金库请求转移表（存入与赎回两个方向共用）：
 * PENDING → PROCESSING → CLAIMABLE → CLAIMED，或 PENDING → CANCELLED。
 */
@Component
public class VaultRequestStateMachine {

    private final LifecycleStateMachine<VaultRequestState, VaultAction> machine =
            LifecycleStateMachine.builder("vault", VaultRequestState.class, VaultAction.class)
                    .on(PENDING, PROCESS, PROCESSING)
                    .on(PROCESSING, COMPLETE, CLAIMABLE)
                    .on(CLAIMABLE, CLAIM, CLAIMED)
                    .on(PENDING, CANCEL, CANCELLED)
                    .terminal(CLAIMED)
                    .terminal(CANCELLED)
                    .build();

    public VaultRequestState next(VaultRequestState current, VaultAction action) {
        return machine.next(current, action);
    }

    public boolean isTerminal(VaultRequestState state) {
        return machine.isTerminal(state);
    }

    public LifecycleStateMachine<VaultRequestState, VaultAction> table() {
        return machine;
    }
}
