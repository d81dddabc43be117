package com.slb.staking_backend.common.lifecycle;

import com.slb.staking_backend.common.exception.StateViolationException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * 通用生命周期状态机：声明式 (状态, 动作) → 下一状态 转移表。
 * <p>存款记录与金库请求共用这一形态；未声明的 (状态, 动作) 组合一律抛出 {@link StateViolationException}，
 * 并带上该动作允许的前置状态集合，便于调用方区分“尚未到达”与“已经越过”。</p>
 *
 * @param <S> 状态枚举
 * @param <A> 动作枚举
 */
public final class LifecycleStateMachine<S extends Enum<S>, A extends Enum<A>> {

    private final String name;
    private final Map<S, Map<A, S>> transitions;
    private final Set<S> terminalStates;
    private final Class<S> stateType;

    private LifecycleStateMachine(String name, Class<S> stateType, Map<S, Map<A, S>> transitions, Set<S> terminalStates) {
        this.name = name;
        this.stateType = stateType;
        this.transitions = transitions;
        this.terminalStates = terminalStates;
    }

    public static <S extends Enum<S>, A extends Enum<A>> Builder<S, A> builder(String name, Class<S> stateType, Class<A> actionType) {
        return new Builder<>(name, stateType, actionType);
    }

    /**
     * 计算下一状态；非法转移抛出 StateViolationException(required, actual)。
     */
    public S next(S current, A action) {
        Map<A, S> row = transitions.get(current);
        S next = row != null ? row.get(action) : null;
        if (next == null) {
            throw new StateViolationException(name + "." + action.name().toLowerCase(), statesAllowing(action), current);
        }
        return next;
    }

    public boolean isTerminal(S state) {
        return terminalStates.contains(state);
    }

    public Set<S> statesAllowing(A action) {
        EnumSet<S> allowed = EnumSet.noneOf(stateType);
        transitions.forEach((state, row) -> {
            if (row.containsKey(action)) {
                allowed.add(state);
            }
        });
        return allowed;
    }

    public static final class Builder<S extends Enum<S>, A extends Enum<A>> {
        private final String name;
        private final Class<S> stateType;
        private final Class<A> actionType;
        private final Map<S, Map<A, S>> transitions;
        private final EnumSet<S> terminalStates;

        private Builder(String name, Class<S> stateType, Class<A> actionType) {
            this.name = name;
            this.stateType = stateType;
            this.actionType = actionType;
            this.transitions = new EnumMap<>(stateType);
            this.terminalStates = EnumSet.noneOf(stateType);
        }

        public Builder<S, A> on(S from, A action, S to) {
            Map<A, S> row = transitions.computeIfAbsent(from, k -> new EnumMap<>(actionType));
            if (row.putIfAbsent(action, to) != null) {
                throw new IllegalStateException("duplicate transition " + from + " --" + action + "-->");
            }
            return this;
        }

        public Builder<S, A> terminal(S state) {
            terminalStates.add(state);
            return this;
        }

        public LifecycleStateMachine<S, A> build() {
            for (S terminal : terminalStates) {
                if (transitions.containsKey(terminal)) {
                    throw new IllegalStateException("terminal state " + terminal + " must not have outgoing transitions");
                }
            }
            Map<S, Map<A, S>> frozen = new EnumMap<>(stateType);
            transitions.forEach((state, row) -> frozen.put(state, Collections.unmodifiableMap(new EnumMap<>(row))));
            return new LifecycleStateMachine<>(name, stateType, Collections.unmodifiableMap(frozen),
                    Collections.unmodifiableSet(EnumSet.copyOf(terminalStates)));
        }
    }
}
