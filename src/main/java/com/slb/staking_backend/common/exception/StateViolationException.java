package com.slb.staking_backend.common.exception;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 生命周期阶段不符：通常意味着读到了过期状态或存在并发竞争，调用方应重新读取状态后再决定是否重试。
 */
public class StateViolationException extends BizException {

    public static final String STATE_VIOLATION = "STATE_VIOLATION";

    private final String required;
    private final String actual;

    public StateViolationException(String guard, Collection<? extends Enum<?>> required, Enum<?> actual) {
        this(STATE_VIOLATION, guard, describe(required), actual != null ? actual.name() : "NONE");
    }

    public StateViolationException(String errorCode, String guard, String required, String actual) {
        super(409, errorCode, guard, guard + ": required " + required + ", actual " + actual);
        this.required = required;
        this.actual = actual;
    }

    public String getRequired() {
        return required;
    }

    public String getActual() {
        return actual;
    }

    private static String describe(Collection<? extends Enum<?>> states) {
        if (states == null || states.isEmpty()) {
            return "[]";
        }
        return states.stream().map(Enum::name).sorted().collect(Collectors.joining("|", "[", "]"));
    }
}
