package com.slb.staking_backend.common.exception;

/**
 * 外部调用（deposit 合约、转账网关）失败。抛出后整个事务回滚，包括同一调用中已写入的状态。
 */
public class ExternalCallFailureException extends BizException {

    public static final String EXTERNAL_CALL_FAILURE = "EXTERNAL_CALL_FAILURE";

    public ExternalCallFailureException(String guard, String message) {
        super(502, EXTERNAL_CALL_FAILURE, guard, message);
    }

    public ExternalCallFailureException(String guard, String message, Throwable cause) {
        this(guard, message);
        initCause(cause);
    }
}
