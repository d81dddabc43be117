package com.slb.staking_backend.common.exception;

/**
 * 托管账本下溢或与记录表不一致。致命错误：整笔操作中止，绝不做截断处理。
 */
public class LedgerInvariantException extends BizException {

    public static final String LEDGER_INVARIANT = "LEDGER_INVARIANT";

    public LedgerInvariantException(String guard, String message) {
        super(500, LEDGER_INVARIANT, guard, message);
    }
}
