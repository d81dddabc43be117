package com.slb.staking_backend.common.exception;

/**
 * 入参不合法（长度、金额、地址格式等），调用方修正后可重试；不会产生任何状态变更。
 */
public class ValidationException extends BizException {

    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INVALID_LENGTH = "INVALID_LENGTH";
    public static final String INVALID_ADDRESS = "INVALID_ADDRESS";
    public static final String PAYMENT_NOT_STAKE_UNIT = "PAYMENT_NOT_STAKE_UNIT";
    public static final String INSUFFICIENT_SHARES = "INSUFFICIENT_SHARES";
    public static final String FUNDING_NOT_FOUND = "FUNDING_NOT_FOUND";
    public static final String FUNDING_MISMATCH = "FUNDING_MISMATCH";
    public static final String FUNDING_UNCONFIRMED = "FUNDING_UNCONFIRMED";
    public static final String FUNDING_ALREADY_USED = "FUNDING_ALREADY_USED";

    public ValidationException(String errorCode, String guard, String message) {
        super(400, errorCode, guard, message);
    }

    public static ValidationException invalidLength(String field, int expected, int actual) {
        return new ValidationException(INVALID_LENGTH, field,
                field + " must be " + expected + " bytes, got " + actual);
    }
}
