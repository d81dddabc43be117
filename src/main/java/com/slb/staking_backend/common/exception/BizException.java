package com.slb.staking_backend.common.exception;

/**
 * 业务异常基类。
 * <p>code 对齐 HTTP 状态码；errorCode 为稳定机器码（keeper/前端据此区分可重试与不可重试的失败）；
 * guard 标明具体失败的校验条件。</p>
 */
public class BizException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_ERROR_CODE = "BIZ_ERROR";

    // 自定义错误码
    private final int code;

    private final String errorCode;

    private final String guard;

    public BizException(String message) {
        this(400, DEFAULT_ERROR_CODE, null, message);
    }

    public BizException(int code, String message) {
        this(code, DEFAULT_ERROR_CODE, null, message);
    }

    public BizException(int code, String errorCode, String guard, String message) {
        super(message);
        this.code = code;
        this.errorCode = errorCode;
        this.guard = guard;
    }

    public int getCode() {
        return code;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public String getGuard() {
        return guard;
    }
}
