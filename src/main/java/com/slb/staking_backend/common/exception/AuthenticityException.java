package com.slb.staking_backend.common.exception;

/**
 * 本地重算的 deposit data root 与提供值不一致：运营方提交的凭证有误或被篡改，资金路径被阻断。
 */
public class AuthenticityException extends BizException {

    public static final String AUTHENTICITY_ERROR = "AUTHENTICITY_ERROR";

    public AuthenticityException(String guard, String message) {
        super(422, AUTHENTICITY_ERROR, guard, message);
    }
}
