package com.slb.staking_backend.common.exception;

/**
 * 调用者无权执行该动作；对该调用者而言是永久性失败。
 */
public class AuthorizationException extends BizException {

    public static final String AUTHORIZATION_ERROR = "AUTHORIZATION_ERROR";

    public AuthorizationException(String guard, String actor) {
        super(403, AUTHORIZATION_ERROR, guard, guard + ": actor " + actor + " is not permitted");
    }
}
