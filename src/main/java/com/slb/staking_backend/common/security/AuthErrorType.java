package com.slb.staking_backend.common.security;

import org.springframework.http.HttpStatus;

/**
 * 鉴权失败分类。code 为稳定机器码，displayMessage 供前端直接展示。
 */
public enum AuthErrorType {
    MISSING_AUTHORIZATION(HttpStatus.UNAUTHORIZED, "AUTH_MISSING_AUTHZ", "未登录，请先使用钱包地址登录"),
    BAD_AUTHORIZATION_HEADER(HttpStatus.BAD_REQUEST, "AUTH_BAD_HEADER", "请使用 Authorization: Bearer <token>"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "AUTH_INVALID_TOKEN", "登录已失效，请重新登录"),
    TOKEN_EXPIRED(HttpStatus.UNAUTHORIZED, "AUTH_TOKEN_EXPIRED", "登录已过期，请重新登录"),
    WRONG_TOKEN_TYPE(HttpStatus.UNAUTHORIZED, "AUTH_WRONG_TOKEN_TYPE", "令牌类型不匹配，请使用 accessToken"),
    UNKNOWN_ACCOUNT(HttpStatus.UNAUTHORIZED, "AUTH_UNKNOWN_ACCOUNT", "地址未注册或已被禁用"),
    NOT_OWNER(HttpStatus.FORBIDDEN, "AUTH_NOT_OWNER", "仅拥有者账户可执行该操作");

    private final HttpStatus status;
    private final String code;
    private final String displayMessage;

    AuthErrorType(HttpStatus status, String code, String displayMessage) {
        this.status = status;
        this.code = code;
        this.displayMessage = displayMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayMessage() {
        return displayMessage;
    }
}
