package com.slb.staking_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * 已登录但角色不足（如非拥有者访问 /api/v1/admin/**），固定返回 403 NOT_OWNER。
 * 生命周期接口的调用方校验在业务层完成，走 AUTHORIZATION_ERROR。
 */
@Component
public class JwtAccessDeniedHandler implements AccessDeniedHandler {

    private final ObjectMapper objectMapper;

    public JwtAccessDeniedHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        AuthFailures.write(response, new AuthFailures.Failure(AuthErrorType.NOT_OWNER,
                accessDeniedException.getMessage(), Map.of("role", "OWNER required")), objectMapper);
    }
}
