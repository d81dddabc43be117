package com.slb.staking_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.util.Map;

/**
 * 受保护接口未通过认证时返回 401；JwtFilter 已标记原因的优先使用标记。
 */
@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public JwtAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        AuthFailures.Failure failure = AuthFailures.get(request);
        if (failure == null) {
            failure = StringUtils.hasText(request.getHeader("Authorization"))
                    ? new AuthFailures.Failure(AuthErrorType.INVALID_TOKEN, authException.getMessage(), Map.of("token", "invalid"))
                    : new AuthFailures.Failure(AuthErrorType.MISSING_AUTHORIZATION, "Missing Authorization: Bearer header",
                    Map.of("Authorization", "required"));
        }
        AuthFailures.write(response, failure, objectMapper);
    }
}
