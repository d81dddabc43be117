package com.slb.staking_backend.common.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.staking_backend.common.api.ApiResponse;
import com.slb.staking_backend.common.trace.TraceIdHolder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.lang.Nullable;

import java.io.IOException;
import java.util.Map;

/**
 * JwtFilter 在请求上标记鉴权失败原因，EntryPoint / AccessDeniedHandler 统一按 ApiResponse 输出。
 */
public final class AuthFailures {

    static final String ATTR = AuthFailures.class.getName() + ".FAILURE";

    public record Failure(AuthErrorType type, @Nullable String detail, @Nullable Map<String, String> errors) {
    }

    private AuthFailures() {
    }

    /** 只保留第一次标记的原因 */
    public static void flag(HttpServletRequest request, AuthErrorType type, String detail, Map<String, String> errors) {
        if (request.getAttribute(ATTR) == null) {
            request.setAttribute(ATTR, new Failure(type, detail, errors));
        }
    }

    @Nullable
    public static Failure get(HttpServletRequest request) {
        return request.getAttribute(ATTR) instanceof Failure failure ? failure : null;
    }

    public static void write(HttpServletResponse response, Failure failure, ObjectMapper mapper) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        AuthErrorType type = failure.type();
        int status = type.getStatus().value();
        response.setStatus(status);
        response.setContentType("application/json;charset=UTF-8");
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, TraceIdHolder.require());
        if (status == 401) {
            response.setHeader("WWW-Authenticate", "Bearer error=\"invalid_token\"");
        }

        ApiResponse<Void> body = ApiResponse.authError(status, type.getCode(), type.getDisplayMessage(), failure.errors());
        if (failure.detail() != null && body.getError() != null) {
            body.getError().setDetail(failure.detail());
        }
        mapper.writeValue(response.getOutputStream(), body);
    }
}
