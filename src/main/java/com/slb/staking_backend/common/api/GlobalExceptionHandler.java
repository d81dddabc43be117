package com.slb.staking_backend.common.api;

import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.exception.CooldownActiveException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.common.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ApiResponse<Void>> biz(BizException e) {
        HttpStatus status = HttpStatus.resolve(e.getCode());
        if (status == null) {
            status = HttpStatus.BAD_REQUEST;
        }
        if (status.is5xxServerError()) {
            log.warn("Request failed errorCode={} guard={}: {}", e.getErrorCode(), e.getGuard(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.bizError(e.getCode(), e.getErrorCode(), e.getMessage(),
                e.getGuard(), detailsOf(e)));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse<Void>> invalidArgument(MethodArgumentNotValidException e) {
        Map<String, String> errors = new LinkedHashMap<>();
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            errors.putIfAbsent(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(ApiResponse.bizError(400, ValidationException.VALIDATION_ERROR,
                "请求参数校验失败", "request.body", errors));
    }

    // keeper 依据 required/actual/availableAt 判断是暂时性失败还是永久性失败
    private Map<String, String> detailsOf(BizException e) {
        if (e instanceof CooldownActiveException cooldown) {
            return Map.of("availableAt", String.valueOf(cooldown.getAvailableAt()),
                    "actual", cooldown.getActual());
        }
        if (e instanceof StateViolationException violation) {
            return Map.of("required", violation.getRequired(), "actual", violation.getActual());
        }
        return null;
    }
}
