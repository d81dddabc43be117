package com.slb.staking_backend.common.api;

import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.exception.CooldownActiveException;
import com.slb.staking_backend.common.exception.ExternalCallFailureException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    void stateViolation_mapsTo409WithRequiredAndActual() {
        StateViolationException e = new StateViolationException("deposit.confirm",
                List.of(DepositState.ASSIGNED), DepositState.REQUESTED);

        ResponseEntity<ApiResponse<Void>> response = handler.biz(e);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        ApiResponse<Void> body = response.getBody();
        assertThat(body).isNotNull();
        assertThat(body.getCode()).isEqualTo(409);
        assertThat(body.getMessage()).isEqualTo(StateViolationException.STATE_VIOLATION);
        assertThat(body.getTraceId()).isNotBlank();
        assertThat(body.getError().getDetail()).isEqualTo("guard=deposit.confirm");
        assertThat(body.getError().getErrors())
                .containsEntry("required", "[ASSIGNED]")
                .containsEntry("actual", "REQUESTED");
    }

    @Test
    void cooldown_exposesAvailableAt() {
        LocalDateTime availableAt = LocalDateTime.of(2024, 3, 8, 0, 0);

        ResponseEntity<ApiResponse<Void>> response = handler.biz(new CooldownActiveException("CONFIRMED", availableAt));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getMessage()).isEqualTo(CooldownActiveException.CANCEL_COOLDOWN_ACTIVE);
        assertThat(response.getBody().getError().getErrors())
                .containsEntry("availableAt", "2024-03-08T00:00")
                .containsEntry("actual", "CONFIRMED");
    }

    @Test
    void externalCallFailure_mapsToBadGateway() {
        ResponseEntity<ApiResponse<Void>> response =
                handler.biz(new ExternalCallFailureException("deposit.finalize.sink", "deposit contract reverted"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().getError().getErrors()).isNull();
    }

    @Test
    void unknownCode_fallsBackToBadRequest() {
        ResponseEntity<ApiResponse<Void>> response = handler.biz(new BizException(499, "odd"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().getCode()).isEqualTo(499);
    }
}
