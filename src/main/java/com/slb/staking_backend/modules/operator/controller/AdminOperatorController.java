package com.slb.staking_backend.modules.operator.controller;

import com.slb.staking_backend.common.api.ApiResponse;
import com.slb.staking_backend.common.security.CustomUserDetails;
import com.slb.staking_backend.modules.operator.dto.OperatorUpdateDto;
import com.slb.staking_backend.modules.operator.service.OperatorRegistry;
import com.slb.staking_backend.modules.operator.vo.OperatorVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/admin/operators")
@PreAuthorize("hasRole('OWNER')")
@Tag(name = "管理员/运营方", description = "运营方白名单维护，仅合约所有者可操作")
public class AdminOperatorController {

    private final OperatorRegistry operatorRegistry;

    public AdminOperatorController(OperatorRegistry operatorRegistry) {
        this.operatorRegistry = operatorRegistry;
    }

    @GetMapping
    @Operation(summary = "运营方列表")
    public ApiResponse<List<OperatorVo>> list() {
        return ApiResponse.ok(operatorRegistry.list());
    }

    @PostMapping
    @Operation(
            summary = "启用/停用运营方",
            description = """
                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/admin/operators" \\
                      -H "Authorization: Bearer <token>" \\
                      -H "Content-Type: application/json" \\
                      -d '{"address": "0x8ba1f109551bd432803012645ac136ddd64dba72", "enabled": true}'
                    """
    )
    public ApiResponse<OperatorVo> update(@AuthenticationPrincipal CustomUserDetails user,
                                          @Valid @RequestBody OperatorUpdateDto dto) {
        return ApiResponse.ok(operatorRegistry.setEnabled(user.getAddress(), dto.getAddress(), dto.getEnabled()));
    }
}
