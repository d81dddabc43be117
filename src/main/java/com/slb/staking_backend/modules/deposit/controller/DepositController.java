package com.slb.staking_backend.modules.deposit.controller;

import com.slb.staking_backend.common.api.ApiResponse;
import com.slb.staking_backend.common.security.CustomUserDetails;
import com.slb.staking_backend.common.vo.PageVo;
import com.slb.staking_backend.modules.audit.entity.LifecycleEvent;
import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import com.slb.staking_backend.modules.audit.service.LifecycleEventService;
import com.slb.staking_backend.modules.deposit.dto.DepositAssignDto;
import com.slb.staking_backend.modules.deposit.dto.DepositConfirmDto;
import com.slb.staking_backend.modules.deposit.dto.DepositCreateDto;
import com.slb.staking_backend.modules.deposit.dto.HandleTransferDto;
import com.slb.staking_backend.modules.deposit.service.DepositRegistryService;
import com.slb.staking_backend.modules.deposit.vo.CancellationVo;
import com.slb.staking_backend.modules.deposit.vo.DepositVo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/deposits")
@Tag(name = "验证者存款", description = "存款记录生命周期：create → assign → confirm → finalize，未终结前可按取消策略 cancel")
public class DepositController {

    private final DepositRegistryService depositRegistryService;
    private final LifecycleEventService lifecycleEventService;

    public DepositController(DepositRegistryService depositRegistryService, LifecycleEventService lifecycleEventService) {
        this.depositRegistryService = depositRegistryService;
        this.lifecycleEventService = lifecycleEventService;
    }

    @PostMapping
    @Operation(
            summary = "创建存款记录",
            description = """
                    付款方先向托管地址转入恰好一个质押单位（默认 32 ETH = 32000000000000000000 wei），
                    再提交该付款交易哈希与提款地址，记录进入 REQUESTED。服务端经链网关核验付款方、收款地址、金额与确认数，
                    每笔交易只能使用一次。调用方同时是记录句柄持有人与退款接收人。

                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/deposits" \\
                      -H "Authorization: Bearer <token>" \\
                      -H "Content-Type: application/json" \\
                      -d '{
                        "withdrawalAddress": "0x71c7656ec7ab88b098defb751b7401b5f6d8976f",
                        "fundingTxHash": "0x9a3f5c0e2b7d41e8a6c5b3d2f1e0a9b8c7d6e5f4a3b2c1d0e9f8a7b6c5d4e3f2"
                      }'

                    常见错误：PAYMENT_NOT_STAKE_UNIT(400)、FUNDING_NOT_FOUND(400)、FUNDING_MISMATCH(400)、
                    FUNDING_UNCONFIRMED(400)、FUNDING_ALREADY_USED(400)、INVALID_ADDRESS(400)
                    """
    )
    public ApiResponse<DepositVo> create(@AuthenticationPrincipal CustomUserDetails user,
                                         @Valid @RequestBody DepositCreateDto dto) {
        return ApiResponse.ok(depositRegistryService.create(user.getAddress(), dto.getWithdrawalAddress(),
                dto.getFundingTxHash()));
    }

    @PostMapping("/{id}/assign")
    @Operation(
            summary = "分配验证者密钥（运营方）",
            description = """
                    白名单运营方写入 48 字节 pubkey 与 96 字节 signature，记录 REQUESTED → ASSIGNED。写入后不可修改。

                    常见错误：AUTHORIZATION_ERROR(403)、INVALID_LENGTH(400)、STATE_VIOLATION(409)
                    """
    )
    public ApiResponse<DepositVo> assign(@AuthenticationPrincipal CustomUserDetails user,
                                         @Parameter(description = "记录 ID", example = "42") @PathVariable Long id,
                                         @Valid @RequestBody DepositAssignDto dto) {
        return ApiResponse.ok(depositRegistryService.assign(user.getAddress(), id, dto.getPubkey(), dto.getSignature()));
    }

    @PostMapping("/{id}/confirm")
    @Operation(
            summary = "确认 deposit_data_root（凭证持有人）",
            description = """
                    提款地址或句柄持有人提交独立计算的 deposit_data_root；服务端以 SHA-256 按存款合约算法重新计算并比对，
                    一致则 ASSIGNED → CONFIRMED，并开始计算取消冷静期。

                    常见错误：AUTHENTICITY_ERROR(422)、AUTHORIZATION_ERROR(403)、STATE_VIOLATION(409)
                    """
    )
    public ApiResponse<DepositVo> confirm(@AuthenticationPrincipal CustomUserDetails user,
                                          @Parameter(description = "记录 ID", example = "42") @PathVariable Long id,
                                          @Valid @RequestBody DepositConfirmDto dto) {
        return ApiResponse.ok(depositRegistryService.confirm(user.getAddress(), id, dto.getDepositDataRoot()));
    }

    @PostMapping("/{id}/finalize")
    @Operation(
            summary = "提交至存款合约（运营方）",
            description = """
                    CONFIRMED → FINALIZED，并在记录与台账落库后调用一次存款合约。调用失败时整体回滚，记录仍为 CONFIRMED。

                    常见错误：EXTERNAL_CALL_FAILURE(502)、AUTHORIZATION_ERROR(403)、STATE_VIOLATION(409)
                    """
    )
    public ApiResponse<DepositVo> finalizeDeposit(@AuthenticationPrincipal CustomUserDetails user,
                                                  @Parameter(description = "记录 ID", example = "42") @PathVariable Long id) {
        return ApiResponse.ok(depositRegistryService.finalizeDeposit(user.getAddress(), id));
    }

    @PostMapping("/{id}/cancel")
    @Operation(
            summary = "取消并退款",
            description = """
                    句柄持有人或提款地址取消未终结记录，质押金退回付款方。
                    REQUESTED / ASSIGNED 可立即取消；CONFIRMED 需等待 confirmedAt + 冷静期（默认 7 天）。

                    常见错误：CANCEL_COOLDOWN_ACTIVE(409，带 availableAt)、STATE_VIOLATION(409)、EXTERNAL_CALL_FAILURE(502)
                    """
    )
    public ApiResponse<DepositVo> cancel(@AuthenticationPrincipal CustomUserDetails user,
                                         @Parameter(description = "记录 ID", example = "42") @PathVariable Long id) {
        return ApiResponse.ok(depositRegistryService.cancel(user.getAddress(), id));
    }

    @PostMapping("/{id}/transfer")
    @Operation(summary = "转让记录句柄", description = "仅 FINALIZED 记录可转让；未终结记录返回 HANDLE_LOCKED(409)。")
    public ApiResponse<DepositVo> transfer(@AuthenticationPrincipal CustomUserDetails user,
                                           @Parameter(description = "记录 ID", example = "42") @PathVariable Long id,
                                           @Valid @RequestBody HandleTransferDto dto) {
        return ApiResponse.ok(depositRegistryService.transferHandle(user.getAddress(), id, dto.getNewOwner()));
    }

    @GetMapping("/{id}")
    @Operation(summary = "查询存款记录", description = "不存在的记录返回 state=NONE。")
    public ApiResponse<DepositVo> get(@Parameter(description = "记录 ID", example = "42") @PathVariable Long id) {
        return ApiResponse.ok(depositRegistryService.get(id));
    }

    @GetMapping("/{id}/cancellation")
    @Operation(summary = "查询取消可用时间", description = "返回当前是否可取消以及最早可取消时间（永不可取消时为空）。")
    public ApiResponse<CancellationVo> cancellation(@Parameter(description = "记录 ID", example = "42") @PathVariable Long id) {
        return ApiResponse.ok(depositRegistryService.cancellableAt(id));
    }

    @GetMapping("/{id}/events")
    @Operation(summary = "查询生命周期事件", description = "按发生顺序返回该记录的全部状态转移，已取消删除的记录同样可查。")
    public ApiResponse<List<LifecycleEvent>> events(@Parameter(description = "记录 ID", example = "42") @PathVariable Long id) {
        return ApiResponse.ok(lifecycleEventService.history(LifecycleSubject.DEPOSIT, id));
    }

    @GetMapping
    @Operation(summary = "我的存款记录", description = "分页查询当前账户作为句柄持有人的存款记录。")
    public ApiResponse<PageVo<DepositVo>> mine(@AuthenticationPrincipal CustomUserDetails user,
                                               @Parameter(description = "页码，从 1 开始", example = "1")
                                               @RequestParam(defaultValue = "1") int page,
                                               @Parameter(description = "每页数量", example = "10")
                                               @RequestParam(defaultValue = "10") int size) {
        return ApiResponse.ok(depositRegistryService.listByOwner(user.getAddress(), page, size));
    }
}
