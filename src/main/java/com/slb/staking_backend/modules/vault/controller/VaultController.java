package com.slb.staking_backend.modules.vault.controller;

import com.slb.staking_backend.common.api.ApiResponse;
import com.slb.staking_backend.common.security.CustomUserDetails;
import com.slb.staking_backend.common.vo.PageVo;
import com.slb.staking_backend.modules.vault.dto.VaultDepositRequestDto;
import com.slb.staking_backend.modules.vault.dto.VaultProcessDepositDto;
import com.slb.staking_backend.modules.vault.dto.VaultProcessRedeemDto;
import com.slb.staking_backend.modules.vault.dto.VaultRedeemRequestDto;
import com.slb.staking_backend.modules.vault.service.VaultRequestService;
import com.slb.staking_backend.modules.vault.vo.VaultRequestVo;
import com.slb.staking_backend.modules.vault.vo.VaultShareVo;
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

import java.math.BigInteger;

@RestController
@RequestMapping("/api/v1/vault")
@Tag(name = "质押金库", description = "异步申购/赎回：请求 → 处理 → 可领取 → 领取，份额与 wei 1:1")
public class VaultController {

    private final VaultRequestService vaultRequestService;

    public VaultController(VaultRequestService vaultRequestService) {
        this.vaultRequestService = vaultRequestService;
    }

    @PostMapping("/deposit-requests")
    @Operation(
            summary = "发起金库申购",
            description = """
                    以金库为句柄持有人在注册表中创建一条存款记录，并登记 PENDING 申购请求。
                    调用方须先向托管地址转入恰好一个质押单位，并提交该付款交易哈希（单次有效）。

                    示例请求 (cURL):
                    curl -X POST "http://localhost:8080/api/v1/vault/deposit-requests" \\
                      -H "Authorization: Bearer <token>" \\
                      -H "Content-Type: application/json" \\
                      -d '{"fundingTxHash": "0x9a3f5c0e2b7d41e8a6c5b3d2f1e0a9b8c7d6e5f4a3b2c1d0e9f8a7b6c5d4e3f2"}'
                    """
    )
    public ApiResponse<VaultRequestVo> requestDeposit(@AuthenticationPrincipal CustomUserDetails user,
                                                      @Valid @RequestBody VaultDepositRequestDto dto) {
        return ApiResponse.ok(vaultRequestService.requestDeposit(user.getAddress(), dto.getController(),
                dto.getFundingTxHash()));
    }

    @PostMapping("/deposit-requests/{id}/process")
    @Operation(
            summary = "处理申购（运营方）",
            description = "金库代为确认 deposit_data_root 并提交存款合约；成功后申购请求进入 CLAIMABLE。任一步失败整体回滚。"
    )
    public ApiResponse<VaultRequestVo> processDeposit(@AuthenticationPrincipal CustomUserDetails user,
                                                      @Parameter(description = "请求 ID", example = "7") @PathVariable Long id,
                                                      @Valid @RequestBody VaultProcessDepositDto dto) {
        return ApiResponse.ok(vaultRequestService.processValidatorDeposit(user.getAddress(), id, dto.getDepositDataRoot()));
    }

    @PostMapping("/deposit-requests/{id}/claim")
    @Operation(summary = "领取申购份额", description = "CLAIMABLE → CLAIMED，向控制人铸造等额份额；重复领取返回 ALREADY_CLAIMED(409)。")
    public ApiResponse<VaultRequestVo> claimDeposit(@AuthenticationPrincipal CustomUserDetails user,
                                                    @Parameter(description = "请求 ID", example = "7") @PathVariable Long id) {
        return ApiResponse.ok(vaultRequestService.claimDeposit(user.getAddress(), id));
    }

    @PostMapping("/deposit-requests/{id}/cancel")
    @Operation(summary = "取消申购", description = "取消未处理完成的申购，并按注册表取消策略退款。")
    public ApiResponse<VaultRequestVo> cancelDeposit(@AuthenticationPrincipal CustomUserDetails user,
                                                     @Parameter(description = "请求 ID", example = "7") @PathVariable Long id) {
        return ApiResponse.ok(vaultRequestService.cancelDeposit(user.getAddress(), id));
    }

    @PostMapping("/redeem-requests")
    @Operation(
            summary = "发起赎回",
            description = """
                    锁定恰好一个质押单位的份额，并绑定一个已上线且未退出的验证者（未指定时取最早上线者）。

                    常见错误：INSUFFICIENT_SHARES(400)、PAYMENT_NOT_STAKE_UNIT(400)、STATE_VIOLATION(409)
                    """
    )
    public ApiResponse<VaultRequestVo> requestRedeem(@AuthenticationPrincipal CustomUserDetails user,
                                                     @Valid @RequestBody VaultRedeemRequestDto dto) {
        return ApiResponse.ok(vaultRequestService.requestRedeem(user.getAddress(), dto.getController(),
                new BigInteger(dto.getShares()), dto.getValidatorId()));
    }

    @PostMapping("/redeem-requests/{id}/processing")
    @Operation(summary = "标记赎回处理中（运营方）", description = "PENDING → PROCESSING，表示已向链上提交退出。")
    public ApiResponse<VaultRequestVo> markRedeemProcessing(@AuthenticationPrincipal CustomUserDetails user,
                                                            @Parameter(description = "请求 ID", example = "8") @PathVariable Long id) {
        return ApiResponse.ok(vaultRequestService.markRedeemProcessing(user.getAddress(), id));
    }

    @PostMapping("/redeem-requests/{id}/process")
    @Operation(summary = "完成赎回（运营方）", description = "记录验证者退出 epoch，请求进入 CLAIMABLE，托管台账 committed → exited。")
    public ApiResponse<VaultRequestVo> processRedeem(@AuthenticationPrincipal CustomUserDetails user,
                                                     @Parameter(description = "请求 ID", example = "8") @PathVariable Long id,
                                                     @Valid @RequestBody VaultProcessRedeemDto dto) {
        return ApiResponse.ok(vaultRequestService.processRedeem(user.getAddress(), id, dto.getExitEpoch()));
    }

    @PostMapping("/redeem-requests/{id}/claim")
    @Operation(summary = "领取赎回款", description = "销毁锁定份额并向控制人转出对应 wei；重复领取返回 ALREADY_CLAIMED(409)。")
    public ApiResponse<VaultRequestVo> claimRedeem(@AuthenticationPrincipal CustomUserDetails user,
                                                   @Parameter(description = "请求 ID", example = "8") @PathVariable Long id) {
        return ApiResponse.ok(vaultRequestService.claimRedeem(user.getAddress(), id));
    }

    @PostMapping("/redeem-requests/{id}/cancel")
    @Operation(summary = "取消赎回", description = "PENDING 状态可取消，锁定份额解锁。")
    public ApiResponse<VaultRequestVo> cancelRedeem(@AuthenticationPrincipal CustomUserDetails user,
                                                    @Parameter(description = "请求 ID", example = "8") @PathVariable Long id) {
        return ApiResponse.ok(vaultRequestService.cancelRedeem(user.getAddress(), id));
    }

    @GetMapping("/requests/{id}")
    @Operation(summary = "查询金库请求")
    public ApiResponse<VaultRequestVo> get(@Parameter(description = "请求 ID", example = "7") @PathVariable Long id) {
        return ApiResponse.ok(vaultRequestService.get(id));
    }

    @GetMapping("/requests")
    @Operation(summary = "我的金库请求", description = "分页查询当前账户发起的申购/赎回请求。")
    public ApiResponse<PageVo<VaultRequestVo>> mine(@AuthenticationPrincipal CustomUserDetails user,
                                                    @Parameter(description = "页码，从 1 开始", example = "1")
                                                    @RequestParam(defaultValue = "1") int page,
                                                    @Parameter(description = "每页数量", example = "10")
                                                    @RequestParam(defaultValue = "10") int size) {
        return ApiResponse.ok(vaultRequestService.listByOwner(user.getAddress(), page, size));
    }

    @GetMapping("/shares")
    @Operation(summary = "我的份额", description = "返回可用与锁定份额。")
    public ApiResponse<VaultShareVo> shares(@AuthenticationPrincipal CustomUserDetails user) {
        return ApiResponse.ok(vaultRequestService.shareBalance(user.getAddress()));
    }
}
