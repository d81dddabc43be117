package com.slb.staking_backend.modules.vault.vo;

import com.slb.staking_backend.modules.vault.entity.VaultRequest;
import com.slb.staking_backend.modules.vault.enums.VaultRequestKind;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.time.LocalDateTime;

@Data
@Schema(description = "金库请求 / Vault request")
public class VaultRequestVo {

    @Schema(description = "请求 ID / Request id", example = "7")
    private Long id;

    @Schema(description = "方向 / Direction", example = "REDEEM")
    private VaultRequestKind kind;

    @Schema(description = "状态 / State", example = "PENDING")
    private VaultRequestState state;

    @Schema(description = "金额或份额 (wei) / Amount or shares", example = "32000000000000000000")
    private String amount;

    @Schema(description = "请求所有人 / Request owner")
    private String ownerRef;

    @Schema(description = "控制人 / Controller")
    private String controllerRef;

    @Schema(description = "关联验证者存款记录 ID / Linked validator record id", example = "42")
    private Long linkedValidatorId;

    @Schema(description = "退出 epoch / Exit epoch")
    private Long exitEpoch;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
    private LocalDateTime claimedAt;

    public static VaultRequestVo from(VaultRequest request) {
        VaultRequestVo vo = new VaultRequestVo();
        vo.setId(request.getId());
        vo.setKind(request.getKind());
        vo.setState(request.getState());
        vo.setAmount(request.getAmount() != null ? request.getAmount().toString() : null);
        vo.setOwnerRef(request.getOwnerRef());
        vo.setControllerRef(request.getControllerRef());
        vo.setLinkedValidatorId(request.getLinkedValidatorId());
        vo.setExitEpoch(request.getExitEpoch());
        vo.setCreatedAt(request.getCreatedAt());
        vo.setUpdatedAt(request.getUpdatedAt());
        vo.setClaimedAt(request.getClaimedAt());
        return vo;
    }
}
