package com.slb.staking_backend.modules.vault.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

@Data
@Schema(description = "keeper 报告验证者退出 / Keeper reports a validator exit")
public class VaultProcessRedeemDto {

    @NotNull(message = "exitEpoch 不能为空")
    @PositiveOrZero
    @Schema(description = "验证者退出 epoch / Exit epoch", example = "281000")
    private Long exitEpoch;
}
