package com.slb.staking_backend.modules.vault.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "keeper 推进金库存入 / Keeper processes a vault deposit")
public class VaultProcessDepositDto {

    @NotBlank(message = "depositDataRoot 不能为空")
    @Schema(description = "deposit_data_root，32 字节十六进制 / Deposit data root, 32 bytes hex")
    private String depositDataRoot;
}
