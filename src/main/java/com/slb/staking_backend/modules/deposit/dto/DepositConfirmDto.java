package com.slb.staking_backend.modules.deposit.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "凭证持有人确认 deposit_data_root / Credential holder confirms the deposit data root")
public class DepositConfirmDto {

    @NotBlank(message = "depositDataRoot 不能为空")
    @Schema(description = "链下计算得到的 deposit_data_root，32 字节十六进制。/ Independently computed deposit data root, 32 bytes hex.",
            example = "0x4ae1a2e1b2f4e1c1f1bb2c3f34d5e6f7a8b9c0d1e2f3a4b5c6d7e8f9a0b1c2d3")
    private String depositDataRoot;
}
