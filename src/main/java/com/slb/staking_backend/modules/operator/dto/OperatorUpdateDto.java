package com.slb.staking_backend.modules.operator.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "更新运营方白名单 / Update operator allow-list entry")
public class OperatorUpdateDto {

    @NotBlank
    @Schema(description = "运营方地址 / Operator address", example = "0x8ba1f109551bd432803012645ac136ddd64dba72",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private String address;

    @NotNull
    @Schema(description = "启用或停用 / Enable or disable", example = "true", requiredMode = Schema.RequiredMode.REQUIRED)
    private Boolean enabled;
}
