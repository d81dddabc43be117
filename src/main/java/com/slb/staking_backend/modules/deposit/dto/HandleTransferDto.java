package com.slb.staking_backend.modules.deposit.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "转让记录句柄 / Transfer record handle ownership")
public class HandleTransferDto {

    @NotBlank(message = "新持有人地址不能为空")
    @Schema(description = "新的句柄持有人地址。/ New handle owner address.", example = "0x8ba1f109551bd432803012645ac136ddd64dba72")
    private String newOwner;
}
