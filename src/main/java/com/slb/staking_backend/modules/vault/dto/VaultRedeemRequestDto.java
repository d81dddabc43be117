package com.slb.staking_backend.modules.vault.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Schema(description = "金库赎回请求 / Vault redeem request")
public class VaultRedeemRequestDto {

    @Schema(description = "控制人地址（可选，默认调用方）/ Controller address, defaults to caller")
    private String controller;

    @NotBlank(message = "份额不能为空")
    @Pattern(regexp = "\\d{1,40}", message = "份额必须为十进制整数")
    @Schema(description = "赎回份额，必须等于一个质押单位 / Shares to redeem, must equal the stake unit",
            example = "32000000000000000000")
    private String shares;

    @Schema(description = "指定退出的验证者记录 ID（可选，默认最早上线的可退出验证者）/ Validator to exit, optional",
            example = "42")
    private Long validatorId;
}
