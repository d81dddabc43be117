package com.slb.staking_backend.modules.vault.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Schema(description = "金库存入请求 / Vault deposit request")
public class VaultDepositRequestDto {

    @Schema(description = "控制人地址（可选，默认调用方）/ Controller address, defaults to caller",
            example = "0x8ba1f109551bd432803012645ac136ddd64dba72")
    private String controller;

    @NotBlank(message = "付款交易哈希不能为空")
    @Pattern(regexp = "0x[0-9a-fA-F]{64}", message = "付款交易哈希必须为 0x + 64 位十六进制")
    @Schema(description = "付款交易哈希（调用方转入托管地址的一个质押单位，单次有效）/ Hash of the caller's stake-unit payment to custody, single use",
            example = "0x9a3f5c0e2b7d41e8a6c5b3d2f1e0a9b8c7d6e5f4a3b2c1d0e9f8a7b6c5d4e3f2")
    private String fundingTxHash;
}
