package com.slb.staking_backend.modules.deposit.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Schema(description = "创建存款记录请求体 / Deposit record creation request body")
public class DepositCreateDto {

    @NotBlank(message = "提款地址不能为空")
    @Schema(description = "提款地址（20 字节 0x 地址），验证者退出后资金流向该地址。/ Execution-layer withdrawal address.",
            example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String withdrawalAddress;

    @NotBlank(message = "付款交易哈希不能为空")
    @Pattern(regexp = "0x[0-9a-fA-F]{64}", message = "付款交易哈希必须为 0x + 64 位十六进制")
    @Schema(description = "调用方转入托管地址的付款交易哈希，须已确认且金额恰为一个质押单位；每笔交易只能使用一次。/ Hash of the caller's confirmed stake-unit payment to the custody address; single use.",
            example = "0x9a3f5c0e2b7d41e8a6c5b3d2f1e0a9b8c7d6e5f4a3b2c1d0e9f8a7b6c5d4e3f2")
    private String fundingTxHash;
}
