package com.slb.staking_backend.modules.deposit.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "运营方分配验证者密钥 / Operator assigns validator credentials")
public class DepositAssignDto {

    @NotBlank(message = "pubkey 不能为空")
    @Schema(description = "BLS 公钥，48 字节十六进制。/ BLS public key, 48 bytes hex.",
            example = "0xa99a76ed7796f7be22d5b7e85deeb7c5677e88e511e0b337618f8c4eb61349b4bf2d153f649f7b53359fe8b94a38e44c")
    private String pubkey;

    @NotBlank(message = "signature 不能为空")
    @Schema(description = "BLS 签名，96 字节十六进制。/ BLS signature, 96 bytes hex.")
    private String signature;
}
