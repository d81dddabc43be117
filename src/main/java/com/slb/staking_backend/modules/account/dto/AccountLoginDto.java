package com.slb.staking_backend.modules.account.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

@Data
@Schema(description = "账户登录请求体 / Account login request body")
public class AccountLoginDto {

    @NotBlank
    @Schema(description = "账户地址，必填。/ Account address, required.", example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String address;

    @NotBlank
    @Schema(description = "登录密码，必填。/ Login password, required.", example = "P@ssw0rd123")
    private String password;

    @NotBlank(message = "签名不能为空")
    @Pattern(regexp = "0x[0-9a-fA-F]{130}", message = "签名必须为 65 字节 0x 十六进制")
    @Schema(description = "对 /auth/challenge 返回消息的 personal_sign 签名（65 字节 r||s||v）。/ personal_sign signature over the issued challenge.",
            example = "0x5f0c...1b")
    private String signature;
}
