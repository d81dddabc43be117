package com.slb.staking_backend.modules.account.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
@Schema(description = "账户注册请求体 / Account registration request body")
public class AccountRegisterDto {

    @NotBlank(message = "地址不能为空")
    @Schema(description = "账户地址（20 字节 0x 地址），作为所有生命周期动作中的调用方身份。/ Account address, the actor identity.",
            example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String address;

    @NotBlank(message = "密码不能为空")
    @Size(min = 8, max = 64)
    @Schema(description = "登录密码，长度 8-64。/ Login password, length 8-64.", example = "P@ssw0rd123")
    private String password;

    @NotBlank(message = "签名不能为空")
    @Pattern(regexp = "0x[0-9a-fA-F]{130}", message = "签名必须为 65 字节 0x 十六进制")
    @Schema(description = "对 /auth/challenge 返回消息的 personal_sign 签名（65 字节 r||s||v）。/ personal_sign signature over the issued challenge.",
            example = "0x5f0c...1b")
    private String signature;
}
