package com.slb.staking_backend.modules.account.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
@Schema(description = "登录挑战请求体 / Sign-in challenge request body")
public class SignInChallengeDto {

    @NotBlank(message = "地址不能为空")
    @Schema(description = "待注册或登录的账户地址 / Account address about to register or log in",
            example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String address;
}
