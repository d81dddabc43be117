package com.slb.staking_backend.modules.account.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "登录挑战 / Sign-in challenge")
public class SignInChallengeVo {

    @Schema(description = "账户地址 / Account address", example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String address;

    @Schema(description = "需原样 personal_sign 的消息 / Message to personal_sign verbatim")
    private String message;

    @Schema(description = "有效期（秒）/ Lifetime in seconds", example = "300")
    private Long expiresIn;
}
