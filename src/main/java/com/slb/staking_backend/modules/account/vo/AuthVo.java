package com.slb.staking_backend.modules.account.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@Schema(description = "认证结果视图对象 / Authentication result view object")
public class AuthVo {

    @Schema(description = "账户地址 / Account address", example = "0x71c7656ec7ab88b098defb751b7401b5f6d8976f")
    private String address;

    @Schema(description = "访问令牌（JWT），用于访问需要鉴权的接口。/ Access token (JWT) used for authenticated API calls.", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9....")
    private String accessToken;

    @Schema(description = "刷新令牌（JWT），用于刷新访问令牌。/ Refresh token (JWT) used to obtain a new access token.", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9....")
    private String refreshToken;

    @Schema(description = "访问令牌有效期（秒）/ Access token lifetime in seconds", example = "3600")
    private Long expiresIn;
}
