package com.slb.staking_backend.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SwaggerConfig {

    private static final String SECURITY_SCHEME_NAME = "BearerAuth";

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                // 1. 配置 API 的基本信息：名称、版本、作者、发布日期等
                .info(new Info()
                        .title("验证者质押后端服务 API / SLB Staking Backend API")
                        .version("1.0.0")
                        .description(
                                """
                                1. 基本信息 / Basic Information
                                - API 名称 / API Name: 验证者质押后端服务 API (SLB Staking Backend API)
                                - 版本号 / Version: 1.0.0

                                API 介绍 / API Introduction:
                                管理质押验证者存款的完整生命周期：付款人提交一个质押单位，运营方分配验证者密钥，
                                凭证持有人确认 deposit_data_root，最终提交至链上存款合约；未终结前可按取消策略退款。
                                另提供异步申购/赎回金库与托管台账查询。
                                Manages the lifecycle of staking validator deposits: a payer funds one stake unit, an operator
                                assigns validator keys, the credential holder confirms the deposit_data_root and the deposit is
                                submitted to the deposit contract. Unfinalized deposits can be cancelled and refunded.
                                An asynchronous vault and custody ledger queries are also exposed.

                                2. 请求与响应规范 / Request & Response Conventions
                                - 所有请求和响应均使用 UTF-8 编码，字段命名遵循驼峰命名法。
                                - 金额一律以 wei 为单位、按十进制字符串传输，避免精度丢失。
                                - 字节字段（pubkey、signature、root）使用 0x 前缀的十六进制字符串。
                                - 地址统一为 0x + 40 位十六进制，服务端按小写保存与比较。

                                统一返回结构 / Unified Response Envelope:
                                - code: 业务状态码，0 表示成功，非 0 与 HTTP 状态码一致。
                                - message: 成功为 "ok"；失败时为稳定机器码，如 STATE_VIOLATION、CANCEL_COOLDOWN_ACTIVE。
                                - displayMessage / error.detail: 展示文案与失败的 guard（如 guard=deposit.confirm）。
                                - traceId: 请求链路追踪 ID。

                                3. 示例 / Example
                                先调用 /api/v1/auth/challenge 获取待签消息，用钱包 personal_sign 后登录：
                                curl -X POST "http://localhost:8080/api/v1/auth/login" \\
                                  -H "Content-Type: application/json" \\
                                  -d "{\\"address\\":\\"0x71c7656ec7ab88b098defb751b7401b5f6d8976f\\",\\"password\\":\\"123456\\",\\"signature\\":\\"0x...\\"}"

                                预期成功响应 / Expected Success Response (JSON):
                                {
                                  \\"code\\": 0,
                                  \\"message\\": \\"ok\\",
                                  \\"data\\": {
                                    \\"address\\": \\"0x71c7656ec7ab88b098defb751b7401b5f6d8976f\\",
                                    \\"accessToken\\": \\"eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...\\",
                                    \\"refreshToken\\": \\"eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...\\",
                                    \\"expiresIn\\": 3600
                                  },
                                  \\"traceId\\": \\"b3f7e6c9a1d24c31\\"
                                }
                                """
                        )
                        .contact(new Contact()
                                .name("SLB Backend")
                                .email("backend@slb.xyz")
                        )
                )
                // 2. 添加全局的安全认证配置（除显式标明为公开接口的 API 之外）
                .addSecurityItem(new SecurityRequirement().addList(SECURITY_SCHEME_NAME))
                .components(new Components()
                        .addSecuritySchemes(SECURITY_SCHEME_NAME,
                                // 3. 定义认证方式为 Bearer Token (JWT)
                                new SecurityScheme()
                                        .name(SECURITY_SCHEME_NAME)
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("在此处输入 JWT 访问令牌，格式为：Bearer {token}")
                        )
                );
    }
}
