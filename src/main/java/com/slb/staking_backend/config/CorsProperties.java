package com.slb.staking_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 质押前端（浏览器钱包页面）跨域访问配置（app.cors.*）。
 */
@Component
@ConfigurationProperties(prefix = "app.cors")
@Data
public class CorsProperties {

    private boolean enabled = true;

    /**
     * 精确 Origin 白名单，如 https://staking.slb.xyz；非空时优先于 allowedOriginPatterns。
     */
    private List<String> allowedOrigins = new ArrayList<>();

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    // 生命周期接口只用 GET / POST
    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));

    private List<String> allowedHeaders = new ArrayList<>(List.of("Content-Type", "Authorization", "X-Trace-Id"));

    /**
     * keeper 与前端通过 X-Trace-Id 对齐服务端日志。
     */
    private List<String> exposedHeaders = new ArrayList<>(List.of("X-Trace-Id"));

    private boolean allowCredentials = false;

    private long maxAgeSeconds = 1800;
}
