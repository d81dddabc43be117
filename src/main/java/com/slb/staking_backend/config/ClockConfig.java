package com.slb.staking_backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 所有时间相关判断（冷静期、时间戳）统一从该 Clock 读取，统一使用 UTC，避免服务器默认时区差异导致时间错位。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
