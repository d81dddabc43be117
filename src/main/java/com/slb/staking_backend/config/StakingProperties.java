package com.slb.staking_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Duration;

/**
 * 质押生命周期相关配置（app.staking.*）。
 */
@Component
@ConfigurationProperties(prefix = "app.staking")
@Data
public class StakingProperties {

    public static final BigInteger WEI_PER_GWEI = BigInteger.valueOf(1_000_000_000L);

    /**
     * 单个验证者所需的固定质押额（wei），默认 32 ETH。
     */
    private BigInteger stakeUnitWei = new BigInteger("32000000000000000000");

    /**
     * 已确认但未提交的记录，需等待该冷静期后才可被单方面取消。
     */
    private Duration cancelCooldown = Duration.ofDays(7);

    /**
     * 拥有者地址：唯一可维护运营方白名单的账户。
     */
    private String ownerAddress;

    /**
     * 金库地址：金库模式下作为 withdrawal credentials 持有者与记录句柄的拥有者。
     */
    private String vaultAddress;

    /**
     * 托管收款地址：存款付款必须是转入该地址的已确认交易。
     */
    private String custodyAddress;

    /**
     * 付款交易被接受前所需的最少区块确认数。
     */
    private long minFundingConfirmations = 12;

    /**
     * withdrawal credentials 版本前缀（0x01 = execution address）。
     */
    private int withdrawalPrefix = 1;

    /**
     * 每次账本变更后是否与记录表做一致性校验。
     */
    private boolean verifyCustodyInvariant = true;

    /**
     * deposit data root 中使用的金额（gwei）。
     */
    public long stakeUnitGwei() {
        BigInteger[] qr = stakeUnitWei.divideAndRemainder(WEI_PER_GWEI);
        if (qr[1].signum() != 0) {
            throw new IllegalStateException("app.staking.stake-unit-wei must be a whole number of gwei");
        }
        return qr[0].longValueExact();
    }
}
