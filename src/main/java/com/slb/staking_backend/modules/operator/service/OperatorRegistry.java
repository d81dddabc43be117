package com.slb.staking_backend.modules.operator.service;

import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.operator.entity.OperatorEntry;
import com.slb.staking_backend.modules.operator.mapper.OperatorMapper;
import com.slb.staking_backend.modules.operator.vo.OperatorVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 运营方白名单。只有拥有者（app.staking.owner-address）可以增删；
 * assign / finalize 以及金库 keeper 动作都通过 {@link #requireOperator} 校验调用方。
 */
@Service
@Slf4j
public class OperatorRegistry {

    private final OperatorMapper operatorMapper;
    private final StakingProperties stakingProperties;
    private final Clock clock;

    public OperatorRegistry(OperatorMapper operatorMapper, StakingProperties stakingProperties, Clock clock) {
        this.operatorMapper = operatorMapper;
        this.stakingProperties = stakingProperties;
        this.clock = clock;
    }

    public boolean isOperator(String address) {
        if (address == null) {
            return false;
        }
        return operatorMapper.findByAddress(address.toLowerCase())
                .map(OperatorEntry::getEnabled)
                .orElse(Boolean.FALSE);
    }

    public void requireOperator(String actor, String guard) {
        if (!isOperator(actor)) {
            throw new AuthorizationException(guard, actor);
        }
    }

    public boolean isOwner(String actor) {
        return HexUtils.sameAddress(actor, stakingProperties.getOwnerAddress());
    }

    public void requireOwner(String actor, String guard) {
        if (!isOwner(actor)) {
            throw new AuthorizationException(guard, actor);
        }
    }

    @Transactional
    public OperatorVo setEnabled(String caller, String operatorAddress, boolean enabled) {
        requireOwner(caller, "operator.update");
        String address = HexUtils.normalizeAddress("operatorAddress", operatorAddress);
        LocalDateTime now = LocalDateTime.now(clock);
        OperatorEntry entry = new OperatorEntry();
        entry.setAddress(address);
        entry.setEnabled(enabled);
        entry.setUpdatedBy(caller);
        entry.setCreatedAt(now);
        entry.setUpdatedAt(now);
        operatorMapper.upsert(entry);
        log.info("Operator {} {} by {}", address, enabled ? "enabled" : "disabled", caller);
        return OperatorVo.from(operatorMapper.findByAddress(address).orElse(entry));
    }

    public List<OperatorVo> list() {
        return operatorMapper.findAll().stream().map(OperatorVo::from).collect(Collectors.toList());
    }
}
