package com.slb.staking_backend.modules.chain.service;

import com.slb.staking_backend.modules.chain.model.IncomingTransfer;

import java.util.Optional;

/**
 * 按交易哈希查询入账交易。交易不存在返回 empty；网关不可用抛出
 * {@link com.slb.staking_backend.common.exception.ExternalCallFailureException}。
 */
public interface PaymentLookup {

    Optional<IncomingTransfer> findTransfer(String txHash);
}
