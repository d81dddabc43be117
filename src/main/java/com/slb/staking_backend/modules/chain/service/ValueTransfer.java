package com.slb.staking_backend.modules.chain.service;

import com.slb.staking_backend.modules.chain.model.AssetKind;
import com.slb.staking_backend.modules.chain.model.ChainCallResult;

import java.math.BigInteger;

/**
 * 价值转出（退款、赎回打款）。
 */
public interface ValueTransfer {

    ChainCallResult send(String toAddress, BigInteger amountWei, AssetKind kind);
}
