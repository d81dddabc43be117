package com.slb.staking_backend.modules.chain.service;

import com.slb.staking_backend.modules.chain.model.ChainCallResult;
import com.slb.staking_backend.modules.credential.model.DepositData;

import java.math.BigInteger;

/**
 * 信标链存款合约。每条存款记录仅在 finalize 中、记录已写为 FINALIZED 之后调用一次。
 */
public interface DepositSink {

    ChainCallResult deposit(DepositData data, byte[] depositDataRoot, BigInteger valueWei);
}
