package com.slb.staking_backend.modules.chain.model;

import java.math.BigInteger;

/**
 * 网关查询到的一笔入账交易。success=false 表示交易已上链但执行失败（revert）。
 */
public record IncomingTransfer(String txHash, String from, String to, BigInteger valueWei,
                               long confirmations, boolean success) {
}
