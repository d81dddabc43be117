package com.slb.staking_backend.modules.custody.service;

import com.slb.staking_backend.common.exception.LedgerInvariantException;
import com.slb.staking_backend.common.vo.PageVo;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.custody.entity.CustodyBalance;
import com.slb.staking_backend.modules.custody.entity.CustodyJournal;
import com.slb.staking_backend.modules.custody.mapper.CustodyBalanceMapper;
import com.slb.staking_backend.modules.custody.mapper.CustodyJournalMapper;
import com.slb.staking_backend.modules.custody.vo.CustodyJournalVo;
import com.slb.staking_backend.modules.custody.vo.CustodySummaryVo;
import com.slb.staking_backend.modules.deposit.mapper.DepositRecordMapper;
import com.slb.staking_backend.modules.vault.mapper.VaultRequestMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 托管台账：pending / committed / exited 三项计数 + 流水。
 * <p>不变量：pending = 未终结记录金额之和；committed = FINALIZED 且未退出记录金额之和；
 * exited = CLAIMABLE 赎回请求金额之和。任何扣减不足直接抛出 {@link LedgerInvariantException}，不截断为 0。</p>
 * <p>调用方须先写入记录状态，再调用这里，使每次变动后的核对口径一致。</p>
 */
@Service
@Slf4j
public class CustodyLedgerService {

    public static final String REF_RESERVE = "reserve";
    public static final String REF_RELEASE = "release";
    public static final String REF_REFUND = "refund";
    public static final String REF_EXIT = "exit";
    public static final String REF_PAYOUT = "payout";

    private final CustodyBalanceMapper custodyBalanceMapper;
    private final CustodyJournalMapper custodyJournalMapper;
    private final DepositRecordMapper depositRecordMapper;
    private final VaultRequestMapper vaultRequestMapper;
    private final StakingProperties stakingProperties;
    private final Clock clock;

    public CustodyLedgerService(CustodyBalanceMapper custodyBalanceMapper,
                                CustodyJournalMapper custodyJournalMapper,
                                DepositRecordMapper depositRecordMapper,
                                VaultRequestMapper vaultRequestMapper,
                                StakingProperties stakingProperties,
                                Clock clock) {
        this.custodyBalanceMapper = custodyBalanceMapper;
        this.custodyJournalMapper = custodyJournalMapper;
        this.depositRecordMapper = depositRecordMapper;
        this.vaultRequestMapper = vaultRequestMapper;
        this.stakingProperties = stakingProperties;
        this.clock = clock;
    }

    /** 创建存款记录：pending += amount */
    @Transactional
    public CustodyBalance reserve(Long depositId, BigInteger amount) {
        return apply(REF_RESERVE, depositId, amount, amount, BigInteger.ZERO, BigInteger.ZERO);
    }

    /** finalize：pending -= amount，committed += amount */
    @Transactional
    public CustodyBalance release(Long depositId, BigInteger amount) {
        return apply(REF_RELEASE, depositId, amount, amount.negate(), amount, BigInteger.ZERO);
    }

    /** 取消退款：pending -= amount */
    @Transactional
    public CustodyBalance refund(Long depositId, BigInteger amount) {
        return apply(REF_REFUND, depositId, amount, amount.negate(), BigInteger.ZERO, BigInteger.ZERO);
    }

    /** 验证者退出：committed -= amount，exited += amount */
    @Transactional
    public CustodyBalance exit(Long requestId, BigInteger amount) {
        return apply(REF_EXIT, requestId, amount, BigInteger.ZERO, amount.negate(), amount);
    }

    /** 赎回领取：exited -= amount */
    @Transactional
    public CustodyBalance payout(Long requestId, BigInteger amount) {
        return apply(REF_PAYOUT, requestId, amount, BigInteger.ZERO, BigInteger.ZERO, amount.negate());
    }

    public CustodySummaryVo summary() {
        CustodyBalance balance = custodyBalanceMapper.find()
                .orElseThrow(() -> new LedgerInvariantException("custody.row", "custody balance row missing"));
        return CustodySummaryVo.from(balance);
    }

    public PageVo<CustodyJournalVo> journal(int page, int size) {
        int safePage = Math.max(1, page);
        int safeSize = Math.min(Math.max(1, size), 100);
        long total = custodyJournalMapper.count();
        List<CustodyJournalVo> list = custodyJournalMapper.findPaginated((safePage - 1) * safeSize, safeSize)
                .stream()
                .map(CustodyJournalVo::from)
                .collect(Collectors.toList());
        return new PageVo<>(total, safePage, safeSize, list);
    }

    /**
     * 重新汇总记录表并与计数比较；不一致抛出 LedgerInvariantException。
     */
    public void verifyInvariant(CustodyBalance balance) {
        BigInteger open = nz(depositRecordMapper.sumOpenAmount());
        BigInteger committed = nz(depositRecordMapper.sumCommittedAmount());
        BigInteger claimable = nz(vaultRequestMapper.sumClaimableRedeemAmount());
        if (!open.equals(balance.getPending())
                || !committed.equals(balance.getCommitted())
                || !claimable.equals(balance.getExited())) {
            log.error("Custody invariant broken: counters=({}, {}, {}), records=({}, {}, {})",
                    balance.getPending(), balance.getCommitted(), balance.getExited(), open, committed, claimable);
            throw new LedgerInvariantException("custody.invariant",
                    "custody counters do not match open/committed/claimable records");
        }
    }

    private CustodyBalance apply(String refType, Long refId, BigInteger amount,
                                 BigInteger pendingDelta, BigInteger committedDelta, BigInteger exitedDelta) {
        if (amount == null || amount.signum() <= 0) {
            throw new LedgerInvariantException("custody." + refType, "ledger amount must be positive");
        }
        CustodyBalance balance = custodyBalanceMapper.lockForUpdate()
                .orElseThrow(() -> new LedgerInvariantException("custody.row", "custody balance row missing"));

        BigInteger pending = checked(refType, "pending", nz(balance.getPending()).add(pendingDelta));
        BigInteger committed = checked(refType, "committed", nz(balance.getCommitted()).add(committedDelta));
        BigInteger exited = checked(refType, "exited", nz(balance.getExited()).add(exitedDelta));

        LocalDateTime now = LocalDateTime.now(clock);
        balance.setPending(pending);
        balance.setCommitted(committed);
        balance.setExited(exited);
        balance.setUpdatedAt(now);
        if (custodyBalanceMapper.update(balance) != 1) {
            throw new LedgerInvariantException("custody.row", "custody balance row missing");
        }

        CustodyJournal journal = new CustodyJournal();
        journal.setRefType(refType);
        journal.setRefId(refId);
        journal.setAmount(amount);
        journal.setPendingAfter(pending);
        journal.setCommittedAfter(committed);
        journal.setExitedAfter(exited);
        journal.setEventTime(now);
        custodyJournalMapper.insert(journal);

        if (stakingProperties.isVerifyCustodyInvariant()) {
            verifyInvariant(balance);
        }
        log.debug("custody {} ref={} amount={} -> pending={}, committed={}, exited={}",
                refType, refId, amount, pending, committed, exited);
        return balance;
    }

    private static BigInteger checked(String refType, String counter, BigInteger value) {
        if (value.signum() < 0) {
            throw new LedgerInvariantException("custody." + refType, counter + " would underflow");
        }
        return value;
    }

    private static BigInteger nz(BigInteger value) {
        return value != null ? value : BigInteger.ZERO;
    }
}
