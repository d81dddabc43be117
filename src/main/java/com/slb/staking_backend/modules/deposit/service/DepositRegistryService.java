package com.slb.staking_backend.modules.deposit.service;

import com.slb.staking_backend.common.exception.AuthenticityException;
import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.exception.ExternalCallFailureException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.common.vo.PageVo;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import com.slb.staking_backend.modules.audit.service.LifecycleEventService;
import com.slb.staking_backend.modules.chain.model.AssetKind;
import com.slb.staking_backend.modules.chain.model.ChainCallResult;
import com.slb.staking_backend.modules.chain.model.IncomingTransfer;
import com.slb.staking_backend.modules.chain.service.DepositSink;
import com.slb.staking_backend.modules.chain.service.ValueTransfer;
import com.slb.staking_backend.modules.credential.model.DepositData;
import com.slb.staking_backend.modules.credential.service.DepositDataRootCalculator;
import com.slb.staking_backend.modules.credential.service.WithdrawalCredentials;
import com.slb.staking_backend.modules.custody.service.CustodyLedgerService;
import com.slb.staking_backend.modules.custody.service.FundingVerifier;
import com.slb.staking_backend.modules.deposit.entity.DepositRecord;
import com.slb.staking_backend.modules.deposit.enums.DepositAction;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import com.slb.staking_backend.modules.deposit.mapper.DepositRecordMapper;
import com.slb.staking_backend.modules.deposit.statemachine.DepositStateMachine;
import com.slb.staking_backend.modules.deposit.vo.CancellationVo;
import com.slb.staking_backend.modules.deposit.vo.DepositVo;
import com.slb.staking_backend.modules.operator.service.OperatorRegistry;
import com.slb.staking_backend.modules.vault.mapper.VaultRequestMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 验证者存款记录的生命周期控制：create → assign → confirm → finalize，或中途 cancel。
 * <p>每个公开动作是一个事务：先写记录（行锁 + 期望状态条件更新），再写托管台账，再写审计事件，
 * 最后才发起外部调用；外部调用失败则整个事务回滚。</p>
 */
@Service
@Slf4j
public class DepositRegistryService {

    public static final String HANDLE_LOCKED = "HANDLE_LOCKED";
    public static final String VAULT_MANAGED = "VAULT_MANAGED";

    private final DepositRecordMapper depositRecordMapper;
    private final DepositStateMachine stateMachine;
    private final DepositDataRootCalculator rootCalculator;
    private final CancellationPolicy cancellationPolicy;
    private final CustodyLedgerService custodyLedgerService;
    private final FundingVerifier fundingVerifier;
    private final VaultRequestMapper vaultRequestMapper;
    private final OperatorRegistry operatorRegistry;
    private final LifecycleEventService lifecycleEventService;
    private final DepositSink depositSink;
    private final ValueTransfer valueTransfer;
    private final StakingProperties stakingProperties;
    private final Clock clock;

    public DepositRegistryService(DepositRecordMapper depositRecordMapper,
                                  DepositStateMachine stateMachine,
                                  DepositDataRootCalculator rootCalculator,
                                  CancellationPolicy cancellationPolicy,
                                  CustodyLedgerService custodyLedgerService,
                                  FundingVerifier fundingVerifier,
                                  VaultRequestMapper vaultRequestMapper,
                                  OperatorRegistry operatorRegistry,
                                  LifecycleEventService lifecycleEventService,
                                  DepositSink depositSink,
                                  ValueTransfer valueTransfer,
                                  StakingProperties stakingProperties,
                                  Clock clock) {
        this.depositRecordMapper = depositRecordMapper;
        this.stateMachine = stateMachine;
        this.rootCalculator = rootCalculator;
        this.cancellationPolicy = cancellationPolicy;
        this.custodyLedgerService = custodyLedgerService;
        this.fundingVerifier = fundingVerifier;
        this.vaultRequestMapper = vaultRequestMapper;
        this.operatorRegistry = operatorRegistry;
        this.lifecycleEventService = lifecycleEventService;
        this.depositSink = depositSink;
        this.valueTransfer = valueTransfer;
        this.stakingProperties = stakingProperties;
        this.clock = clock;
    }

    /**
     * 直接存款：调用方既是句柄持有人也是付款方。
     */
    @Transactional
    public DepositVo create(String caller, String withdrawalAddress, String fundingTxHash) {
        return DepositVo.from(createRecord(caller, caller, withdrawalAddress, fundingTxHash));
    }

    /**
     * 新建记录（NONE → REQUESTED），并在托管台账中占用一个质押单位。
     * 付款必须是 depositorRef 转入托管地址、已确认且未被使用过的交易。
     *
     * @param ownerRef      句柄持有人
     * @param depositorRef  付款方，取消时退款给它
     * @param fundingTxHash 付款交易哈希
     */
    @Transactional
    public DepositRecord createRecord(String ownerRef, String depositorRef, String withdrawalAddress, String fundingTxHash) {
        String address = HexUtils.normalizeAddress("withdrawalAddress", withdrawalAddress);
        IncomingTransfer payment = fundingVerifier.verify(depositorRef, fundingTxHash);
        BigInteger stakeUnit = stakingProperties.getStakeUnitWei();
        DepositState next = stateMachine.next(DepositState.NONE, DepositAction.CREATE);

        LocalDateTime now = now();
        DepositRecord record = new DepositRecord();
        record.setState(next);
        record.setOwnerRef(ownerRef);
        record.setDepositorRef(depositorRef);
        record.setWithdrawalAddress(address);
        record.setWithdrawalCredentials(HexUtils.encode(
                WithdrawalCredentials.forAddress(stakingProperties.getWithdrawalPrefix(), address)));
        record.setAmount(stakeUnit);
        record.setCreatedAt(now);
        record.setUpdatedAt(now);
        depositRecordMapper.insert(record);
        fundingVerifier.consume(payment, depositorRef, record.getId());

        custodyLedgerService.reserve(record.getId(), stakeUnit);
        lifecycleEventService.record(LifecycleSubject.DEPOSIT, record.getId(), "create",
                DepositState.NONE, next, depositorRef, null);
        return record;
    }

    /**
     * 运营方写入验证者公钥与签名（REQUESTED → ASSIGNED）。写入后二者不可再改。
     */
    @Transactional
    public DepositVo assign(String caller, Long id, String pubkeyHex, String signatureHex) {
        operatorRegistry.requireOperator(caller, "deposit.assign");
        byte[] pubkey = HexUtils.decode("pubkey", pubkeyHex);
        byte[] signature = HexUtils.decode("signature", signatureHex);
        DepositData.requireLength("pubkey", pubkey, DepositData.PUBKEY_LENGTH);
        DepositData.requireLength("signature", signature, DepositData.SIGNATURE_LENGTH);

        DepositRecord record = lockRecord(id, DepositAction.ASSIGN);
        DepositState from = record.getState();
        DepositState next = stateMachine.next(from, DepositAction.ASSIGN);

        LocalDateTime now = now();
        record.setPubkey(HexUtils.encode(pubkey));
        record.setSignature(HexUtils.encode(signature));
        record.setAssignedOperator(caller);
        record.setAssignedAt(now);
        transition(record, from, next, now, "deposit.assign");

        lifecycleEventService.record(LifecycleSubject.DEPOSIT, id, "assign", from, next, caller, null);
        return DepositVo.from(record);
    }

    /**
     * 凭证持有人（提款地址或句柄持有人）确认 deposit_data_root（ASSIGNED → CONFIRMED）。
     * 重新计算的根与提交值不一致时抛出 {@link AuthenticityException}，状态不变。
     */
    @Transactional
    public DepositVo confirm(String caller, Long id, String suppliedRootHex) {
        DepositRecord record = lockRecord(id, DepositAction.CONFIRM);
        requireHolder(record, caller, "deposit.confirm");
        rejectVaultManaged(record, "deposit.confirm");
        DepositState from = record.getState();
        DepositState next = stateMachine.next(from, DepositAction.CONFIRM);

        byte[] suppliedRoot = HexUtils.decode("depositDataRoot", suppliedRootHex);
        DepositData.requireLength("depositDataRoot", suppliedRoot, DepositDataRootCalculator.ROOT_LENGTH);
        if (!rootCalculator.matches(toDepositData(record), suppliedRoot)) {
            throw new AuthenticityException("deposit.confirm.root",
                    "deposit data root does not match the assigned credentials");
        }

        LocalDateTime now = now();
        record.setCommittedRoot(HexUtils.encode(suppliedRoot));
        record.setConfirmedAt(now);
        transition(record, from, next, now, "deposit.confirm");

        lifecycleEventService.record(LifecycleSubject.DEPOSIT, id, "confirm", from, next, caller, null);
        return DepositVo.from(record);
    }

    /**
     * 运营方提交至存款合约（CONFIRMED → FINALIZED）。
     * 记录状态与台账先落库，再调用一次 {@link DepositSink}；调用失败则整体回滚。
     */
    @Transactional
    public DepositVo finalizeDeposit(String caller, Long id) {
        operatorRegistry.requireOperator(caller, "deposit.finalize");
        DepositRecord record = lockRecord(id, DepositAction.FINALIZE);
        DepositState from = record.getState();
        DepositState next = stateMachine.next(from, DepositAction.FINALIZE);

        DepositData data = toDepositData(record);
        byte[] root = rootCalculator.computeRoot(data);
        if (!rootCalculator.matches(data, HexUtils.decode("committedRoot", record.getCommittedRoot()))) {
            throw new AuthenticityException("deposit.finalize.root",
                    "stored deposit data root no longer reproduces");
        }

        LocalDateTime now = now();
        record.setFinalizedAt(now);
        transition(record, from, next, now, "deposit.finalize");
        custodyLedgerService.release(id, record.getAmount());

        lifecycleEventService.record(LifecycleSubject.DEPOSIT, id, "finalize", from, next, caller, null);

        ChainCallResult result = depositSink.deposit(data, root, record.getAmount());
        if (result == null || !result.success()) {
            String error = result != null ? result.error() : "no result";
            log.warn("Deposit sink call failed for record {}: {}", id, error);
            throw new ExternalCallFailureException("deposit.finalize.sink", "deposit contract call failed: " + error);
        }
        log.info("Deposit record {} submitted to deposit contract (txHash={})", id, result.txHash());
        return DepositVo.from(record);
    }

    /**
     * 取消并退款（任一未终结状态 → CANCELLED）。记录被删除，台账退回占用，
     * 最后将一个质押单位转回付款方。
     */
    @Transactional
    public DepositVo cancel(String caller, Long id) {
        DepositRecord record = lockRecord(id, DepositAction.CANCEL);
        requireHolder(record, caller, "deposit.cancel");
        rejectVaultManaged(record, "deposit.cancel");
        LocalDateTime now = now();
        cancellationPolicy.check(record, now);
        DepositState from = record.getState();
        DepositState next = stateMachine.next(from, DepositAction.CANCEL);

        if (depositRecordMapper.deleteIfState(id, from) == 0) {
            throw new StateViolationException("deposit.cancel", List.of(from), DepositState.NONE);
        }
        custodyLedgerService.refund(id, record.getAmount());

        lifecycleEventService.record(LifecycleSubject.DEPOSIT, id, "cancel", from, next, caller,
                "refundTo=" + record.getDepositorRef());

        ChainCallResult result = valueTransfer.send(record.getDepositorRef(), record.getAmount(), AssetKind.NATIVE);
        if (result == null || !result.success()) {
            String error = result != null ? result.error() : "no result";
            log.warn("Refund transfer failed for record {} to {}: {}", id, record.getDepositorRef(), error);
            throw new ExternalCallFailureException("deposit.cancel.refund", "refund transfer failed: " + error);
        }
        log.info("Deposit record {} refunded to {} (txHash={})", id, record.getDepositorRef(), result.txHash());

        record.setState(next);
        record.setUpdatedAt(now);
        return DepositVo.from(record);
    }

    /**
     * 转让记录句柄。仅在 FINALIZED 后允许；未终结的记录句柄被锁定（HANDLE_LOCKED）。
     */
    @Transactional
    public DepositVo transferHandle(String caller, Long id, String newOwner) {
        DepositRecord record = depositRecordMapper.lockByIdForUpdate(id)
                .orElseThrow(() -> new StateViolationException(HANDLE_LOCKED, "deposit.transfer",
                        "[" + DepositState.FINALIZED + "]", DepositState.NONE.name()));
        if (!HexUtils.sameAddress(caller, record.getOwnerRef())) {
            throw new AuthorizationException("deposit.transfer", caller);
        }
        if (record.getState() != DepositState.FINALIZED) {
            throw new StateViolationException(HANDLE_LOCKED, "deposit.transfer",
                    "[" + DepositState.FINALIZED + "]", record.getState().name());
        }
        String target = HexUtils.normalizeAddress("newOwner", newOwner);
        if (depositRecordMapper.updateOwnerIfFinalized(id, record.getOwnerRef(), target) == 0) {
            throw new StateViolationException(HANDLE_LOCKED, "deposit.transfer",
                    "[" + DepositState.FINALIZED + "]", "CHANGED");
        }
        String previous = record.getOwnerRef();
        record.setOwnerRef(target);
        record.setUpdatedAt(now());
        lifecycleEventService.record(LifecycleSubject.DEPOSIT, id, "transfer", record.getState(), record.getState(),
                caller, "from=" + previous + ", to=" + target);
        return DepositVo.from(record);
    }

    /**
     * 标记 FINALIZED 验证者已退出（金库赎回流程调用）。
     */
    @Transactional
    public DepositRecord markExited(Long id, long exitEpoch) {
        DepositRecord record = depositRecordMapper.lockByIdForUpdate(id)
                .orElseThrow(() -> new StateViolationException("deposit.exit", List.of(DepositState.FINALIZED), DepositState.NONE));
        if (record.getState() != DepositState.FINALIZED) {
            throw new StateViolationException("deposit.exit", List.of(DepositState.FINALIZED), record.getState());
        }
        if (record.getExitEpoch() != null || depositRecordMapper.markExited(id, exitEpoch) == 0) {
            throw new StateViolationException(StateViolationException.STATE_VIOLATION, "deposit.exit",
                    "[FINALIZED]", "FINALIZED(exited)");
        }
        record.setExitEpoch(exitEpoch);
        return record;
    }

    /**
     * 查询记录；不存在的 id 返回 state=NONE。
     */
    public DepositVo get(Long id) {
        return depositRecordMapper.findById(id)
                .map(DepositVo::from)
                .orElseGet(() -> {
                    DepositVo none = new DepositVo();
                    none.setId(id);
                    none.setState(DepositState.NONE);
                    return none;
                });
    }

    public Optional<DepositRecord> find(Long id) {
        return depositRecordMapper.findById(id);
    }

    public PageVo<DepositVo> listByOwner(String owner, int page, int size) {
        int safePage = Math.max(1, page);
        int safeSize = Math.min(Math.max(1, size), 100);
        long total = depositRecordMapper.countByOwner(owner);
        List<DepositVo> list = depositRecordMapper.findByOwnerPaginated(owner, (safePage - 1) * safeSize, safeSize)
                .stream()
                .map(DepositVo::from)
                .collect(Collectors.toList());
        return new PageVo<>(total, safePage, safeSize, list);
    }

    /**
     * 查询最早可取消时间；记录不存在时视为 NONE（永不可取消）。
     */
    public CancellationVo cancellableAt(Long id) {
        DepositRecord record = depositRecordMapper.findById(id).orElse(null);
        DepositState state = record != null ? record.getState() : DepositState.NONE;
        LocalDateTime now = now();
        return new CancellationVo(id, state,
                cancellationPolicy.isCancellable(record, now),
                cancellationPolicy.availableAt(record).orElse(null));
    }

    private DepositRecord lockRecord(Long id, DepositAction action) {
        Optional<DepositRecord> locked = depositRecordMapper.lockByIdForUpdate(id);
        if (locked.isEmpty()) {
            // 不存在的记录即 NONE
            throw new StateViolationException("deposit." + action.name().toLowerCase(),
                    stateMachine.table().statesAllowing(action), DepositState.NONE);
        }
        return locked.get();
    }

    private void transition(DepositRecord record, DepositState from, DepositState next, LocalDateTime now, String guard) {
        record.setState(next);
        record.setUpdatedAt(now);
        if (depositRecordMapper.updateIfState(record, from) == 0) {
            DepositState actual = depositRecordMapper.findById(record.getId())
                    .map(DepositRecord::getState)
                    .orElse(DepositState.NONE);
            throw new StateViolationException(guard, List.of(from), actual);
        }
    }

    /**
     * 存在 PENDING 金库申购请求的记录只能经由金库推进或取消，否则申购请求会失去关联记录。
     */
    private void rejectVaultManaged(DepositRecord record, String guard) {
        if (vaultRequestMapper.countPendingDepositByValidator(record.getId()) > 0) {
            throw new StateViolationException(VAULT_MANAGED, guard, "[no pending vault request]", "VAULT_PENDING");
        }
    }

    /**
     * 当前时间截断到微秒，与 DATETIME(6) 列一致，冷静期计算不受舍入影响。
     */
    private LocalDateTime now() {
        return LocalDateTime.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private void requireHolder(DepositRecord record, String caller, String guard) {
        if (!HexUtils.sameAddress(caller, record.getWithdrawalAddress())
                && !HexUtils.sameAddress(caller, record.getOwnerRef())) {
            throw new AuthorizationException(guard, caller);
        }
    }

    private DepositData toDepositData(DepositRecord record) {
        long amountGwei = record.getAmount().divide(StakingProperties.WEI_PER_GWEI).longValueExact();
        return new DepositData(
                HexUtils.decode("pubkey", record.getPubkey()),
                HexUtils.decode("withdrawalCredentials", record.getWithdrawalCredentials()),
                HexUtils.decode("signature", record.getSignature()),
                amountGwei);
    }
}
