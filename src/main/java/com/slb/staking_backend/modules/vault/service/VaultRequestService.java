package com.slb.staking_backend.modules.vault.service;

import com.slb.staking_backend.common.exception.AlreadyClaimedException;
import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.exception.ExternalCallFailureException;
import com.slb.staking_backend.common.exception.LedgerInvariantException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.common.vo.PageVo;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import com.slb.staking_backend.modules.audit.service.LifecycleEventService;
import com.slb.staking_backend.modules.chain.model.AssetKind;
import com.slb.staking_backend.modules.chain.model.ChainCallResult;
import com.slb.staking_backend.modules.chain.service.ValueTransfer;
import com.slb.staking_backend.modules.custody.service.CustodyLedgerService;
import com.slb.staking_backend.modules.deposit.entity.DepositRecord;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import com.slb.staking_backend.modules.deposit.mapper.DepositRecordMapper;
import com.slb.staking_backend.modules.deposit.service.DepositRegistryService;
import com.slb.staking_backend.modules.operator.service.OperatorRegistry;
import com.slb.staking_backend.modules.vault.entity.VaultRequest;
import com.slb.staking_backend.modules.vault.entity.VaultShareBalance;
import com.slb.staking_backend.modules.vault.enums.VaultAction;
import com.slb.staking_backend.modules.vault.enums.VaultRequestKind;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import com.slb.staking_backend.modules.vault.mapper.VaultRequestMapper;
import com.slb.staking_backend.modules.vault.mapper.VaultShareMapper;
import com.slb.staking_backend.modules.vault.statemachine.VaultRequestStateMachine;
import com.slb.staking_backend.modules.vault.vo.VaultRequestVo;
import com.slb.staking_backend.modules.vault.vo.VaultShareVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 异步金库：存入方向（付款 → 验证者上线 → 领取份额）与赎回方向（锁定份额 → 验证者退出 → 领取质押单位）。
 * <p>金库地址同时是存款记录的句柄持有人与提款地址；存款记录本身的流转全部委托给 {@link DepositRegistryService}。</p>
 */
@Service
@Slf4j
public class VaultRequestService {

    private final VaultRequestMapper vaultRequestMapper;
    private final VaultShareMapper vaultShareMapper;
    private final VaultRequestStateMachine stateMachine;
    private final DepositRegistryService depositRegistryService;
    private final DepositRecordMapper depositRecordMapper;
    private final CustodyLedgerService custodyLedgerService;
    private final OperatorRegistry operatorRegistry;
    private final LifecycleEventService lifecycleEventService;
    private final ValueTransfer valueTransfer;
    private final StakingProperties stakingProperties;
    private final Clock clock;

    public VaultRequestService(VaultRequestMapper vaultRequestMapper,
                               VaultShareMapper vaultShareMapper,
                               VaultRequestStateMachine stateMachine,
                               DepositRegistryService depositRegistryService,
                               DepositRecordMapper depositRecordMapper,
                               CustodyLedgerService custodyLedgerService,
                               OperatorRegistry operatorRegistry,
                               LifecycleEventService lifecycleEventService,
                               ValueTransfer valueTransfer,
                               StakingProperties stakingProperties,
                               Clock clock) {
        this.vaultRequestMapper = vaultRequestMapper;
        this.vaultShareMapper = vaultShareMapper;
        this.stateMachine = stateMachine;
        this.depositRegistryService = depositRegistryService;
        this.depositRecordMapper = depositRecordMapper;
        this.custodyLedgerService = custodyLedgerService;
        this.operatorRegistry = operatorRegistry;
        this.lifecycleEventService = lifecycleEventService;
        this.valueTransfer = valueTransfer;
        this.stakingProperties = stakingProperties;
        this.clock = clock;
    }

    /* ----------- 存入方向 ----------- */

    /**
     * 申购：调用方以一笔已确认的付款交易在注册表中开一条金库持有的存款记录。
     */
    @Transactional
    public VaultRequestVo requestDeposit(String caller, String controller, String fundingTxHash) {
        String vault = vaultAddress();
        String controllerRef = resolveController(caller, controller);
        DepositRecord record = depositRegistryService.createRecord(vault, caller, vault, fundingTxHash);

        LocalDateTime now = LocalDateTime.now(clock);
        VaultRequest request = new VaultRequest();
        request.setKind(VaultRequestKind.DEPOSIT);
        request.setState(VaultRequestState.PENDING);
        request.setAmount(record.getAmount());
        request.setOwnerRef(caller);
        request.setControllerRef(controllerRef);
        request.setLinkedValidatorId(record.getId());
        request.setCreatedAt(now);
        request.setUpdatedAt(now);
        vaultRequestMapper.insert(request);

        lifecycleEventService.record(LifecycleSubject.VAULT_REQUEST, request.getId(), "requestDeposit",
                null, VaultRequestState.PENDING, caller, "validator=" + record.getId());
        return VaultRequestVo.from(request);
    }

    /**
     * keeper 推进存入请求：PENDING → PROCESSING，以金库身份确认 deposit_data_root，
     * PROCESSING → CLAIMABLE，最后提交存款合约（外部调用在最后）。
     */
    @Transactional
    public VaultRequestVo processValidatorDeposit(String keeper, Long id, String suppliedRootHex) {
        operatorRegistry.requireOperator(keeper, "vault.processDeposit");
        VaultRequest request = lockRequest(id, VaultRequestKind.DEPOSIT, VaultAction.PROCESS);

        advance(request, VaultAction.PROCESS, keeper, "processDeposit", null);
        depositRegistryService.confirm(vaultAddress(), request.getLinkedValidatorId(), suppliedRootHex);
        advance(request, VaultAction.COMPLETE, keeper, "processDeposit", null);
        depositRegistryService.finalizeDeposit(keeper, request.getLinkedValidatorId());
        return VaultRequestVo.from(request);
    }

    @Transactional
    public VaultRequestVo claimDeposit(String caller, Long id) {
        VaultRequest request = lockRequest(id, VaultRequestKind.DEPOSIT, VaultAction.CLAIM);
        requireOwnerOrController(request, caller, "vault.claimDeposit");
        rejectRepeatedClaim(request);

        request.setClaimedAt(LocalDateTime.now(clock));
        advance(request, VaultAction.CLAIM, caller, "claimDeposit", "minted=" + request.getAmount());
        mintShares(request.getOwnerRef(), request.getAmount());
        return VaultRequestVo.from(request);
    }

    /**
     * 取消存入请求（仅 PENDING），关联存款记录随之取消并退款给付款方。
     */
    @Transactional
    public VaultRequestVo cancelDeposit(String caller, Long id) {
        VaultRequest request = lockRequest(id, VaultRequestKind.DEPOSIT, VaultAction.CANCEL);
        requireOwnerOrController(request, caller, "vault.cancelDeposit");

        advance(request, VaultAction.CANCEL, caller, "cancelDeposit", null);
        depositRegistryService.cancel(vaultAddress(), request.getLinkedValidatorId());
        return VaultRequestVo.from(request);
    }

    /* ----------- 赎回方向 ----------- */

    /**
     * 申请赎回一个质押单位：锁定份额，并关联一个可退出的金库验证者（指定的，或最早上线的）。
     */
    @Transactional
    public VaultRequestVo requestRedeem(String owner, String controller, BigInteger shares, Long validatorId) {
        BigInteger stakeUnit = stakingProperties.getStakeUnitWei();
        if (shares == null || shares.compareTo(stakeUnit) != 0) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "vault.redeem.shares",
                    "redeem shares must equal the stake unit of " + stakeUnit);
        }
        String controllerRef = resolveController(owner, controller);
        DepositRecord validator = resolveExitableValidator(validatorId);

        lockShares(owner, shares);

        LocalDateTime now = LocalDateTime.now(clock);
        VaultRequest request = new VaultRequest();
        request.setKind(VaultRequestKind.REDEEM);
        request.setState(VaultRequestState.PENDING);
        request.setAmount(shares);
        request.setOwnerRef(owner);
        request.setControllerRef(controllerRef);
        request.setLinkedValidatorId(validator.getId());
        request.setCreatedAt(now);
        request.setUpdatedAt(now);
        vaultRequestMapper.insert(request);

        lifecycleEventService.record(LifecycleSubject.VAULT_REQUEST, request.getId(), "requestRedeem",
                null, VaultRequestState.PENDING, owner, "validator=" + validator.getId());
        return VaultRequestVo.from(request);
    }

    /**
     * keeper 已提交退出：PENDING → PROCESSING，之后不可再取消。
     */
    @Transactional
    public VaultRequestVo markRedeemProcessing(String keeper, Long id) {
        operatorRegistry.requireOperator(keeper, "vault.markRedeemProcessing");
        VaultRequest request = lockRequest(id, VaultRequestKind.REDEEM, VaultAction.PROCESS);
        advance(request, VaultAction.PROCESS, keeper, "markRedeemProcessing", null);
        return VaultRequestVo.from(request);
    }

    /**
     * 验证者已退出：请求进入 CLAIMABLE，验证者记录写入 exitEpoch，托管台账 committed → exited。
     * PENDING 的请求会先记录一次 PROCESSING 再完成。
     */
    @Transactional
    public VaultRequestVo processRedeem(String keeper, Long id, long exitEpoch) {
        operatorRegistry.requireOperator(keeper, "vault.processRedeem");
        if (exitEpoch < 0) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "vault.processRedeem.exitEpoch",
                    "exit epoch must not be negative");
        }
        VaultRequest request = lockRequest(id, VaultRequestKind.REDEEM, VaultAction.COMPLETE);
        if (request.getState() == VaultRequestState.PENDING) {
            advance(request, VaultAction.PROCESS, keeper, "processRedeem", null);
        }
        request.setExitEpoch(exitEpoch);
        advance(request, VaultAction.COMPLETE, keeper, "processRedeem", "exitEpoch=" + exitEpoch);

        depositRegistryService.markExited(request.getLinkedValidatorId(), exitEpoch);
        custodyLedgerService.exit(id, request.getAmount());
        return VaultRequestVo.from(request);
    }

    /**
     * 领取赎回：燃烧锁定份额，台账 payout，最后向请求所有人转出一个质押单位。重复领取抛出 AlreadyClaimed。
     */
    @Transactional
    public VaultRequestVo claimRedeem(String caller, Long id) {
        VaultRequest request = lockRequest(id, VaultRequestKind.REDEEM, VaultAction.CLAIM);
        requireOwnerOrController(request, caller, "vault.claimRedeem");
        rejectRepeatedClaim(request);

        request.setClaimedAt(LocalDateTime.now(clock));
        advance(request, VaultAction.CLAIM, caller, "claimRedeem", "payTo=" + request.getOwnerRef());
        burnLockedShares(request.getOwnerRef(), request.getAmount());
        custodyLedgerService.payout(id, request.getAmount());

        ChainCallResult result = valueTransfer.send(request.getOwnerRef(), request.getAmount(), AssetKind.NATIVE);
        if (result == null || !result.success()) {
            String error = result != null ? result.error() : "no result";
            log.warn("Redeem payout failed for request {} to {}: {}", id, request.getOwnerRef(), error);
            throw new ExternalCallFailureException("vault.claimRedeem.payout", "redeem payout failed: " + error);
        }
        log.info("Vault request {} paid {} wei to {} (txHash={})", id, request.getAmount(), request.getOwnerRef(),
                result.txHash());
        return VaultRequestVo.from(request);
    }

    @Transactional
    public VaultRequestVo cancelRedeem(String caller, Long id) {
        VaultRequest request = lockRequest(id, VaultRequestKind.REDEEM, VaultAction.CANCEL);
        requireOwnerOrController(request, caller, "vault.cancelRedeem");
        advance(request, VaultAction.CANCEL, caller, "cancelRedeem", null);
        unlockShares(request.getOwnerRef(), request.getAmount());
        return VaultRequestVo.from(request);
    }

    /* ----------- 查询 ----------- */

    public VaultRequestVo get(Long id) {
        return vaultRequestMapper.findById(id)
                .map(VaultRequestVo::from)
                .orElseThrow(() -> new BizException(404, "NOT_FOUND", "vault.get", "vault request " + id + " not found"));
    }

    public PageVo<VaultRequestVo> listByOwner(String owner, int page, int size) {
        int safePage = Math.max(1, page);
        int safeSize = Math.min(Math.max(1, size), 100);
        long total = vaultRequestMapper.countByOwner(owner);
        List<VaultRequestVo> list = vaultRequestMapper.findByOwnerPaginated(owner, (safePage - 1) * safeSize, safeSize)
                .stream()
                .map(VaultRequestVo::from)
                .collect(Collectors.toList());
        return new PageVo<>(total, safePage, safeSize, list);
    }

    public VaultShareVo shareBalance(String owner) {
        return vaultShareMapper.findByOwner(owner)
                .map(VaultShareVo::from)
                .orElseGet(() -> VaultShareVo.empty(owner));
    }

    /* ----------- 私有工具 ----------- */

    private VaultRequest lockRequest(Long id, VaultRequestKind kind, VaultAction action) {
        VaultRequest request = vaultRequestMapper.lockByIdForUpdate(id)
                .orElseThrow(() -> new BizException(404, "NOT_FOUND", "vault." + action.name().toLowerCase(),
                        "vault request " + id + " not found"));
        if (request.getKind() != kind) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "vault.kind",
                    "vault request " + id + " is a " + request.getKind() + " request");
        }
        return request;
    }

    private void advance(VaultRequest request, VaultAction action, String actor, String label, String detail) {
        VaultRequestState from = request.getState();
        VaultRequestState next = stateMachine.next(from, action);
        request.setState(next);
        request.setUpdatedAt(LocalDateTime.now(clock));
        if (vaultRequestMapper.updateIfState(request, from) == 0) {
            VaultRequestState actual = vaultRequestMapper.findById(request.getId())
                    .map(VaultRequest::getState)
                    .orElse(null);
            throw new StateViolationException("vault." + label, List.of(from), actual);
        }
        lifecycleEventService.record(LifecycleSubject.VAULT_REQUEST, request.getId(), label, from, next, actor, detail);
    }

    private void rejectRepeatedClaim(VaultRequest request) {
        if (request.getState() == VaultRequestState.CLAIMED) {
            throw new AlreadyClaimedException(request.getId());
        }
    }

    private void requireOwnerOrController(VaultRequest request, String caller, String guard) {
        if (!HexUtils.sameAddress(caller, request.getOwnerRef())
                && !HexUtils.sameAddress(caller, request.getControllerRef())) {
            throw new AuthorizationException(guard, caller);
        }
    }

    private DepositRecord resolveExitableValidator(Long validatorId) {
        String vault = vaultAddress();
        if (validatorId == null) {
            return depositRecordMapper.findOldestExitableByOwner(vault)
                    .orElseThrow(() -> new StateViolationException(StateViolationException.STATE_VIOLATION,
                            "vault.redeem.validator", "[FINALIZED, not exited, not linked]", "NONE"));
        }
        DepositRecord record = depositRecordMapper.findById(validatorId)
                .orElseThrow(() -> new StateViolationException("vault.redeem.validator",
                        List.of(DepositState.FINALIZED), DepositState.NONE));
        if (!HexUtils.sameAddress(record.getOwnerRef(), vault)) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "vault.redeem.validator",
                    "validator " + validatorId + " is not held by the vault");
        }
        if (record.getState() != DepositState.FINALIZED) {
            throw new StateViolationException("vault.redeem.validator", List.of(DepositState.FINALIZED), record.getState());
        }
        if (record.getExitEpoch() != null || vaultRequestMapper.countOpenRedeemByValidator(validatorId) > 0) {
            throw new StateViolationException(StateViolationException.STATE_VIOLATION, "vault.redeem.validator",
                    "[FINALIZED, not exited, not linked]", record.getExitEpoch() != null ? "EXITED" : "LINKED");
        }
        return record;
    }

    private void mintShares(String owner, BigInteger amount) {
        LocalDateTime now = LocalDateTime.now(clock);
        Optional<VaultShareBalance> existing = vaultShareMapper.lockByOwnerForUpdate(owner);
        if (existing.isEmpty()) {
            VaultShareBalance balance = new VaultShareBalance();
            balance.setOwnerAddress(owner);
            balance.setAvailable(amount);
            balance.setLocked(BigInteger.ZERO);
            balance.setUpdatedAt(now);
            vaultShareMapper.insert(balance);
            return;
        }
        VaultShareBalance balance = existing.get();
        balance.setAvailable(balance.getAvailable().add(amount));
        balance.setUpdatedAt(now);
        vaultShareMapper.update(balance);
    }

    private void lockShares(String owner, BigInteger shares) {
        VaultShareBalance balance = vaultShareMapper.lockByOwnerForUpdate(owner)
                .filter(b -> b.getAvailable().compareTo(shares) >= 0)
                .orElseThrow(() -> new ValidationException(ValidationException.INSUFFICIENT_SHARES, "vault.redeem.shares",
                        "available shares are below " + shares));
        balance.setAvailable(balance.getAvailable().subtract(shares));
        balance.setLocked(balance.getLocked().add(shares));
        balance.setUpdatedAt(LocalDateTime.now(clock));
        vaultShareMapper.update(balance);
    }

    private void unlockShares(String owner, BigInteger shares) {
        VaultShareBalance balance = lockedBalance(owner, shares);
        balance.setLocked(balance.getLocked().subtract(shares));
        balance.setAvailable(balance.getAvailable().add(shares));
        balance.setUpdatedAt(LocalDateTime.now(clock));
        vaultShareMapper.update(balance);
    }

    private void burnLockedShares(String owner, BigInteger shares) {
        VaultShareBalance balance = lockedBalance(owner, shares);
        balance.setLocked(balance.getLocked().subtract(shares));
        balance.setUpdatedAt(LocalDateTime.now(clock));
        vaultShareMapper.update(balance);
    }

    private VaultShareBalance lockedBalance(String owner, BigInteger shares) {
        return vaultShareMapper.lockByOwnerForUpdate(owner)
                .filter(b -> b.getLocked().compareTo(shares) >= 0)
                .orElseThrow(() -> new LedgerInvariantException("vault.shares.locked",
                        "locked shares of " + owner + " are below " + shares));
    }

    private String resolveController(String caller, String controller) {
        if (!StringUtils.hasText(controller)) {
            return caller;
        }
        return HexUtils.normalizeAddress("controller", controller);
    }

    private String vaultAddress() {
        String vault = stakingProperties.getVaultAddress();
        if (!StringUtils.hasText(vault)) {
            throw new IllegalStateException("app.staking.vault-address is not configured");
        }
        return vault.toLowerCase();
    }
}
