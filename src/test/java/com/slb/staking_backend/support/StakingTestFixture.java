package com.slb.staking_backend.support;

import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.audit.service.LifecycleEventService;
import com.slb.staking_backend.modules.credential.model.DepositData;
import com.slb.staking_backend.modules.credential.service.DepositDataRootCalculator;
import com.slb.staking_backend.modules.custody.entity.CustodyBalance;
import com.slb.staking_backend.modules.custody.service.CustodyLedgerService;
import com.slb.staking_backend.modules.custody.service.FundingVerifier;
import com.slb.staking_backend.modules.deposit.entity.DepositRecord;
import com.slb.staking_backend.modules.deposit.service.CancellationPolicy;
import com.slb.staking_backend.modules.deposit.service.DepositRegistryService;
import com.slb.staking_backend.modules.deposit.statemachine.DepositStateMachine;
import com.slb.staking_backend.modules.operator.service.OperatorRegistry;
import com.slb.staking_backend.modules.vault.service.VaultRequestService;
import com.slb.staking_backend.modules.vault.statemachine.VaultRequestStateMachine;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 不启动 Spring 上下文，用内存表把存款、台账、金库服务整体装配起来。
 * <p>{@link #tx(Supplier)} 在异常时恢复所有内存表，模拟 @Transactional 的回滚。</p>
 */
public class StakingTestFixture {

    public static final String OWNER = "0x00000000000000000000000000000000000000aa";
    public static final String OPERATOR = "0x00000000000000000000000000000000000000bb";
    public static final String VAULT = "0x00000000000000000000000000000000000000cc";
    public static final String ALICE = "0x1111111111111111111111111111111111111111";
    public static final String BOB = "0x2222222222222222222222222222222222222222";
    public static final String CAROL = "0x3333333333333333333333333333333333333333";
    public static final String CUSTODY = "0x00000000000000000000000000000000000000dd";

    public static final BigInteger STAKE_UNIT = new BigInteger("32000000000000000000");

    public final StakingProperties properties = new StakingProperties();
    public final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));

    public final FakeDepositRecordMapper records = new FakeDepositRecordMapper();
    public final FakeVaultRequestMapper vaultRequests = new FakeVaultRequestMapper();
    public final FakeVaultShareMapper shares = new FakeVaultShareMapper();
    public final FakeCustodyBalanceMapper custodyBalance = new FakeCustodyBalanceMapper();
    public final FakeCustodyJournalMapper custodyJournal = new FakeCustodyJournalMapper();
    public final FakeFundingReceiptMapper fundingReceipts = new FakeFundingReceiptMapper();
    public final FakeOperatorMapper operators = new FakeOperatorMapper();
    public final FakeLifecycleEventMapper events = new FakeLifecycleEventMapper();
    public final RecordingChainGateway chain = new RecordingChainGateway();

    public final DepositDataRootCalculator rootCalculator = new DepositDataRootCalculator();
    public final DepositStateMachine depositStateMachine = new DepositStateMachine();
    public final LifecycleEventService lifecycleEventService;
    public final OperatorRegistry operatorRegistry;
    public final CustodyLedgerService custodyLedgerService;
    public final FundingVerifier fundingVerifier;
    public final CancellationPolicy cancellationPolicy;
    public final DepositRegistryService registry;
    public final VaultRequestService vault;

    private final List<Rollbackable> tables;

    public StakingTestFixture() {
        properties.setOwnerAddress(OWNER);
        properties.setVaultAddress(VAULT);
        properties.setCustodyAddress(CUSTODY);
        records.linkVaultRequests(vaultRequests);

        lifecycleEventService = new LifecycleEventService(events, clock);
        operatorRegistry = new OperatorRegistry(operators, properties, clock);
        custodyLedgerService = new CustodyLedgerService(custodyBalance, custodyJournal, records, vaultRequests,
                properties, clock);
        fundingVerifier = new FundingVerifier(chain, fundingReceipts, properties, clock);
        cancellationPolicy = new CancellationPolicy(properties, depositStateMachine);
        registry = new DepositRegistryService(records, depositStateMachine, rootCalculator, cancellationPolicy,
                custodyLedgerService, fundingVerifier, vaultRequests, operatorRegistry, lifecycleEventService,
                chain, chain, properties, clock);
        vault = new VaultRequestService(vaultRequests, shares, new VaultRequestStateMachine(), registry, records,
                custodyLedgerService, operatorRegistry, lifecycleEventService, chain, properties, clock);

        tables = List.of(records, vaultRequests, shares, custodyBalance, custodyJournal, fundingReceipts, operators,
                events);
        operatorRegistry.setEnabled(OWNER, OPERATOR, true);
    }

    /**
     * 以单个事务执行：抛出运行时异常时恢复全部内存表后重新抛出。
     */
    public <T> T tx(Supplier<T> work) {
        Map<Rollbackable, Object> snapshots = new LinkedHashMap<>();
        for (Rollbackable table : tables) {
            snapshots.put(table, table.snapshot());
        }
        try {
            return work.get();
        } catch (RuntimeException e) {
            snapshots.forEach(Rollbackable::restore);
            throw e;
        }
    }

    /**
     * payer 向托管地址转入一个质押单位（已充分确认），返回付款交易哈希。
     */
    public String fund(String payer) {
        return fund(payer, STAKE_UNIT);
    }

    public String fund(String payer, BigInteger amountWei) {
        return chain.receive(payer, CUSTODY, amountWei, properties.getMinFundingConfirmations(), true);
    }

    public static String pubkeyHex(int seed) {
        return HexUtils.encode(filled(DepositData.PUBKEY_LENGTH, seed));
    }

    public static String signatureHex(int seed) {
        return HexUtils.encode(filled(DepositData.SIGNATURE_LENGTH, seed + 1));
    }

    /**
     * 按记录当前存储的凭证独立计算 deposit_data_root。
     */
    public String rootHexFor(Long recordId) {
        DepositRecord record = records.findById(recordId).orElseThrow();
        DepositData data = new DepositData(
                HexUtils.decode("pubkey", record.getPubkey()),
                HexUtils.decode("withdrawalCredentials", record.getWithdrawalCredentials()),
                HexUtils.decode("signature", record.getSignature()),
                properties.stakeUnitGwei());
        return HexUtils.encode(rootCalculator.computeRoot(data));
    }

    public CustodyBalance balance() {
        return custodyBalance.find().orElseThrow();
    }

    /**
     * 合约持有资金 = pending + exited（committed 已转入存款合约）。
     */
    public BigInteger held() {
        CustodyBalance balance = balance();
        return balance.getPending().add(balance.getExited());
    }

    public void disableOperator(String address) {
        operatorRegistry.setEnabled(OWNER, address, false);
    }

    private static byte[] filled(int length, int seed) {
        byte[] out = new byte[length];
        Arrays.fill(out, (byte) seed);
        for (int i = 0; i < length; i += 7) {
            out[i] = (byte) (seed * 31 + i);
        }
        return out;
    }
}
