package com.slb.staking_backend.modules.custody.service;

import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.chain.model.IncomingTransfer;
import com.slb.staking_backend.support.FakeFundingReceiptMapper;
import com.slb.staking_backend.support.MutableClock;
import com.slb.staking_backend.support.RecordingChainGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FundingVerifierTest {

    private static final String ALICE = "0x1111111111111111111111111111111111111111";
    private static final String BOB = "0x2222222222222222222222222222222222222222";
    private static final String CUSTODY = "0x00000000000000000000000000000000000000dd";
    private static final BigInteger STAKE_UNIT = new BigInteger("32000000000000000000");

    private final RecordingChainGateway chain = new RecordingChainGateway();
    private final FakeFundingReceiptMapper receipts = new FakeFundingReceiptMapper();
    private final StakingProperties properties = new StakingProperties();
    private FundingVerifier verifier;

    @BeforeEach
    void setup() {
        properties.setCustodyAddress(CUSTODY);
        properties.setMinFundingConfirmations(12);
        verifier = new FundingVerifier(chain, receipts, properties, new MutableClock(Instant.parse("2024-03-01T00:00:00Z")));
    }

    @Test
    void verify_acceptsConfirmedStakeUnitFromPayerToCustody() {
        String tx = chain.receive(ALICE, CUSTODY.toUpperCase().replace("0X", "0x"), STAKE_UNIT, 12, true);

        IncomingTransfer transfer = verifier.verify(ALICE, tx.toUpperCase().replace("0X", "0x"));

        assertThat(transfer.valueWei()).isEqualTo(STAKE_UNIT);
        assertThat(receipts.size()).isZero();
    }

    @Test
    void verify_unknownTransaction() {
        assertFails(ALICE, "0x" + "ee".repeat(32), ValidationException.FUNDING_NOT_FOUND);
    }

    @Test
    void verify_malformedHash() {
        assertFails(ALICE, "0x1234", ValidationException.VALIDATION_ERROR);
        assertFails(ALICE, null, ValidationException.VALIDATION_ERROR);
    }

    @Test
    void verify_rejectsEachMismatch() {
        assertFails(ALICE, chain.receive(ALICE, BOB, STAKE_UNIT, 12, true), ValidationException.FUNDING_MISMATCH);
        assertFails(ALICE, chain.receive(BOB, CUSTODY, STAKE_UNIT, 12, true), ValidationException.FUNDING_MISMATCH);
        assertFails(ALICE, chain.receive(ALICE, CUSTODY, STAKE_UNIT, 12, false), ValidationException.FUNDING_MISMATCH);
        assertFails(ALICE, chain.receive(ALICE, CUSTODY, STAKE_UNIT.subtract(BigInteger.ONE), 12, true),
                ValidationException.PAYMENT_NOT_STAKE_UNIT);
        assertFails(ALICE, chain.receive(ALICE, CUSTODY, STAKE_UNIT, 11, true), ValidationException.FUNDING_UNCONFIRMED);
    }

    @Test
    void consume_recordsReceiptAndBlocksReuse() {
        String tx = chain.receive(ALICE, CUSTODY, STAKE_UNIT, 20, true);
        IncomingTransfer transfer = verifier.verify(ALICE, tx);

        verifier.consume(transfer, ALICE, 9L);

        assertThat(receipts.findByTxHash(tx)).get().extracting("depositId").isEqualTo(9L);
        assertFails(ALICE, tx, ValidationException.FUNDING_ALREADY_USED);
        // 两个并发请求都通过了 verify，唯一键保证只有一个能消费
        assertThatThrownBy(() -> verifier.consume(transfer, ALICE, 10L))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ValidationException.FUNDING_ALREADY_USED);
    }

    @Test
    void verify_withoutCustodyAddressConfigured() {
        properties.setCustodyAddress(null);
        String tx = chain.receive(ALICE, CUSTODY, STAKE_UNIT, 12, true);

        assertThatThrownBy(() -> verifier.verify(ALICE, tx)).isInstanceOf(IllegalStateException.class);
    }

    private void assertFails(String payer, String tx, String errorCode) {
        assertThatThrownBy(() -> verifier.verify(payer, tx))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(errorCode);
    }
}
