package com.slb.staking_backend.modules.deposit.service;

import com.slb.staking_backend.common.exception.AuthenticityException;
import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.exception.CooldownActiveException;
import com.slb.staking_backend.common.exception.ExternalCallFailureException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.modules.audit.enums.LifecycleSubject;
import com.slb.staking_backend.modules.audit.entity.LifecycleEvent;
import com.slb.staking_backend.modules.chain.model.AssetKind;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import com.slb.staking_backend.modules.deposit.vo.CancellationVo;
import com.slb.staking_backend.modules.deposit.vo.DepositVo;
import com.slb.staking_backend.support.RecordingChainGateway;
import com.slb.staking_backend.support.StakingTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.util.List;

import static com.slb.staking_backend.support.StakingTestFixture.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 真实服务 + 内存表的端到端生命周期。
 */
class DepositLifecycleScenarioTest {

    private StakingTestFixture f;

    @BeforeEach
    void setup() {
        f = new StakingTestFixture();
    }

    @Test
    void happyPath_createAssignConfirmFinalize() {
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();
        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.REQUESTED);
        assertThat(f.balance().getPending()).isEqualTo(STAKE_UNIT);

        f.tx(() -> f.registry.assign(OPERATOR, id, pubkeyHex(1), signatureHex(1)));
        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.ASSIGNED);

        String root = f.rootHexFor(id);
        f.tx(() -> f.registry.confirm(ALICE, id, root));
        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.CONFIRMED);

        DepositVo finalized = f.tx(() -> f.registry.finalizeDeposit(OPERATOR, id));
        assertThat(finalized.getState()).isEqualTo(DepositState.FINALIZED);

        assertThat(f.chain.deposits()).hasSize(1);
        RecordingChainGateway.DepositCall call = f.chain.deposits().get(0);
        assertThat(HexUtils.encode(call.data().getPubkey())).isEqualTo(pubkeyHex(1));
        assertThat(HexUtils.encode(call.data().getSignature())).isEqualTo(signatureHex(1));
        assertThat(HexUtils.encode(call.data().getWithdrawalCredentials()))
                .isEqualTo(f.registry.get(id).getWithdrawalCredentials());
        assertThat(HexUtils.encode(call.root())).isEqualTo(root);
        assertThat(call.valueWei()).isEqualTo(STAKE_UNIT);

        assertThat(f.balance().getPending()).isZero();
        assertThat(f.balance().getCommitted()).isEqualTo(STAKE_UNIT);

        List<LifecycleEvent> history = f.lifecycleEventService.history(LifecycleSubject.DEPOSIT, id);
        assertThat(history).extracting(LifecycleEvent::getAction)
                .containsExactly("create", "assign", "confirm", "finalize");
    }

    @Test
    void immediateCancel_refundsExactlyAndDeletesRecord() {
        Long id = f.tx(() -> f.registry.create(ALICE, BOB, f.fund(ALICE))).getId();

        DepositVo vo = f.tx(() -> f.registry.cancel(ALICE, id));

        assertThat(vo.getState()).isEqualTo(DepositState.CANCELLED);
        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.NONE);
        assertThat(f.records.size()).isZero();
        assertThat(f.chain.transfers()).containsExactly(
                new RecordingChainGateway.TransferCall(ALICE, STAKE_UNIT, AssetKind.NATIVE));
        assertThat(f.held()).isZero();
    }

    @Test
    void withdrawalAddressHolderMayCancel() {
        Long id = f.tx(() -> f.registry.create(ALICE, BOB, f.fund(ALICE))).getId();

        f.tx(() -> f.registry.cancel(BOB, id));

        assertThat(f.chain.totalTransferredTo(ALICE)).isEqualTo(STAKE_UNIT);
        assertThat(f.chain.totalTransferredTo(BOB)).isZero();
    }

    @Test
    void confirmedCancel_waitsForCooldown() {
        Long id = confirmedRecord();

        f.clock.advance(Duration.ofSeconds(1));
        assertThatThrownBy(() -> f.tx(() -> f.registry.cancel(ALICE, id)))
                .isInstanceOf(CooldownActiveException.class);
        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.CONFIRMED);
        CancellationVo window = f.registry.cancellableAt(id);
        assertThat(window.isCancellable()).isFalse();

        f.clock.advance(Duration.ofDays(7));
        f.tx(() -> f.registry.cancel(ALICE, id));

        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.NONE);
        assertThat(f.chain.totalTransferredTo(ALICE)).isEqualTo(STAKE_UNIT);
        assertThat(f.held()).isZero();
    }

    @Test
    void wrongRoot_leavesRecordAssigned() {
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();
        f.tx(() -> f.registry.assign(OPERATOR, id, pubkeyHex(1), signatureHex(1)));
        String foreignRoot = rootOfOtherKeys();

        assertThatThrownBy(() -> f.tx(() -> f.registry.confirm(ALICE, id, foreignRoot)))
                .isInstanceOf(AuthenticityException.class);

        DepositVo vo = f.registry.get(id);
        assertThat(vo.getState()).isEqualTo(DepositState.ASSIGNED);
        assertThat(vo.getCommittedRoot()).isNull();
    }

    @Test
    void wrongRoot_recoveredByCancelAndRecreate() {
        Long first = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();
        f.tx(() -> f.registry.assign(OPERATOR, first, pubkeyHex(1), signatureHex(1)));
        String foreignRoot = rootOfOtherKeys();
        assertThatThrownBy(() -> f.tx(() -> f.registry.confirm(ALICE, first, foreignRoot)))
                .isInstanceOf(AuthenticityException.class);

        f.tx(() -> f.registry.cancel(ALICE, first));
        Long second = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();

        assertThat(second).isNotEqualTo(first);
        assertThat(f.balance().getPending()).isEqualTo(STAKE_UNIT);
    }

    @Test
    void finalizeSinkFailure_rollsBackEverything() {
        Long id = confirmedRecord();
        int eventsBefore = f.lifecycleEventService.history(LifecycleSubject.DEPOSIT, id).size();
        int journalBefore = f.custodyJournal.size();

        f.chain.failNext();
        assertThatThrownBy(() -> f.tx(() -> f.registry.finalizeDeposit(OPERATOR, id)))
                .isInstanceOf(ExternalCallFailureException.class);

        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.CONFIRMED);
        assertThat(f.balance().getPending()).isEqualTo(STAKE_UNIT);
        assertThat(f.balance().getCommitted()).isZero();
        assertThat(f.custodyJournal.size()).isEqualTo(journalBefore);
        assertThat(f.lifecycleEventService.history(LifecycleSubject.DEPOSIT, id)).hasSize(eventsBefore);
        assertThat(f.chain.deposits()).isEmpty();

        f.tx(() -> f.registry.finalizeDeposit(OPERATOR, id));
        assertThat(f.chain.deposits()).hasSize(1);
    }

    @Test
    void refundFailure_keepsRecordOpen() {
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();

        f.chain.failNext();
        assertThatThrownBy(() -> f.tx(() -> f.registry.cancel(ALICE, id)))
                .isInstanceOf(ExternalCallFailureException.class);

        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.REQUESTED);
        assertThat(f.balance().getPending()).isEqualTo(STAKE_UNIT);
    }

    @Test
    void stepsCannotBeSkippedOrRepeated() {
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();

        assertThatThrownBy(() -> f.tx(() -> f.registry.finalizeDeposit(OPERATOR, id)))
                .isInstanceOf(StateViolationException.class);
        f.tx(() -> f.registry.assign(OPERATOR, id, pubkeyHex(1), signatureHex(1)));
        assertThatThrownBy(() -> f.tx(() -> f.registry.assign(OPERATOR, id, pubkeyHex(2), signatureHex(2))))
                .isInstanceOf(StateViolationException.class);
        assertThat(f.registry.get(id).getPubkey()).isEqualTo(pubkeyHex(1));
    }

    @Test
    void finalizedRecord_cannotBeCancelledButHandleMoves() {
        Long id = confirmedRecord();
        f.tx(() -> f.registry.finalizeDeposit(OPERATOR, id));

        assertThatThrownBy(() -> f.tx(() -> f.registry.cancel(ALICE, id)))
                .isExactlyInstanceOf(StateViolationException.class);

        f.tx(() -> f.registry.transferHandle(ALICE, id, CAROL));
        assertThat(f.registry.get(id).getOwnerRef()).isEqualTo(CAROL);
        assertThatThrownBy(() -> f.tx(() -> f.registry.transferHandle(ALICE, id, BOB)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void disabledOperator_losesAccess() {
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();
        f.disableOperator(OPERATOR);

        assertThatThrownBy(() -> f.tx(() -> f.registry.assign(OPERATOR, id, pubkeyHex(1), signatureHex(1))))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void listByOwner_pagesNewestFirst() {
        for (int i = 0; i < 3; i++) {
            f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE)));
        }
        f.tx(() -> f.registry.create(BOB, BOB, f.fund(BOB)));

        var page = f.registry.listByOwner(ALICE, 1, 2);

        assertThat(page.getTotal()).isEqualTo(3L);
        assertThat(page.getList()).hasSize(2);
        assertThat(page.getList().get(0).getId()).isGreaterThan(page.getList().get(1).getId());
        assertThat(page.getList()).allSatisfy(vo -> assertThat(vo.getAmount()).isEqualTo(STAKE_UNIT.toString()));
    }

    private Long confirmedRecord() {
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE))).getId();
        f.tx(() -> f.registry.assign(OPERATOR, id, pubkeyHex(1), signatureHex(1)));
        String root = f.rootHexFor(id);
        f.tx(() -> f.registry.confirm(ALICE, id, root));
        return id;
    }

    private String rootOfOtherKeys() {
        StakingTestFixture other = new StakingTestFixture();
        Long id = other.tx(() -> other.registry.create(ALICE, ALICE, other.fund(ALICE))).getId();
        other.tx(() -> other.registry.assign(OPERATOR, id, pubkeyHex(2), signatureHex(2)));
        return other.rootHexFor(id);
    }

    @Test
    void paymentMustBeExactlyOneStakeUnit() {
        assertThatThrownBy(() -> f.tx(() -> f.registry.create(ALICE, ALICE, f.fund(ALICE, STAKE_UNIT.add(BigInteger.ONE)))))
                .hasMessageContaining("stake unit");
        assertThat(f.records.size()).isZero();
    }

    @Test
    void createWithoutPayment_isRejectedAndNothingCanBeRefunded() {
        String neverPaid = "0x" + "77".repeat(32);

        assertThatThrownBy(() -> f.tx(() -> f.registry.create(CAROL, CAROL, neverPaid)))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ValidationException.FUNDING_NOT_FOUND);
        assertThatThrownBy(() -> f.tx(() -> f.registry.cancel(CAROL, 1L)))
                .isInstanceOf(StateViolationException.class);

        assertThat(f.records.size()).isZero();
        assertThat(f.balance().getPending()).isZero();
        assertThat(f.chain.transfers()).isEmpty();
    }

    @Test
    void paymentFromSomeoneElse_cannotOpenRecord() {
        String alicePaid = f.fund(ALICE);

        assertThatThrownBy(() -> f.tx(() -> f.registry.create(CAROL, CAROL, alicePaid)))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ValidationException.FUNDING_MISMATCH);
        assertThat(f.records.size()).isZero();
    }

    @Test
    void fundingIsSingleUse_evenAfterRefund() {
        String funding = f.fund(ALICE);
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, funding)).getId();
        f.tx(() -> f.registry.cancel(ALICE, id));
        assertThat(f.chain.totalTransferredTo(ALICE)).isEqualTo(STAKE_UNIT);

        assertThatThrownBy(() -> f.tx(() -> f.registry.create(ALICE, ALICE, funding)))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ValidationException.FUNDING_ALREADY_USED);
        assertThat(f.chain.totalTransferredTo(ALICE)).isEqualTo(STAKE_UNIT);
        assertThat(f.balance().getPending()).isZero();
    }

    @Test
    void rejectedCreate_leavesFundingUnused() {
        String funding = f.fund(ALICE);

        assertThatThrownBy(() -> f.tx(() -> f.registry.create(ALICE, "0x1234", funding)))
                .isInstanceOf(ValidationException.class);
        Long id = f.tx(() -> f.registry.create(ALICE, ALICE, funding)).getId();

        assertThat(f.registry.get(id).getState()).isEqualTo(DepositState.REQUESTED);
        assertThat(f.fundingReceipts.findByTxHash(funding)).get()
                .extracting("depositId").isEqualTo(id);
    }
}
