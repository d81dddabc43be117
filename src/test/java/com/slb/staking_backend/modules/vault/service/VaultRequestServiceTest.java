package com.slb.staking_backend.modules.vault.service;

import com.slb.staking_backend.common.exception.AlreadyClaimedException;
import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.exception.ExternalCallFailureException;
import com.slb.staking_backend.common.exception.StateViolationException;
import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.modules.chain.model.AssetKind;
import com.slb.staking_backend.modules.deposit.enums.DepositState;
import com.slb.staking_backend.modules.deposit.service.DepositRegistryService;
import com.slb.staking_backend.modules.vault.enums.VaultRequestKind;
import com.slb.staking_backend.modules.vault.enums.VaultRequestState;
import com.slb.staking_backend.modules.vault.vo.VaultRequestVo;
import com.slb.staking_backend.modules.vault.vo.VaultShareVo;
import com.slb.staking_backend.support.RecordingChainGateway;
import com.slb.staking_backend.support.StakingTestFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.slb.staking_backend.support.StakingTestFixture.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VaultRequestServiceTest {

    private StakingTestFixture f;

    @BeforeEach
    void setup() {
        f = new StakingTestFixture();
    }

    @Test
    void depositRequest_processedAndClaimedMintsShares() {
        VaultRequestVo request = f.tx(() -> f.vault.requestDeposit(ALICE, null, f.fund(ALICE)));
        Long validatorId = request.getLinkedValidatorId();
        assertThat(request.getKind()).isEqualTo(VaultRequestKind.DEPOSIT);
        assertThat(f.registry.get(validatorId).getOwnerRef()).isEqualTo(VAULT);
        assertThat(f.registry.get(validatorId).getWithdrawalAddress()).isEqualTo(VAULT);

        f.tx(() -> f.registry.assign(OPERATOR, validatorId, pubkeyHex(3), signatureHex(3)));
        String root = f.rootHexFor(validatorId);
        VaultRequestVo processed = f.tx(() -> f.vault.processValidatorDeposit(OPERATOR, request.getId(), root));

        assertThat(processed.getState()).isEqualTo(VaultRequestState.CLAIMABLE);
        assertThat(f.registry.get(validatorId).getState()).isEqualTo(DepositState.FINALIZED);
        assertThat(f.chain.deposits()).hasSize(1);

        f.tx(() -> f.vault.claimDeposit(ALICE, request.getId()));
        VaultShareVo shares = f.vault.shareBalance(ALICE);
        assertThat(shares.getAvailable()).isEqualTo(STAKE_UNIT.toString());

        assertThatThrownBy(() -> f.tx(() -> f.vault.claimDeposit(ALICE, request.getId())))
                .isInstanceOf(AlreadyClaimedException.class);
        assertThat(f.vault.shareBalance(ALICE).getAvailable()).isEqualTo(STAKE_UNIT.toString());
    }

    @Test
    void redeem_processedAndClaimedPaysOnce() {
        Long requestId = fundedRedeem();
        assertThat(f.vault.shareBalance(ALICE).getLocked()).isEqualTo(STAKE_UNIT.toString());

        VaultRequestVo processed = f.tx(() -> f.vault.processRedeem(OPERATOR, requestId, 281_000L));
        assertThat(processed.getState()).isEqualTo(VaultRequestState.CLAIMABLE);
        assertThat(processed.getExitEpoch()).isEqualTo(281_000L);
        assertThat(f.balance().getCommitted()).isZero();
        assertThat(f.balance().getExited()).isEqualTo(STAKE_UNIT);

        VaultRequestVo claimed = f.tx(() -> f.vault.claimRedeem(ALICE, requestId));
        assertThat(claimed.getState()).isEqualTo(VaultRequestState.CLAIMED);
        assertThat(f.chain.transfers()).containsExactly(
                new RecordingChainGateway.TransferCall(ALICE, STAKE_UNIT, AssetKind.NATIVE));
        assertThat(f.balance().getExited()).isZero();
        assertThat(f.vault.shareBalance(ALICE).getLocked()).isEqualTo("0");

        assertThatThrownBy(() -> f.tx(() -> f.vault.claimRedeem(ALICE, requestId)))
                .isInstanceOf(AlreadyClaimedException.class);
        assertThat(f.chain.transfers()).hasSize(1);
    }

    @Test
    void redeemPayoutFailure_leavesRequestClaimable() {
        Long requestId = fundedRedeem();
        f.tx(() -> f.vault.processRedeem(OPERATOR, requestId, 10L));

        f.chain.failNext();
        assertThatThrownBy(() -> f.tx(() -> f.vault.claimRedeem(ALICE, requestId)))
                .isInstanceOf(ExternalCallFailureException.class);

        assertThat(f.vault.get(requestId).getState()).isEqualTo(VaultRequestState.CLAIMABLE);
        assertThat(f.balance().getExited()).isEqualTo(STAKE_UNIT);
        assertThat(f.vault.shareBalance(ALICE).getLocked()).isEqualTo(STAKE_UNIT.toString());
    }

    @Test
    void redeem_withoutExitableValidator_isStateViolation() {
        assertThatThrownBy(() -> f.tx(() -> f.vault.requestRedeem(BOB, null, STAKE_UNIT, null)))
                .isInstanceOf(StateViolationException.class);
    }

    @Test
    void redeem_requiresEnoughShares() {
        VaultRequestVo deposit = f.tx(() -> f.vault.requestDeposit(ALICE, null, f.fund(ALICE)));
        Long validatorId = deposit.getLinkedValidatorId();
        f.tx(() -> f.registry.assign(OPERATOR, validatorId, pubkeyHex(5), signatureHex(5)));
        String root = f.rootHexFor(validatorId);
        f.tx(() -> f.vault.processValidatorDeposit(OPERATOR, deposit.getId(), root));
        f.tx(() -> f.vault.claimDeposit(ALICE, deposit.getId()));

        assertThatThrownBy(() -> f.tx(() -> f.vault.requestRedeem(BOB, null, STAKE_UNIT, null)))
                .isInstanceOf(ValidationException.class)
                .extracting("errorCode").isEqualTo(ValidationException.INSUFFICIENT_SHARES);
        assertThat(f.vault.shareBalance(BOB).getLocked()).isEqualTo("0");
        assertThat(f.vault.shareBalance(ALICE).getAvailable()).isEqualTo(STAKE_UNIT.toString());
    }

    @Test
    void redeem_sharesMustEqualStakeUnit() {
        assertThatThrownBy(() -> f.tx(() -> f.vault.requestRedeem(ALICE, null, BigInteger.ONE, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void cancelRedeem_unlocksSharesAndFreesValidator() {
        Long requestId = fundedRedeem();

        f.tx(() -> f.vault.cancelRedeem(ALICE, requestId));

        assertThat(f.vault.get(requestId).getState()).isEqualTo(VaultRequestState.CANCELLED);
        assertThat(f.vault.shareBalance(ALICE).getAvailable()).isEqualTo(STAKE_UNIT.toString());
        assertThat(f.vault.shareBalance(ALICE).getLocked()).isEqualTo("0");

        Long again = f.tx(() -> f.vault.requestRedeem(ALICE, null, STAKE_UNIT, null)).getId();
        assertThat(f.vault.get(again).getState()).isEqualTo(VaultRequestState.PENDING);
    }

    @Test
    void processingRedeem_cannotBeCancelled() {
        Long requestId = fundedRedeem();
        f.tx(() -> f.vault.markRedeemProcessing(OPERATOR, requestId));

        assertThatThrownBy(() -> f.tx(() -> f.vault.cancelRedeem(ALICE, requestId)))
                .isInstanceOf(StateViolationException.class);
    }

    @Test
    void keeperActions_requireOperator() {
        Long requestId = fundedRedeem();

        assertThatThrownBy(() -> f.tx(() -> f.vault.processRedeem(ALICE, requestId, 1L)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void cancelDeposit_refundsPayer() {
        VaultRequestVo request = f.tx(() -> f.vault.requestDeposit(ALICE, BOB, f.fund(ALICE)));

        f.tx(() -> f.vault.cancelDeposit(BOB, request.getId()));

        assertThat(f.vault.get(request.getId()).getState()).isEqualTo(VaultRequestState.CANCELLED);
        assertThat(f.registry.get(request.getLinkedValidatorId()).getState()).isEqualTo(DepositState.NONE);
        assertThat(f.chain.totalTransferredTo(ALICE)).isEqualTo(STAKE_UNIT);
        assertThat(f.held()).isZero();
    }

    @Test
    void vaultOwnedRecord_cannotBeCancelledOrConfirmedOutsideTheVault() {
        VaultRequestVo request = f.tx(() -> f.vault.requestDeposit(ALICE, null, f.fund(ALICE)));
        Long validatorId = request.getLinkedValidatorId();
        f.tx(() -> f.registry.assign(OPERATOR, validatorId, pubkeyHex(5), signatureHex(5)));
        String root = f.rootHexFor(validatorId);

        assertThatThrownBy(() -> f.tx(() -> f.registry.cancel(VAULT, validatorId)))
                .isInstanceOf(StateViolationException.class)
                .extracting("errorCode").isEqualTo(DepositRegistryService.VAULT_MANAGED);
        assertThatThrownBy(() -> f.tx(() -> f.registry.confirm(VAULT, validatorId, root)))
                .isInstanceOf(StateViolationException.class)
                .extracting("errorCode").isEqualTo(DepositRegistryService.VAULT_MANAGED);
        assertThat(f.registry.get(validatorId).getState()).isEqualTo(DepositState.ASSIGNED);
        assertThat(f.chain.transfers()).isEmpty();

        f.tx(() -> f.vault.cancelDeposit(ALICE, request.getId()));

        assertThat(f.vault.get(request.getId()).getState()).isEqualTo(VaultRequestState.CANCELLED);
        assertThat(f.registry.get(validatorId).getState()).isEqualTo(DepositState.NONE);
        assertThat(f.chain.totalTransferredTo(ALICE)).isEqualTo(STAKE_UNIT);
    }

    @Test
    void missingRequest_isNotFound() {
        assertThatThrownBy(() -> f.vault.get(12345L))
                .isInstanceOf(BizException.class)
                .extracting("code").isEqualTo(404);
    }

    /**
     * ALICE 申购并领取份额后，发起一笔赎回，返回赎回请求 id。
     */
    private Long fundedRedeem() {
        VaultRequestVo deposit = f.tx(() -> f.vault.requestDeposit(ALICE, null, f.fund(ALICE)));
        Long validatorId = deposit.getLinkedValidatorId();
        f.tx(() -> f.registry.assign(OPERATOR, validatorId, pubkeyHex(4), signatureHex(4)));
        String root = f.rootHexFor(validatorId);
        f.tx(() -> f.vault.processValidatorDeposit(OPERATOR, deposit.getId(), root));
        f.tx(() -> f.vault.claimDeposit(ALICE, deposit.getId()));
        VaultRequestVo redeem = f.tx(() -> f.vault.requestRedeem(ALICE, null, STAKE_UNIT, null));
        assertThat(redeem.getLinkedValidatorId()).isEqualTo(validatorId);
        return redeem.getId();
    }
}
