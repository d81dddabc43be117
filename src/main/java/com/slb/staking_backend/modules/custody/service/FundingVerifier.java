package com.slb.staking_backend.modules.custody.service;

import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.chain.model.IncomingTransfer;
import com.slb.staking_backend.modules.chain.service.PaymentLookup;
import com.slb.staking_backend.modules.custody.entity.FundingReceipt;
import com.slb.staking_backend.modules.custody.mapper.FundingReceiptMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigInteger;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 存款付款核验：付款必须是一笔已上链、已确认、由调用方转入托管地址、金额恰为一个质押单位的交易，
 * 且每笔交易只能消费一次。台账只为核验过的付款记 pending。
 */
@Service
@Slf4j
public class FundingVerifier {

    private static final Pattern TX_HASH = Pattern.compile("0x[0-9a-f]{64}");

    private final PaymentLookup paymentLookup;
    private final FundingReceiptMapper fundingReceiptMapper;
    private final StakingProperties stakingProperties;
    private final Clock clock;

    public FundingVerifier(PaymentLookup paymentLookup,
                           FundingReceiptMapper fundingReceiptMapper,
                           StakingProperties stakingProperties,
                           Clock clock) {
        this.paymentLookup = paymentLookup;
        this.fundingReceiptMapper = fundingReceiptMapper;
        this.stakingProperties = stakingProperties;
        this.clock = clock;
    }

    /**
     * 核验 payer 发出的付款交易，返回可消费的入账。不写库。
     */
    public IncomingTransfer verify(String payer, String rawTxHash) {
        String txHash = normalizeTxHash(rawTxHash);
        if (fundingReceiptMapper.findByTxHash(txHash).isPresent()) {
            throw new ValidationException(ValidationException.FUNDING_ALREADY_USED, "funding.replay",
                    "funding transaction " + txHash + " has already been used");
        }
        IncomingTransfer transfer = paymentLookup.findTransfer(txHash)
                .orElseThrow(() -> new ValidationException(ValidationException.FUNDING_NOT_FOUND, "funding.lookup",
                        "funding transaction " + txHash + " not found"));
        if (!transfer.success()) {
            throw new ValidationException(ValidationException.FUNDING_MISMATCH, "funding.status",
                    "funding transaction " + txHash + " reverted");
        }
        String custody = stakingProperties.getCustodyAddress();
        if (!StringUtils.hasText(custody)) {
            throw new IllegalStateException("app.staking.custody-address is not configured");
        }
        if (!HexUtils.sameAddress(transfer.to(), custody)) {
            throw new ValidationException(ValidationException.FUNDING_MISMATCH, "funding.recipient",
                    "funding transaction was not sent to the custody address");
        }
        if (!HexUtils.sameAddress(transfer.from(), payer)) {
            throw new ValidationException(ValidationException.FUNDING_MISMATCH, "funding.payer",
                    "funding transaction was not sent by " + payer);
        }
        BigInteger stakeUnit = stakingProperties.getStakeUnitWei();
        if (transfer.valueWei() == null || transfer.valueWei().compareTo(stakeUnit) != 0) {
            throw new ValidationException(ValidationException.PAYMENT_NOT_STAKE_UNIT, "deposit.create",
                    "payment must equal the stake unit of " + stakeUnit + " wei");
        }
        if (transfer.confirmations() < stakingProperties.getMinFundingConfirmations()) {
            throw new ValidationException(ValidationException.FUNDING_UNCONFIRMED, "funding.confirmations",
                    "funding transaction has " + transfer.confirmations() + " confirmations, requires "
                            + stakingProperties.getMinFundingConfirmations());
        }
        return transfer;
    }

    /**
     * 将已核验的付款登记为某条存款记录的资金来源；同一交易并发消费时只有一个成功。
     */
    public void consume(IncomingTransfer transfer, String payer, Long depositId) {
        FundingReceipt receipt = new FundingReceipt();
        receipt.setTxHash(normalizeTxHash(transfer.txHash()));
        receipt.setPayer(payer);
        receipt.setAmount(transfer.valueWei());
        receipt.setDepositId(depositId);
        receipt.setConsumedAt(LocalDateTime.now(clock));
        try {
            fundingReceiptMapper.insert(receipt);
        } catch (DuplicateKeyException e) {
            throw new ValidationException(ValidationException.FUNDING_ALREADY_USED, "funding.replay",
                    "funding transaction " + receipt.getTxHash() + " has already been used");
        }
        log.info("Funding {} from {} consumed by deposit record {}", receipt.getTxHash(), payer, depositId);
    }

    private static String normalizeTxHash(String rawTxHash) {
        String txHash = rawTxHash == null ? "" : rawTxHash.trim().toLowerCase(Locale.ROOT);
        if (!TX_HASH.matcher(txHash).matches()) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "fundingTxHash",
                    "fundingTxHash must be 0x followed by 64 hex characters");
        }
        return txHash;
    }
}
