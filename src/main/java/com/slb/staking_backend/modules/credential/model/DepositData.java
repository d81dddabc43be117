package com.slb.staking_backend.modules.credential.model;

import com.slb.staking_backend.common.exception.ValidationException;

import java.util.Arrays;

/**
 * 信标链存款数据（DepositData）：pubkey 48 字节，withdrawal_credentials 32 字节，signature 96 字节，amount 以 gwei 计。
 * <p>构造时即校验长度，并对字节数组做防御性拷贝。</p>
 */
public final class DepositData {

    public static final int PUBKEY_LENGTH = 48;
    public static final int WITHDRAWAL_CREDENTIALS_LENGTH = 32;
    public static final int SIGNATURE_LENGTH = 96;

    private final byte[] pubkey;
    private final byte[] withdrawalCredentials;
    private final byte[] signature;
    private final long amountGwei;

    public DepositData(byte[] pubkey, byte[] withdrawalCredentials, byte[] signature, long amountGwei) {
        requireLength("pubkey", pubkey, PUBKEY_LENGTH);
        requireLength("withdrawalCredentials", withdrawalCredentials, WITHDRAWAL_CREDENTIALS_LENGTH);
        requireLength("signature", signature, SIGNATURE_LENGTH);
        if (amountGwei <= 0) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "amount", "amount must be positive");
        }
        this.pubkey = pubkey.clone();
        this.withdrawalCredentials = withdrawalCredentials.clone();
        this.signature = signature.clone();
        this.amountGwei = amountGwei;
    }

    public static void requireLength(String field, byte[] value, int expected) {
        int actual = value == null ? 0 : value.length;
        if (actual != expected) {
            throw ValidationException.invalidLength(field, expected, actual);
        }
    }

    public byte[] getPubkey() {
        return pubkey.clone();
    }

    public byte[] getWithdrawalCredentials() {
        return withdrawalCredentials.clone();
    }

    public byte[] getSignature() {
        return signature.clone();
    }

    public long getAmountGwei() {
        return amountGwei;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DepositData other)) {
            return false;
        }
        return amountGwei == other.amountGwei
                && Arrays.equals(pubkey, other.pubkey)
                && Arrays.equals(withdrawalCredentials, other.withdrawalCredentials)
                && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(pubkey);
        result = 31 * result + Arrays.hashCode(withdrawalCredentials);
        result = 31 * result + Arrays.hashCode(signature);
        return 31 * result + Long.hashCode(amountGwei);
    }
}
