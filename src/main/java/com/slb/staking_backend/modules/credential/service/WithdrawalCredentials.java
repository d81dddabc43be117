package com.slb.staking_backend.modules.credential.service;

import com.slb.staking_backend.common.exception.ValidationException;
import com.slb.staking_backend.common.util.HexUtils;

/**
 * 提款凭证：1 字节版本前缀 + 11 个 0 字节 + 20 字节执行层地址。
 */
public final class WithdrawalCredentials {

    public static final int LENGTH = 32;
    private static final int ADDRESS_OFFSET = 12;

    private WithdrawalCredentials() {
    }

    public static byte[] forAddress(int prefix, String address) {
        if (prefix < 0 || prefix > 0xff) {
            throw new ValidationException(ValidationException.VALIDATION_ERROR, "withdrawalPrefix",
                    "withdrawal prefix must fit in one byte");
        }
        byte[] addr = HexUtils.addressBytes(address);
        byte[] out = new byte[LENGTH];
        out[0] = (byte) prefix;
        System.arraycopy(addr, 0, out, ADDRESS_OFFSET, addr.length);
        return out;
    }
}
