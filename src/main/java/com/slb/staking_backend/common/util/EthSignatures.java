package com.slb.staking_backend.common.util;

import com.slb.staking_backend.common.exception.ValidationException;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Optional;

/**
 * EIP-191 personal_sign 签名工具：从 65 字节 r||s||v 签名中恢复签名地址。
 */
public final class EthSignatures {

    public static final int SIGNATURE_LENGTH = 65;

    private EthSignatures() {
    }

    /**
     * 恢复对 message 做 personal_sign 的地址（小写 0x 形式）。签名无法恢复出公钥时返回 empty。
     */
    public static Optional<String> recoverSigner(String message, String signatureHex) {
        byte[] raw = HexUtils.decode("signature", signatureHex);
        if (raw.length != SIGNATURE_LENGTH) {
            throw ValidationException.invalidLength("signature", SIGNATURE_LENGTH, raw.length);
        }
        byte v = raw[64];
        // 部分钱包返回 0/1
        if (v < 27) {
            v += 27;
        }
        Sign.SignatureData data = new Sign.SignatureData(v,
                Arrays.copyOfRange(raw, 0, 32),
                Arrays.copyOfRange(raw, 32, 64));
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(message.getBytes(StandardCharsets.UTF_8), data);
            return Optional.of("0x" + Keys.getAddress(publicKey));
        } catch (SignatureException e) {
            return Optional.empty();
        }
    }
}
