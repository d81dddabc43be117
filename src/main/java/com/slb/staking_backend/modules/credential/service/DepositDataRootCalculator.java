package com.slb.staking_backend.modules.credential.service;

import com.slb.staking_backend.modules.credential.model.DepositData;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * 复现信标链存款合约的 deposit_data_root（即 SSZ hash_tree_root(DepositData)）。
 *
 * <pre>
 * pubkeyRoot    = H(pubkey || 16 个 0 字节)
 * signatureRoot = H(H(sig[0:64]) || H(sig[64:96] || 32 个 0 字节))
 * amountLeaf    = LE64(amountGwei) || 24 个 0 字节
 * root          = H(H(pubkeyRoot || withdrawalCredentials) || H(amountLeaf || signatureRoot))
 * </pre>
 * 纯函数，无状态，可并发调用。
 */
@Component
public class DepositDataRootCalculator {

    public static final int ROOT_LENGTH = 32;

    public byte[] computeRoot(DepositData data) {
        byte[] pubkey = data.getPubkey();
        byte[] signature = data.getSignature();

        byte[] pubkeyRoot = sha256(pubkey, new byte[16]);
        byte[] sigRootA = sha256(slice(signature, 0, 64));
        byte[] sigRootB = sha256(slice(signature, 64, 96), new byte[32]);
        byte[] signatureRoot = sha256(sigRootA, sigRootB);

        byte[] left = sha256(pubkeyRoot, data.getWithdrawalCredentials());
        byte[] right = sha256(amountLeaf(data.getAmountGwei()), signatureRoot);
        return sha256(left, right);
    }

    /**
     * 重新计算并与给定根比较（常量时间）。给定根长度不为 32 时直接返回 false。
     */
    public boolean matches(DepositData data, byte[] suppliedRoot) {
        if (suppliedRoot == null || suppliedRoot.length != ROOT_LENGTH) {
            return false;
        }
        return MessageDigest.isEqual(computeRoot(data), suppliedRoot);
    }

    static byte[] amountLeaf(long amountGwei) {
        return ByteBuffer.allocate(32).order(ByteOrder.LITTLE_ENDIAN).putLong(amountGwei).array();
    }

    private static byte[] slice(byte[] src, int from, int to) {
        byte[] out = new byte[to - from];
        System.arraycopy(src, from, out, 0, out.length);
        return out;
    }

    private static byte[] sha256(byte[]... parts) {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // JCA 规范要求所有 JRE 都提供 SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
        for (byte[] part : parts) {
            digest.update(part);
        }
        return digest.digest();
    }
}
