package com.slb.staking_backend.modules.account.service;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.util.EthSignatures;
import com.slb.staking_backend.common.util.HexUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

/**
 * 钱包签名挑战：注册与登录前，调用方必须用地址私钥对服务端下发的一次性消息做 personal_sign。
 */
@Service
@Slf4j
public class SignInChallengeService {

    public static final String AUTH_CHALLENGE_MISSING = "AUTH_CHALLENGE_MISSING";
    public static final String AUTH_SIGNATURE_INVALID = "AUTH_SIGNATURE_INVALID";

    // 签名最大尝试次数
    private static final int MAX_ATTEMPTS = 3;
    // 挑战有效期
    public static final long CHALLENGE_EXPIRATION_MINUTES = 5;

    private static final SecureRandom RANDOM = new SecureRandom();

    private static class ChallengeInfo {
        final String message;
        int attempts = 0;

        ChallengeInfo(String message) {
            this.message = message;
        }
    }

    // 每个地址只保留最近一次挑战
    private final Cache<String, ChallengeInfo> challengeCache = CacheBuilder.newBuilder()
            .expireAfterWrite(CHALLENGE_EXPIRATION_MINUTES, TimeUnit.MINUTES)
            .maximumSize(100_000)
            .build();

    private final Clock clock;

    public SignInChallengeService(Clock clock) {
        this.clock = clock;
    }

    /**
     * 为地址生成一次性待签消息。
     */
    public String issue(String rawAddress) {
        String address = HexUtils.normalizeAddress("address", rawAddress);
        byte[] nonce = new byte[16];
        RANDOM.nextBytes(nonce);
        String message = "staking-backend wants you to sign in with your Ethereum account:\n"
                + address + "\n\n"
                + "Nonce: " + HexFormat.of().formatHex(nonce) + "\n"
                + "Issued At: " + Instant.now(clock);
        challengeCache.put(address, new ChallengeInfo(message));
        return message;
    }

    /**
     * 校验签名出自该地址；成功后挑战失效，不可重放。
     */
    public void verify(String rawAddress, String signatureHex) {
        String address = HexUtils.normalizeAddress("address", rawAddress);
        ChallengeInfo info = challengeCache.getIfPresent(address);
        if (info == null) {
            throw new BizException(401, AUTH_CHALLENGE_MISSING, "auth.challenge",
                    "sign-in challenge expired or not requested");
        }
        if (info.attempts >= MAX_ATTEMPTS) {
            challengeCache.invalidate(address);
            throw new BizException(401, AUTH_CHALLENGE_MISSING, "auth.challenge",
                    "too many failed signatures, request a new challenge");
        }
        String signer = EthSignatures.recoverSigner(info.message, signatureHex).orElse(null);
        if (!HexUtils.sameAddress(signer, address)) {
            info.attempts++;
            log.warn("Sign-in signature rejected for {} (recovered={})", address, signer);
            throw new BizException(401, AUTH_SIGNATURE_INVALID, "auth.signature",
                    "signature was not produced by " + address);
        }
        challengeCache.invalidate(address);
    }
}
