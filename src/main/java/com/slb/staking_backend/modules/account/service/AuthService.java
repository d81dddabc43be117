package com.slb.staking_backend.modules.account.service;

import com.slb.staking_backend.common.exception.AuthorizationException;
import com.slb.staking_backend.common.exception.BizException;
import com.slb.staking_backend.common.security.CustomUserDetails;
import com.slb.staking_backend.common.util.HexUtils;
import com.slb.staking_backend.common.util.JwtUtil;
import com.slb.staking_backend.config.StakingProperties;
import com.slb.staking_backend.modules.account.entity.Account;
import com.slb.staking_backend.modules.account.mapper.AccountMapper;
import com.slb.staking_backend.modules.account.vo.AuthVo;
import com.slb.staking_backend.modules.account.vo.SignInChallengeVo;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.concurrent.TimeUnit;

@Service
@Slf4j
public class AuthService {

    public static final String ROLE_USER = "USER";
    public static final String ROLE_OWNER = "OWNER";

    private final AuthenticationManager authenticationManager;
    private final UserDetailsService userDetailsService;
    private final AccountMapper accountMapper;
    private final PasswordEncoder passwordEncoder;
    private final StakingProperties stakingProperties;
    private final JwtUtil jwtUtil;
    private final SignInChallengeService challengeService;
    private final Clock clock;

    public AuthService(AuthenticationManager authenticationManager,
                       UserDetailsService userDetailsService,
                       AccountMapper accountMapper,
                       PasswordEncoder passwordEncoder,
                       StakingProperties stakingProperties,
                       JwtUtil jwtUtil,
                       SignInChallengeService challengeService,
                       Clock clock) {
        this.authenticationManager = authenticationManager;
        this.userDetailsService = userDetailsService;
        this.accountMapper = accountMapper;
        this.passwordEncoder = passwordEncoder;
        this.stakingProperties = stakingProperties;
        this.jwtUtil = jwtUtil;
        this.challengeService = challengeService;
        this.clock = clock;
    }

    /** 下发待签名的登录挑战 */
    public SignInChallengeVo challenge(String rawAddress) {
        String address = HexUtils.normalizeAddress("address", rawAddress);
        return new SignInChallengeVo(address, challengeService.issue(address),
                TimeUnit.MINUTES.toSeconds(SignInChallengeService.CHALLENGE_EXPIRATION_MINUTES));
    }

    /** 校验地址签名后注册账户并直接签发令牌；金库地址只由服务自身使用，不可注册 */
    @Transactional
    public AuthVo register(String rawAddress, String password, String signature, HttpServletRequest request) {
        String address = HexUtils.normalizeAddress("address", rawAddress);
        if (HexUtils.sameAddress(address, stakingProperties.getVaultAddress())) {
            throw new AuthorizationException("auth.register.reserved", address);
        }
        challengeService.verify(address, signature);
        accountMapper.selectByAddress(address).ifPresent(a -> {
            throw new BizException(409, "该地址已注册");
        });

        LocalDateTime now = LocalDateTime.now(clock);
        Account account = new Account();
        account.setAddress(address);
        account.setPasswordHash(passwordEncoder.encode(password));
        account.setRole(HexUtils.sameAddress(address, stakingProperties.getOwnerAddress()) ? ROLE_OWNER : ROLE_USER);
        account.setStatus(1);
        account.setCreateTime(now);
        account.setUpdateTime(now);
        accountMapper.insert(account);
        log.info("Account registered: {} (role={})", address, account.getRole());

        return issue(new CustomUserDetails(account), request);
    }

    /** 校验签名与密码后生成 accessToken / refreshToken */
    public AuthVo login(String rawAddress, String password, String signature, HttpServletRequest request) {
        String address = HexUtils.normalizeAddress("address", rawAddress);
        // 0) 地址控制权
        challengeService.verify(address, signature);
        // 1) 认证
        authenticationManager.authenticate(new UsernamePasswordAuthenticationToken(address, password));
        // 2) 加载账户
        UserDetails userDetails = userDetailsService.loadUserByUsername(address);
        // 3) 签发
        return issue(userDetails, request);
    }

    /** 刷新 accessToken（refreshToken 原样返回） */
    public AuthVo refreshToken(String refreshToken, HttpServletRequest request) {
        if (!StringUtils.hasText(refreshToken)) {
            throw new BizException(401, "AUTH_INVALID_TOKEN");
        }

        Claims refreshClaims;
        try {
            refreshClaims = jwtUtil.parseRefreshClaims(refreshToken);
        } catch (ExpiredJwtException e) {
            throw new BizException(401, "AUTH_EXPIRED");
        } catch (UnsupportedJwtException e) {
            throw new BizException(401, "AUTH_WRONG_TOKEN_TYPE");
        } catch (JwtException e) {
            throw new BizException(401, "AUTH_INVALID_TOKEN");
        }

        String address = jwtUtil.resolveAddress(refreshClaims);
        if (!StringUtils.hasText(address)) {
            throw new BizException(401, "AUTH_INVALID_TOKEN");
        }

        UserDetails userDetails = userDetailsService.loadUserByUsername(address);
        if (!jwtUtil.validateRefreshToken(refreshToken, userDetails)) {
            throw new BizException(401, "AUTH_INVALID_TOKEN");
        }
        String fingerprint = fingerprintOf(request.getRemoteAddr(), request.getHeader("User-Agent"));
        return AuthVo.builder()
                .address(userDetails.getUsername())
                .accessToken(jwtUtil.generateAccessToken(userDetails, fingerprint))
                .refreshToken(refreshToken)
                .expiresIn(jwtUtil.getAccessTokenExpire())
                .build();
    }

    private AuthVo issue(UserDetails userDetails, HttpServletRequest request) {
        String fingerprint = fingerprintOf(request.getRemoteAddr(), request.getHeader("User-Agent"));
        return AuthVo.builder()
                .address(userDetails.getUsername())
                .accessToken(jwtUtil.generateAccessToken(userDetails, fingerprint))
                .refreshToken(jwtUtil.generateRefreshToken(userDetails))
                .expiresIn(jwtUtil.getAccessTokenExpire())
                .build();
    }

    /* -------------------- 内部小工具 -------------------- */

    private static String fingerprintOf(String ip, String ua) {
        String raw = (ip == null ? "" : ip) + "|" + (ua == null ? "" : ua);
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
