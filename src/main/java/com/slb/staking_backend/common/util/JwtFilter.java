package com.slb.staking_backend.common.util;

import com.slb.staking_backend.common.security.AuthErrorType;
import com.slb.staking_backend.common.security.AuthFailures;
import com.slb.staking_backend.common.security.CustomUserDetails;
import com.slb.staking_backend.modules.account.entity.Account;
import com.slb.staking_backend.modules.account.mapper.AccountMapper;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Bearer accessToken → SecurityContext。失败时只在请求上标记原因，是否拒绝由后续授权规则决定，
 * 所以公开接口（登录、注册）带着过期令牌也能访问。
 */
@Component
@Slf4j
public class JwtFilter extends OncePerRequestFilter {

    private static final String BEARER = "Bearer ";
    private static final String REFRESH_URI = "/api/v1/auth/refresh";

    private final JwtUtil jwtUtil;
    private final AccountMapper accountMapper;

    public JwtFilter(JwtUtil jwtUtil, AccountMapper accountMapper) {
        this.jwtUtil = jwtUtil;
        this.accountMapper = accountMapper;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (SecurityContextHolder.getContext().getAuthentication() == null) {
            authenticate(request);
        }
        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request) {
        String header = request.getHeader("Authorization");
        if (!StringUtils.hasText(header)) {
            return;
        }
        if (!header.startsWith(BEARER) || !StringUtils.hasText(header.substring(BEARER.length()))) {
            AuthFailures.flag(request, AuthErrorType.BAD_AUTHORIZATION_HEADER, "Malformed Authorization header",
                    Map.of("Authorization", "Expected 'Authorization: Bearer <token>'"));
            return;
        }
        String token = header.substring(BEARER.length()).trim();

        Claims claims;
        try {
            claims = jwtUtil.parseClaims(token);
        } catch (ExpiredJwtException e) {
            AuthFailures.flag(request, AuthErrorType.TOKEN_EXPIRED,
                    "Token expired at " + e.getClaims().getExpiration(), Map.of("token", "expired"));
            return;
        } catch (JwtException | IllegalArgumentException e) {
            AuthFailures.flag(request, AuthErrorType.INVALID_TOKEN, e.getMessage(), Map.of("token", "invalid"));
            return;
        }

        String tokenType = claims.get(JwtUtil.CLAIM_TYP, String.class);
        if (!"access".equalsIgnoreCase(tokenType)) {
            // refresh 接口在请求体里携带 refreshToken，Authorization 头里的类型不影响它
            if (!request.getRequestURI().startsWith(REFRESH_URI)) {
                AuthFailures.flag(request, AuthErrorType.WRONG_TOKEN_TYPE, "Wrong token type: " + tokenType,
                        Map.of("token", "wrong_type"));
            }
            return;
        }

        Optional<Account> account = loadAccount(claims);
        if (account.isEmpty() || account.get().getStatus() == null || account.get().getStatus() == 0) {
            AuthFailures.flag(request, AuthErrorType.UNKNOWN_ACCOUNT, "Account missing or disabled",
                    Map.of("token", "unknown_account"));
            return;
        }

        CustomUserDetails userDetails = new CustomUserDetails(account.get());
        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                userDetails, null, userDetails.getAuthorities());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        log.debug("Authenticated {} for {}", userDetails.getAddress(), request.getRequestURI());
    }

    // 优先按 uid 恢复账户，旧令牌没有 uid 时按地址
    private Optional<Account> loadAccount(Claims claims) {
        Object uid = claims.get(JwtUtil.CLAIM_UID);
        if (uid instanceof Number number) {
            return accountMapper.selectById(number.longValue());
        }
        String address = jwtUtil.resolveAddress(claims);
        if (!StringUtils.hasText(address)) {
            return Optional.empty();
        }
        return accountMapper.selectByAddress(address.toLowerCase());
    }
}
