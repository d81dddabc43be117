package com.slb.staking_backend.common.util;

import com.slb.staking_backend.common.security.CustomUserDetails;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.Nullable;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.Date;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

@Component
@Slf4j
public class JwtUtil {

    public static final String CLAIM_TYP = "typ";
    public static final String CLAIM_ADDRESS = "address";
    public static final String CLAIM_UID = "uid";
    private static final String TOKEN_TYPE_ACCESS = "access";
    private static final String TOKEN_TYPE_REFRESH = "refresh";

    @Value("${security.jwt.secret}")
    private String secret;

    @Value("${security.jwt.access-token-expire}")
    private long accessTokenExpire;  // seconds

    @Value("${security.jwt.refresh-token-expire}")
    private long refreshTokenExpire; // seconds

    private Key key;

    @PostConstruct
    public void init() {
        // 保证 secret 至少 32 bytes，HS256 可用
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
    }

    /* ----------- 公共解析工具 ----------- */

    public String getSubject(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    public String getClaim(String token, String name) {
        return extractAllClaims(token).get(name, String.class);
    }

    public <T> T getClaim(String token, String name, Class<T> type) {
        return extractAllClaims(token).get(name, type);
    }

    public Claims parseClaims(String token) {
        return extractAllClaims(token);
    }

    public Claims parseRefreshClaims(String token) {
        Claims claims = extractAllClaims(token);
        ensureTokenType(claims, TOKEN_TYPE_REFRESH);
        return claims;
    }

    public boolean validateAccessToken(String token, UserDetails user) {
        return validateTokenInternal(token, user, TOKEN_TYPE_ACCESS);
    }

    public boolean validateRefreshToken(String token, UserDetails user) {
        return validateTokenInternal(token, user, TOKEN_TYPE_REFRESH);
    }

    /** 生成 AccessToken：subject=地址，claim 写入 address / uid / typ / fpt(设备指纹) */
    public String generateAccessToken(UserDetails user, @Nullable String fingerprint) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_TYP, TOKEN_TYPE_ACCESS);
        claims.put(CLAIM_ADDRESS, user.getUsername());
        Long uid = resolveUid(user);
        if (uid != null) claims.put(CLAIM_UID, uid);
        if (StringUtils.hasText(fingerprint)) claims.put("fpt", fingerprint);
        return buildToken(claims, user.getUsername(), accessTokenExpire);
    }

    /** 生成 RefreshToken：subject=地址，claim 写入 address / uid / typ=refresh */
    public String generateRefreshToken(UserDetails user) {
        Map<String, Object> claims = new HashMap<>();
        claims.put(CLAIM_TYP, TOKEN_TYPE_REFRESH);
        claims.put(CLAIM_ADDRESS, user.getUsername());
        Long uid = resolveUid(user);
        if (uid != null) claims.put(CLAIM_UID, uid);
        return buildToken(claims, user.getUsername(), refreshTokenExpire);
    }

    public long getAccessTokenExpire() {
        return accessTokenExpire;
    }

    /* ----------- 私有工具 ----------- */

    private String buildToken(Map<String, Object> claims, String subject, long ttlSeconds) {
        Date now = new Date();
        Date exp = new Date(now.getTime() + ttlSeconds * 1000);
        return Jwts.builder()
                .setClaims(claims)
                .setSubject(subject)
                .setIssuedAt(now)
                .setExpiration(exp)
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    private <T> T extractClaim(String token, Function<Claims, T> resolver) {
        return resolver.apply(extractAllClaims(token));
    }

    private Claims extractAllClaims(String token) throws JwtException {
        return Jwts.parserBuilder().setSigningKey(key).build().parseClaimsJws(token).getBody();
    }

    private boolean validateTokenInternal(String token, UserDetails user, String expectedType) {
        try {
            Claims claims = extractAllClaims(token);
            ensureTokenType(claims, expectedType);
            String address = resolveAddress(claims);
            return StringUtils.hasText(address)
                    && address.equalsIgnoreCase(user.getUsername())
                    && !isExpired(claims);
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Failed to validate {} token: {}", expectedType, e.getMessage());
            return false;
        }
    }

    private void ensureTokenType(Claims claims, String expectedType) {
        String tokenType = claims.get(CLAIM_TYP, String.class);
        if (!expectedType.equalsIgnoreCase(tokenType)) {
            throw new UnsupportedJwtException("Wrong token type: " + tokenType);
        }
    }

    public String resolveAddress(Claims claims) {
        String address = claims.get(CLAIM_ADDRESS, String.class);
        if (!StringUtils.hasText(address)) {
            address = claims.getSubject();
        }
        return address;
    }

    private boolean isExpired(Claims claims) {
        Date expiration = claims.getExpiration();
        return expiration == null || expiration.before(new Date());
    }

    /**
     * 从 UserDetails 中提取账户 ID（uid）；仅 CustomUserDetails 携带。
     */
    @Nullable
    private Long resolveUid(UserDetails userDetails) {
        if (userDetails instanceof CustomUserDetails customUserDetails
                && customUserDetails.getAccount() != null
                && customUserDetails.getAccount().getId() != null) {
            return customUserDetails.getAccount().getId();
        }
        return null;
    }
}
