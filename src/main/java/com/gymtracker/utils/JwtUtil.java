package com.gymtracker.utils;

import io.jsonwebtoken.*;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * 从 Bearer Token 中识别训练数据所属的用户。所有日历和训练接口都按 userId 隔离数据。
 */
@Component
public class JwtUtil {

    public static final String BEARER_PREFIX = "Bearer ";

    private static final String CLAIM_USER_ID = "userId";
    private static final String CLAIM_USERNAME = "username";

    @Value("${jwt.secret:gym-tracker-secret-key-change-in-production}")
    private String secret;

    @Value("${jwt.expiration:86400000}") // 24小时
    private long expiration;

    private SecretKey key;

    private JwtParser parser;

    @PostConstruct
    public void init() {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.parser = Jwts.parser().verifyWith(key).build();
    }

    public String generateToken(Long userId, String username) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .claim(CLAIM_USER_ID, userId)
                .claim(CLAIM_USERNAME, username)
                .issuedAt(new Date(now))
                .expiration(new Date(now + expiration))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public Claims parseToken(String token) {
        return parser.parseSignedClaims(token).getPayload();
    }

    public Long getUserIdFromToken(String token) {
        Object userId = parseToken(token).get(CLAIM_USER_ID);
        if (!(userId instanceof Number)) {
            throw new JwtException("Token中缺少userId");
        }
        return ((Number) userId).longValue();
    }

    /**
     * 从 Authorization 头获取用户ID，头缺失或不是 Bearer 格式时抛出 IllegalArgumentException
     */
    public Long getUserIdFromHeader(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            throw new IllegalArgumentException("未提供Token");
        }
        return getUserIdFromToken(authHeader.substring(BEARER_PREFIX.length()).trim());
    }

    public boolean validateToken(String token) {
        try {
            parseToken(token);
            return true;
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }
}
