package com.xinyue.router.web.service;

import com.xinyue.router.core.error.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * JWT 签发与校验（HS256），REST 和 WebSocket 共用。
 * token 只携带 sub / iat / exp，无服务端状态，过期即失效。
 */
public final class JwtTokenService {

    private static final Logger LOG = LoggerFactory.getLogger(JwtTokenService.class);

    private final SecretKey secretKey;
    private final Duration ttl;
    private final Clock clock;

    public JwtTokenService(String secret, Duration ttl, Clock clock) {
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalArgumentException("router.jwt.secret 至少需要 32 字节");
        }
        this.secretKey = new SecretKeySpec(bytes, "HmacSHA256");
        this.ttl = ttl;
        this.clock = clock;
    }

    public JwtTokenService(String secret, Duration ttl) {
        this(secret, ttl, Clock.systemUTC());
    }

    public String issue(String username) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(username)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(ttl)))
                .signWith(secretKey)
                .compact();
    }

    /**
     * @return token 中的用户名
     * @throws UnauthorizedException token 为空、签名不对或已过期
     */
    public String verify(String token) {
        if (token == null || token.isBlank()) {
            throw new UnauthorizedException("missing token");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token.trim())
                    .getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                throw new UnauthorizedException("token has no subject");
            }
            return subject;
        } catch (JwtException | IllegalArgumentException e) {
            LOG.debug("token 校验失败: {}", e.getMessage());
            throw new UnauthorizedException("invalid or expired token");
        }
    }

    /**
     * 解析 "Bearer xxx" 形式的请求头。
     */
    public String verifyBearer(String authorization) {
        if (authorization == null || authorization.isBlank()) {
            throw new UnauthorizedException("missing Authorization header");
        }
        String token = authorization.startsWith("Bearer ") ? authorization.substring(7) : authorization;
        return verify(token);
    }

    public long ttlSeconds() {
        return ttl.toSeconds();
    }
}
