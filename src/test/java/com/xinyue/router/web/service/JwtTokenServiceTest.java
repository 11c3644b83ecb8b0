package com.xinyue.router.web.service;

import com.xinyue.router.core.error.UnauthorizedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JWT 令牌服务测试")
class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-unit-test-secret-0123";

    @Test
    @DisplayName("签发的令牌可以解析出用户名")
    void testIssueAndVerify() {
        JwtTokenService service = new JwtTokenService(SECRET, Duration.ofMinutes(5));

        String token = service.issue("trader1");

        assertEquals("trader1", service.verify(token));
        assertEquals("trader1", service.verifyBearer("Bearer " + token));
        assertEquals(300, service.ttlSeconds());
    }

    @Test
    @DisplayName("过期令牌被拒绝")
    void testExpiredToken() {
        Instant issuedAt = Instant.parse("2024-01-01T00:00:00Z");
        JwtTokenService issuer = new JwtTokenService(SECRET, Duration.ofMinutes(1),
                Clock.fixed(issuedAt, ZoneOffset.UTC));
        String token = issuer.issue("trader1");

        JwtTokenService later = new JwtTokenService(SECRET, Duration.ofMinutes(1),
                Clock.fixed(issuedAt.plusSeconds(3600), ZoneOffset.UTC));

        assertThrows(UnauthorizedException.class, () -> later.verify(token));
    }

    @Test
    @DisplayName("不同密钥签名、空令牌和乱码被拒绝")
    void testInvalidTokens() {
        JwtTokenService service = new JwtTokenService(SECRET, Duration.ofMinutes(5));
        JwtTokenService other = new JwtTokenService("another-secret-another-secret-456789", Duration.ofMinutes(5));

        assertThrows(UnauthorizedException.class, () -> service.verify(other.issue("trader1")));
        assertThrows(UnauthorizedException.class, () -> service.verify(""));
        assertThrows(UnauthorizedException.class, () -> service.verify("abc.def.ghi"));
        assertThrows(UnauthorizedException.class, () -> service.verifyBearer(null));
    }
}
