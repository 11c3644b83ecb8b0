package com.xinyue.router.io.input;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("重连退避测试")
class ReconnectBackoffTest {

    @Test
    @DisplayName("延迟逐次翻倍直到上限，握手成功后重置")
    void testDoublingCappedAndReset() {
        ReconnectBackoff backoff = new ReconnectBackoff(500, 3_000);

        assertEquals(500, backoff.nextDelayMs());
        assertEquals(1_000, backoff.nextDelayMs());
        assertEquals(2_000, backoff.nextDelayMs());
        assertEquals(3_000, backoff.nextDelayMs());
        assertEquals(3_000, backoff.nextDelayMs());
        assertEquals(5, backoff.attempts());

        backoff.reset();
        assertEquals(0, backoff.attempts());
        assertEquals(500, backoff.nextDelayMs());
    }

    @Test
    @DisplayName("多次失败后不会溢出")
    void testManyAttempts_NoOverflow() {
        ReconnectBackoff backoff = new ReconnectBackoff(1, 30_000);
        long last = 0;
        for (int i = 0; i < 200; i++) {
            last = backoff.nextDelayMs();
        }
        assertEquals(30_000, last);
    }

    @Test
    @DisplayName("非法参数被拒绝")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(100, 10));
    }
}
