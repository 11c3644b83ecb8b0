package com.xinyue.router.core.market;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EWMA 计算测试")
class EwmaStateTest {

    @Test
    @DisplayName("第一笔成交直接作为初始值")
    void testFirstUpdate_InitializesValue() {
        EwmaState state = new EwmaState(10);
        assertFalse(state.initialized());

        assertEquals(100.0, state.update(100.0, 1_000));
        assertTrue(state.initialized());
        assertEquals(1_000, state.lastTimestamp());
    }

    @Test
    @DisplayName("经过一个半衰期，旧值权重为 0.5")
    void testHalfLife_DecaysToHalf() {
        EwmaState state = new EwmaState(10);
        state.update(100.0, 0);

        double value = state.update(200.0, 10_000);

        assertEquals(150.0, value, 1e-9);
        assertEquals(0.5, EwmaState.decayFactor(10_000, 10), 1e-12);
    }

    @Test
    @DisplayName("半衰期越短，越快贴近最新价格")
    void testShorterHalfLife_ReactsFaster() {
        EwmaState fast = new EwmaState(1);
        EwmaState slow = new EwmaState(60);
        fast.update(100.0, 0);
        slow.update(100.0, 0);

        double fastValue = fast.update(200.0, 2_000);
        double slowValue = slow.update(200.0, 2_000);

        assertTrue(fastValue > slowValue);
        assertEquals(175.0, fastValue, 1e-9);
    }

    @Test
    @DisplayName("非正半衰期被拒绝")
    void testInvalidHalfLife() {
        assertThrows(IllegalArgumentException.class, () -> new EwmaState(0));
        assertThrows(IllegalArgumentException.class, () -> new EwmaState(-1));
        assertEquals(1.0, EwmaState.decayFactor(0, 5));
    }
}
