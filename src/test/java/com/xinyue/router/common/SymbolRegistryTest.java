package com.xinyue.router.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("交易对注册表和定点数测试")
class SymbolRegistryTest {

    @Test
    @DisplayName("交易对按报价资产后缀拆分，id 从 1 开始")
    void testRegistry() {
        SymbolRegistry registry = new SymbolRegistry(List.of("btcusdt", "ETHBTC", "SOLUSDC", "BTCUSDT"));

        assertEquals(3, registry.all().size());
        assertEquals(1, registry.get("BTCUSDT"));
        assertEquals("BTC", registry.info("BTCUSDT").base());
        assertEquals("BTC", registry.info("ETHBTC").quote());
        assertEquals("USDC", registry.info("SOLUSDC").quote());
        assertEquals(-1, registry.get("DOGEUSDT"));
        assertNull(registry.info((short) 0));
        assertEquals(List.of("BTC", "ETH", "SOL", "USDC", "USDT"), registry.assets());
    }

    @Test
    @DisplayName("定点数解析、取整和输出")
    void testScaleConstants() {
        assertEquals(5_000_012_000_000L, ScaleConstants.parseE8("50000.12"));
        assertEquals(1L, ScaleConstants.parseE8("0.000000019"));
        assertEquals(1L, ScaleConstants.notionalCeilE8(30_000_000L, 2L));
        assertEquals(0L, ScaleConstants.notionalFloorE8(30_000_000L, 2L));
        assertEquals("100", ScaleConstants.toDecimal(100 * ScaleConstants.SCALE_E8).toPlainString());
        assertEquals("0.01", ScaleConstants.toDecimal(1_000_000L).toString());
        assertEquals("100", ScaleConstants.toDecimal(100 * ScaleConstants.SCALE_E8).toString());
        assertThrows(NumberFormatException.class, () -> ScaleConstants.parseE8("abc"));
    }
}
