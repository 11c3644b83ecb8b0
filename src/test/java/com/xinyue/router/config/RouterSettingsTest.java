package com.xinyue.router.config;

import com.xinyue.router.common.Exchange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("路由配置测试")
class RouterSettingsTest {

    @Test
    @DisplayName("只有 classpath 配置时使用默认值")
    void testLoad_ClasspathDefaults() {
        RouterSettings settings = RouterSettings.load(Map.of(), new Properties());

        assertEquals(List.of(Exchange.BINANCE, Exchange.OKX), settings.exchanges());
        assertEquals(8765, settings.wsPort());
        assertEquals("/ws", settings.wsPath());
        assertEquals(2_000L, settings.klineCloseGraceMs());
    }

    @Test
    @DisplayName("外部文件 < 环境变量 < System property 依次覆盖")
    void testLoad_LayeredOverrides(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("router-prod.properties");
        Files.writeString(file, String.join("\n",
                "router.ws.port=9100",
                "router.symbols=BTCUSDT",
                "router.ws.path=/stream",
                "router.ringbuffer.size=1024"), StandardCharsets.UTF_8);

        Map<String, String> env = Map.of(
                "ROUTER_CONFIG", file.toString(),
                "ROUTER_WS_PORT", "9200",
                "ROUTER_OUTBOUND_QUEUE_CAPACITY", "64",
                "PATH", "/usr/bin");
        Properties system = new Properties();
        system.setProperty("router.ws.port", "9300");
        system.setProperty("user.home", "/home/x");

        RouterSettings settings = RouterSettings.load(env, system);

        assertEquals(9300, settings.wsPort());
        assertEquals(64, settings.outboundQueueCapacity());
        assertEquals(List.of("BTCUSDT"), settings.symbols());
        assertEquals("/stream", settings.wsPath());
        assertEquals(1024, settings.ringBufferSize());
    }

    @Test
    @DisplayName("外部文件不存在时启动失败")
    void testLoad_MissingExternalFile(@TempDir Path dir) {
        Properties system = new Properties();
        system.setProperty(RouterSettings.EXTERNAL_FILE_KEY, dir.resolve("missing.properties").toString());

        assertThrows(IllegalStateException.class, () -> RouterSettings.load(Map.of(), system));
    }

    @Test
    @DisplayName("空交易对、非法端口、非法整数和过短密钥都被拒绝")
    void testValidate_RejectsBadValues() {
        assertInvalid("router.symbols", " , ");
        assertInvalid("router.exchanges", "binance,kraken");
        assertInvalid("router.ws.port", "0");
        assertInvalid("router.ws.port", "70000");
        assertInvalid("router.ws.port", "eighty");
        assertInvalid("router.ws.path", "ws");
        assertInvalid("router.jwt.secret", "too-short");
        assertInvalid("router.ringbuffer.size", "1000");
        assertInvalid("router.outbound.queue.capacity", "0");
        assertInvalid("router.kline.close.grace.ms", "-1");
    }

    @Test
    @DisplayName("非法整数的错误信息带上配置项名称")
    void testValidate_MessageNamesKey() {
        Properties props = new Properties();
        props.setProperty("router.feed.idle.seconds", "3O");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new RouterSettings(props));
        assertTrue(e.getMessage().contains("router.feed.idle.seconds"));
        assertInstanceOf(NumberFormatException.class, e.getCause());
    }

    private static void assertInvalid(String key, String value) {
        Properties props = new Properties();
        props.setProperty(key, value);
        assertThrows(IllegalStateException.class, () -> new RouterSettings(props), key + "=" + value);
    }
}
