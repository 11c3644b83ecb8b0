package com.xinyue.router.config;

import com.xinyue.router.common.Exchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * 路由服务配置读取器。
 * <p>
 * 读取顺序（后者覆盖前者）：
 * 1. classpath 下的 router.properties；
 * 2. router.config 指向的外部 properties 文件（-Drouter.config=... 或环境变量 ROUTER_CONFIG）；
 * 3. ROUTER_ 开头的环境变量，ROUTER_WS_PORT 对应 router.ws.port；
 * 4. 同名 System property，例如 -Drouter.ws.port=9001。
 * <p>
 * 构造时校验全部取值，配置错误在启动阶段以 {@link IllegalStateException} 报出。
 */
public final class RouterSettings {

    private static final Logger LOG = LoggerFactory.getLogger(RouterSettings.class);

    public static final String RESOURCE = "router.properties";
    public static final String EXTERNAL_FILE_KEY = "router.config";
    private static final String ENV_PREFIX = "ROUTER_";

    private final Properties props;

    public RouterSettings(Properties props) {
        this.props = props;
        validate();
    }

    /**
     * 按上面的顺序叠加所有配置来源。
     */
    public static RouterSettings load() {
        return load(System.getenv(), System.getProperties());
    }

    static RouterSettings load(Map<String, String> env, Properties system) {
        Properties props = new Properties();
        try (InputStream is = RouterSettings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (is != null) {
                props.load(is);
            }
        } catch (IOException e) {
            throw new IllegalStateException("读取 " + RESOURCE + " 失败", e);
        }

        Properties overrides = new Properties();
        for (Map.Entry<String, String> entry : env.entrySet()) {
            if (entry.getKey().startsWith(ENV_PREFIX)) {
                overrides.setProperty(entry.getKey().toLowerCase(Locale.ROOT).replace('_', '.'), entry.getValue());
            }
        }
        for (String key : system.stringPropertyNames()) {
            if (key.startsWith("router.")) {
                overrides.setProperty(key, system.getProperty(key));
            }
        }

        String external = overrides.getProperty(EXTERNAL_FILE_KEY);
        if (external != null && !external.isBlank()) {
            Path path = Path.of(external.trim());
            try (InputStream is = Files.newInputStream(path)) {
                props.load(new InputStreamReader(is, StandardCharsets.UTF_8));
                LOG.info("已加载外部配置文件: {}", path);
            } catch (IOException e) {
                throw new IllegalStateException("读取外部配置文件失败: " + path, e);
            }
        }

        props.putAll(overrides);
        return new RouterSettings(props);
    }

    private void validate() {
        if (exchanges().isEmpty()) {
            throw new IllegalStateException("router.exchanges 至少需要一个交易所");
        }
        if (symbols().isEmpty()) {
            throw new IllegalStateException("router.symbols 至少需要一个交易对");
        }
        requirePort("router.ws.port", wsPort());
        if (!wsPath().startsWith("/")) {
            throw new IllegalStateException("router.ws.path 必须以 / 开头: " + wsPath());
        }
        requirePositive("router.outbound.queue.capacity", outboundQueueCapacity());
        if (jwtSecret().getBytes(StandardCharsets.UTF_8).length < 32) {
            throw new IllegalStateException("router.jwt.secret 至少需要 32 字节");
        }
        requirePositive("router.jwt.ttl.minutes", jwtTtlMinutes());
        requirePositive("router.state.snapshot.interval.seconds", snapshotIntervalSeconds());
        requirePositive("router.reconnect.initial.ms", reconnectInitialMs());
        if (reconnectMaxMs() < reconnectInitialMs()) {
            throw new IllegalStateException("router.reconnect.max.ms 不能小于 router.reconnect.initial.ms");
        }
        int ringSize = ringBufferSize();
        if (ringSize <= 0 || Integer.bitCount(ringSize) != 1) {
            throw new IllegalStateException("router.ringbuffer.size 必须是 2 的幂: " + ringSize);
        }
        requirePositive("router.feed.idle.seconds", feedIdleSeconds());
        requirePositive("router.feed.keepalive.seconds", feedKeepaliveSeconds());
        if (klineCloseGraceMs() < 0) {
            throw new IllegalStateException("router.kline.close.grace.ms 不能为负数");
        }
    }

    public List<Exchange> exchanges() {
        List<Exchange> exchanges = new ArrayList<>();
        for (String name : list("router.exchanges", "binance,okx")) {
            Exchange exchange = Exchange.fromWireName(name);
            if (exchange == null) {
                throw new IllegalStateException("router.exchanges 中存在未知交易所: " + name);
            }
            exchanges.add(exchange);
        }
        return exchanges;
    }

    public List<String> symbols() {
        return list("router.symbols", "BTCUSDT,ETHUSDT,SOLUSDT,ADAUSDT,XRPUSDT");
    }

    public int wsPort() {
        return intValue("router.ws.port", 8765);
    }

    public String wsPath() {
        return props.getProperty("router.ws.path", "/ws");
    }

    public int outboundQueueCapacity() {
        return intValue("router.outbound.queue.capacity", 1024);
    }

    public String jwtSecret() {
        return props.getProperty("router.jwt.secret", "CHANGE_ME_DEV_SECRET_CHANGE_ME_DEV_SECRET");
    }

    public long jwtTtlMinutes() {
        return longValue("router.jwt.ttl.minutes", 60L * 24);
    }

    public String statePath() {
        return props.getProperty("router.state.path", "data/state.json");
    }

    public long snapshotIntervalSeconds() {
        return longValue("router.state.snapshot.interval.seconds", 30L);
    }

    public long reconnectInitialMs() {
        return longValue("router.reconnect.initial.ms", 500L);
    }

    public long reconnectMaxMs() {
        return longValue("router.reconnect.max.ms", 30_000L);
    }

    public int ringBufferSize() {
        return intValue("router.ringbuffer.size", 4096);
    }

    public String binanceUrl() {
        return props.getProperty("router.feed.binance.url", "wss://stream.binance.com:9443/stream");
    }

    public String okxUrl() {
        return props.getProperty("router.feed.okx.url", "wss://ws.okx.com:8443/ws/v5/public");
    }

    /**
     * 超过该时间没有收到任何数据则认为连接已死，主动断开重连。
     */
    public int feedIdleSeconds() {
        return intValue("router.feed.idle.seconds", 30);
    }

    public int feedKeepaliveSeconds() {
        return intValue("router.feed.keepalive.seconds", 20);
    }

    /**
     * 时钟封闭 K 线桶前等待迟到成交的时间。
     * 成交时间来自交易所，时钟来自本机，两者之间有网络延迟和时钟偏差。
     */
    public long klineCloseGraceMs() {
        return longValue("router.kline.close.grace.ms", 2_000L);
    }

    private List<String> list(String key, String defaultValue) {
        List<String> values = new ArrayList<>();
        for (String part : props.getProperty(key, defaultValue).split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private int intValue(String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " 不是合法整数: " + value, e);
        }
    }

    private long longValue(String key, long defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(key + " 不是合法整数: " + value, e);
        }
    }

    private static void requirePort(String key, int port) {
        if (port < 1 || port > 65_535) {
            throw new IllegalStateException(key + " 超出端口范围: " + port);
        }
    }

    private static void requirePositive(String key, long value) {
        if (value <= 0) {
            throw new IllegalStateException(key + " 必须大于 0: " + value);
        }
    }
}
