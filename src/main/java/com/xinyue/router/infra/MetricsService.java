package com.xinyue.router.infra;

import com.xinyue.router.common.Exchange;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 系统级 KPI，基于 Micrometer。
 * <p>
 * 计数器在构造时全部注册好，热路径上只做 increment，不做 registry 查找。
 * 默认使用 {@link SimpleMeterRegistry}，需要接 Prometheus 时换成对应的 registry 即可。
 */
public final class MetricsService {

    public static final String FEED_MALFORMED = "router.feed.malformed";
    public static final String FEED_RECONNECTS = "router.feed.reconnects";
    public static final String FEED_TICKS = "router.feed.ticks";
    public static final String CLIENT_MALFORMED = "router.client.frames.malformed";
    public static final String OUTBOUND_DROPPED = "router.client.outbound.dropped";
    public static final String TRADES_IGNORED = "router.market.trades.ignored";
    public static final String KLINE_LATE = "router.market.kline.late";
    public static final String ORDERS = "router.oms.orders";
    public static final String FILLS = "router.oms.fills";

    private final MeterRegistry registry;

    private final Map<Exchange, Counter> malformedByExchange = new EnumMap<>(Exchange.class);
    private final Map<Exchange, Counter> reconnectsByExchange = new EnumMap<>(Exchange.class);
    private final Counter malformedClientFrames;
    private final Counter droppedOutbound;
    private final Counter ignoredTrades;
    private final Counter ticksPublished;
    private final Counter orders;
    private final Counter fills;

    public MetricsService() {
        this(new SimpleMeterRegistry());
    }

    public MetricsService(MeterRegistry registry) {
        this.registry = registry;
        registry.config().commonTags(List.of(Tag.of("service", "market-router")));

        for (Exchange exchange : Exchange.values()) {
            malformedByExchange.put(exchange, Counter.builder(FEED_MALFORMED)
                    .description("丢弃的畸形交易所消息")
                    .tag("exchange", exchange.wireName())
                    .register(registry));
            reconnectsByExchange.put(exchange, Counter.builder(FEED_RECONNECTS)
                    .description("交易所连接重连次数")
                    .tag("exchange", exchange.wireName())
                    .register(registry));
        }
        malformedClientFrames = Counter.builder(CLIENT_MALFORMED)
                .description("无法解析的客户端帧")
                .register(registry);
        droppedOutbound = Counter.builder(OUTBOUND_DROPPED)
                .description("出站队列已满而丢弃的推送")
                .register(registry);
        ignoredTrades = Counter.builder(TRADES_IGNORED)
                .description("时间戳不递增、K 线和 EWMA 忽略的成交")
                .register(registry);
        ticksPublished = Counter.builder(FEED_TICKS)
                .description("发布到 RingBuffer 的 tick")
                .register(registry);
        orders = Counter.builder(ORDERS)
                .description("接受的模拟订单")
                .register(registry);
        fills = Counter.builder(FILLS)
                .description("模拟成交笔数")
                .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    public void recordMalformed(Exchange exchange) {
        malformedByExchange.get(exchange).increment();
    }

    public long malformedCount(Exchange exchange) {
        return (long) malformedByExchange.get(exchange).count();
    }

    public void recordReconnect(Exchange exchange) {
        reconnectsByExchange.get(exchange).increment();
    }

    public long reconnectCount(Exchange exchange) {
        return (long) reconnectsByExchange.get(exchange).count();
    }

    public void recordMalformedClientFrame() {
        malformedClientFrames.increment();
    }

    public long malformedClientFrames() {
        return (long) malformedClientFrames.count();
    }

    public void recordDroppedOutbound() {
        droppedOutbound.increment();
    }

    public long droppedOutbound() {
        return (long) droppedOutbound.count();
    }

    /**
     * 时间戳不大于该范围最近一笔成交的 tick，K 线 / EWMA 忽略。
     */
    public void recordIgnoredTrade() {
        ignoredTrades.increment();
    }

    public long ignoredTrades() {
        return (long) ignoredTrades.count();
    }

    /**
     * 超过宽限期才到达、所属 K 线桶已被时钟封闭的成交，按范围打标签。
     */
    public void recordLateKlineTrade(String scope) {
        Counter.builder(KLINE_LATE)
                .description("所属 K 线桶已封闭的迟到成交")
                .tag("scope", scope)
                .register(registry)
                .increment();
    }

    public long lateKlineTrades() {
        double total = 0;
        for (Counter counter : registry.find(KLINE_LATE).counters()) {
            total += counter.count();
        }
        return (long) total;
    }

    public void recordTick() {
        ticksPublished.increment();
    }

    public long ticks() {
        return (long) ticksPublished.count();
    }

    public void recordOrder() {
        orders.increment();
    }

    public void recordFill() {
        fills.increment();
    }

    public long fills() {
        return (long) fills.count();
    }

    public long orders() {
        return (long) orders.count();
    }
}
