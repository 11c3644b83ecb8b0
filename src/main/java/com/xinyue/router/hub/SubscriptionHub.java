package com.xinyue.router.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.error.ErrorCode;
import com.xinyue.router.core.error.TradingException;
import com.xinyue.router.core.market.BestTouch;
import com.xinyue.router.core.market.EwmaRegistry;
import com.xinyue.router.core.market.EwmaUpdate;
import com.xinyue.router.core.market.KlineBucket;
import com.xinyue.router.core.market.KlineInterval;
import com.xinyue.router.core.market.MarketEventListener;
import com.xinyue.router.core.market.TradePrint;
import com.xinyue.router.core.oms.OrderEventListener;
import com.xinyue.router.core.oms.OrderSnapshot;
import com.xinyue.router.infra.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 订阅中心：维护 (连接, 订阅) 关系，把聚合引擎和撮合引擎的事件投递给匹配的连接。
 * <p>
 * 路由按 {@link StreamTopic} 精确查表：scope = "all" 的订阅只收合并盘口的事件，不会收到单个交易所的事件。
 * 订单更新推送给该用户所有已认证的连接，不需要订阅。
 * 投递只做非阻塞入队，慢连接只会丢自己的消息。
 */
public final class SubscriptionHub implements MarketEventListener, OrderEventListener {

    private static final Logger LOG = LoggerFactory.getLogger(SubscriptionHub.class);

    static final String INVALID_SUBSCRIPTION = "INVALID_SUBSCRIPTION";
    static final String MALFORMED = "MALFORMED";
    static final String UNKNOWN_ACTION = "UNKNOWN_ACTION";

    private final SymbolRegistry symbolRegistry;
    private final Set<Exchange> exchanges;
    private final EwmaRegistry ewmaRegistry;
    private final TokenAuthenticator authenticator;
    private final MetricsService metricsService;
    private final int queueCapacity;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HubMessages messages = new HubMessages(mapper);
    private final AtomicLong sessionIds = new AtomicLong();

    private final ConcurrentHashMap<String, ClientSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<StreamTopic, Set<ClientSession>> subscribers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Set<ClientSession>> sessionsByUser = new ConcurrentHashMap<>();

    public SubscriptionHub(SymbolRegistry symbolRegistry,
                           Set<Exchange> exchanges,
                           EwmaRegistry ewmaRegistry,
                           TokenAuthenticator authenticator,
                           MetricsService metricsService,
                           int queueCapacity) {
        this.symbolRegistry = symbolRegistry;
        this.exchanges = exchanges;
        this.ewmaRegistry = ewmaRegistry;
        this.authenticator = authenticator;
        this.metricsService = metricsService;
        this.queueCapacity = queueCapacity;
    }

    // ==================== 连接生命周期 ====================

    public ClientSession onConnect(SessionTransport transport) {
        ClientSession session = new ClientSession("c" + sessionIds.incrementAndGet(), transport, queueCapacity);
        sessions.put(session.id(), session);
        LOG.info("客户端连接 {} ({})，当前 {} 个", session.id(), transport.remoteAddress(), sessions.size());
        return session;
    }

    /**
     * 连接断开：移除它的所有订阅并释放 EWMA 登记，余额和订单不受影响。
     */
    public void onDisconnect(ClientSession session) {
        if (sessions.remove(session.id()) == null) {
            return;
        }
        session.markClosed();
        for (Map.Entry<StreamTopic, StreamSpec> entry : session.subscriptions().entrySet()) {
            removeSubscriber(entry.getKey(), session);
            if (entry.getValue().kind() == StreamKind.EWMA) {
                ewmaRegistry.unregister(entry.getValue().ewmaKey());
            }
        }
        session.subscriptions().clear();
        String userId = session.userId();
        if (userId != null) {
            Set<ClientSession> own = sessionsByUser.get(userId);
            if (own != null) {
                own.remove(session);
            }
        }
        LOG.info("客户端断开 {}，丢弃消息 {} 条，当前 {} 个", session.id(), session.droppedCount(), sessions.size());
    }

    /**
     * 处理一条入站文本帧。
     */
    public void onFrame(ClientSession session, String text) {
        JsonNode msg;
        try {
            msg = mapper.readTree(text);
        } catch (JsonProcessingException e) {
            metricsService.recordMalformedClientFrame();
            session.offer(messages.error(MALFORMED, "invalid json"));
            return;
        }
        if (msg == null || !msg.isObject()) {
            metricsService.recordMalformedClientFrame();
            session.offer(messages.error(MALFORMED, "expected a json object"));
            return;
        }
        String action = msg.path("action").asText("");
        switch (action) {
            case "auth" -> handleAuth(session, msg);
            case "subscribe" -> handleSubscribe(session, msg);
            case "unsubscribe" -> handleUnsubscribe(session, msg);
            case "ping" -> session.offer(messages.pong());
            default -> session.offer(messages.error(UNKNOWN_ACTION, "unknown action"));
        }
    }

    private void handleAuth(ClientSession session, JsonNode msg) {
        String token = msg.path("token").asText("");
        String userId;
        try {
            userId = authenticator.authenticate(token);
        } catch (TradingException e) {
            session.offer(messages.error(ErrorCode.UNAUTHORIZED.name(), e.getMessage()));
            return;
        }
        String previous = session.userId();
        if (previous != null && !previous.equals(userId)) {
            Set<ClientSession> own = sessionsByUser.get(previous);
            if (own != null) {
                own.remove(session);
            }
        }
        session.authenticate(userId);
        sessionsByUser.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(session);
        session.offer(messages.authOk(userId));
    }

    private void handleSubscribe(ClientSession session, JsonNode msg) {
        if (!session.isAuthenticated()) {
            session.offer(messages.error(ErrorCode.UNAUTHORIZED.name(), "authenticate before subscribing"));
            return;
        }
        StreamSpec spec;
        try {
            spec = parseSpec(msg);
        } catch (IllegalArgumentException e) {
            session.offer(messages.error(INVALID_SUBSCRIPTION, e.getMessage()));
            return;
        }
        StreamTopic topic = spec.topic();
        if (session.subscriptions().putIfAbsent(topic, spec) == null) {
            subscribers.compute(topic, (k, set) -> {
                Set<ClientSession> target = set == null ? ConcurrentHashMap.newKeySet() : set;
                target.add(session);
                return target;
            });
            if (spec.kind() == StreamKind.EWMA) {
                ewmaRegistry.register(spec.ewmaKey());
            }
        }
        session.offer(messages.subscription("subscribed", spec));
    }

    /**
     * 按 stream + symbol 取消，带了 exchange / interval / half_life 时只取消匹配的那一条。
     */
    private void handleUnsubscribe(ClientSession session, JsonNode msg) {
        String stream = msg.path("stream").asText("");
        String symbol = msg.path("symbol").asText("").toUpperCase();
        StreamKind kind = StreamKind.fromWire(stream);
        // 与 parseSpec 相同的归一化，否则大小写不同的请求匹配不到已有订阅
        String scope = msg.hasNonNull("exchange") ? msg.get("exchange").asText().toLowerCase() : null;
        String interval = null;
        if (msg.hasNonNull("interval")) {
            KlineInterval parsed = KlineInterval.fromLabel(msg.get("interval").asText());
            interval = parsed == null ? msg.get("interval").asText() : parsed.label();
        }
        String halfLife = msg.hasNonNull("half_life") ? StreamTopic.halfLifeParam(msg.get("half_life").asDouble()) : null;

        int removed = 0;
        Iterator<Map.Entry<StreamTopic, StreamSpec>> it = session.subscriptions().entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<StreamTopic, StreamSpec> entry = it.next();
            StreamTopic topic = entry.getKey();
            if (topic.kind() != kind || !topic.symbol().equals(symbol)) {
                continue;
            }
            if (scope != null && !topic.scope().equals(scope)) {
                continue;
            }
            if (kind == StreamKind.KLINES && interval != null && !topic.param().equals(interval)) {
                continue;
            }
            if (kind == StreamKind.EWMA && halfLife != null && !topic.param().equals(halfLife)) {
                continue;
            }
            it.remove();
            removeSubscriber(topic, session);
            if (kind == StreamKind.EWMA) {
                ewmaRegistry.unregister(entry.getValue().ewmaKey());
            }
            removed++;
        }
        session.offer(messages.unsubscribed(stream, symbol, removed));
    }

    /**
     * 校验并解析订阅请求，只在订阅时做一次。
     */
    StreamSpec parseSpec(JsonNode msg) {
        StreamKind kind = StreamKind.fromWire(msg.path("stream").asText(""));
        if (kind == null) {
            throw new IllegalArgumentException("unknown stream: " + msg.path("stream").asText(""));
        }
        String symbol = msg.path("symbol").asText("").toUpperCase();
        if (symbolRegistry.info(symbol) == null) {
            throw new IllegalArgumentException("unknown symbol: " + symbol);
        }
        String scope = msg.hasNonNull("exchange") ? msg.get("exchange").asText().toLowerCase() : Exchange.ALL_SCOPE;
        if (!Exchange.ALL_SCOPE.equals(scope)) {
            Exchange exchange = Exchange.fromWireName(scope);
            if (exchange == null || !exchanges.contains(exchange)) {
                throw new IllegalArgumentException("unknown exchange: " + scope);
            }
        }
        return switch (kind) {
            case BEST_TOUCH -> StreamSpec.bestTouch(symbol, scope);
            case TRADES -> StreamSpec.trades(symbol, scope);
            case KLINES -> {
                KlineInterval interval = KlineInterval.fromLabel(msg.path("interval").asText(null));
                if (interval == null) {
                    throw new IllegalArgumentException("interval must be one of 1s, 10s, 1m, 5m");
                }
                yield StreamSpec.klines(symbol, scope, interval);
            }
            case EWMA -> {
                JsonNode h = msg.get("half_life");
                if (h == null || !h.isNumber() || !(h.asDouble() > 0) || Double.isInfinite(h.asDouble())) {
                    throw new IllegalArgumentException("half_life must be a positive number of seconds");
                }
                yield StreamSpec.ewma(symbol, scope, h.asDouble());
            }
        };
    }

    private void removeSubscriber(StreamTopic topic, ClientSession session) {
        subscribers.computeIfPresent(topic, (k, set) -> {
            set.remove(session);
            return set.isEmpty() ? null : set;
        });
    }

    // ==================== 事件投递 ====================

    @Override
    public void onBestTouch(BestTouch touch) {
        if (touch == null) {
            return;
        }
        Set<ClientSession> targets = subscribers.get(StreamTopic.of(StreamKind.BEST_TOUCH, touch.symbol(), touch.scope()));
        if (targets != null && !targets.isEmpty()) {
            deliver(targets, messages.bestTouch(touch));
        }
    }

    @Override
    public void onTrade(TradePrint trade) {
        Set<ClientSession> targets = subscribers.get(StreamTopic.of(StreamKind.TRADES, trade.symbol(), trade.scope()));
        if (targets != null && !targets.isEmpty()) {
            deliver(targets, messages.trade(trade));
        }
    }

    @Override
    public void onKline(KlineBucket bucket) {
        Set<ClientSession> targets = subscribers.get(
                new StreamTopic(StreamKind.KLINES, bucket.symbol(), bucket.scope(), bucket.interval().label()));
        if (targets != null && !targets.isEmpty()) {
            deliver(targets, messages.kline(bucket));
        }
    }

    @Override
    public void onEwma(EwmaUpdate update) {
        Set<ClientSession> targets = subscribers.get(new StreamTopic(StreamKind.EWMA,
                update.key().symbol(), update.key().scope(), StreamTopic.halfLifeParam(update.key().halfLifeSeconds())));
        if (targets != null && !targets.isEmpty()) {
            deliver(targets, messages.ewma(update));
        }
    }

    @Override
    public void onOrderUpdate(OrderSnapshot order) {
        Set<ClientSession> targets = sessionsByUser.get(order.userId());
        if (targets != null && !targets.isEmpty()) {
            deliver(targets, messages.order(order));
        }
    }

    private void deliver(Set<ClientSession> targets, String payload) {
        for (ClientSession session : targets) {
            if (!session.offer(payload)) {
                metricsService.recordDroppedOutbound();
            }
        }
    }

    // ==================== 诊断 ====================

    public int sessionCount() {
        return sessions.size();
    }

    public int subscriberCount(StreamTopic topic) {
        Set<ClientSession> set = subscribers.get(topic);
        return set == null ? 0 : set.size();
    }

    public List<ClientSession> sessions() {
        return new ArrayList<>(sessions.values());
    }
}
