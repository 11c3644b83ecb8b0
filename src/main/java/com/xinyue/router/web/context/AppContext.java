package com.xinyue.router.web.context;

import com.lmax.disruptor.dsl.Disruptor;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.config.RouterSettings;
import com.xinyue.router.core.CoreEngine;
import com.xinyue.router.core.CoreEventFactory;
import com.xinyue.router.core.market.AggregationEventHandler;
import com.xinyue.router.core.market.EwmaRegistry;
import com.xinyue.router.core.oms.MatchingEventHandler;
import com.xinyue.router.core.oms.OrderManagementSystem;
import com.xinyue.router.core.position.PositionManager;
import com.xinyue.router.core.store.JsonFileStateStore;
import com.xinyue.router.core.store.SnapshotScheduler;
import com.xinyue.router.core.store.StateSnapshot;
import com.xinyue.router.core.store.StateStore;
import com.xinyue.router.hub.SubscriptionHub;
import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.Normalizer;
import com.xinyue.router.io.input.AccessLayerCoordinator;
import com.xinyue.router.io.input.ReconnectBackoff;
import com.xinyue.router.io.input.binance.BinanceFeedParser;
import com.xinyue.router.io.input.binance.BinanceMarketDataConnector;
import com.xinyue.router.io.input.okx.OkxFeedParser;
import com.xinyue.router.io.input.okx.OkxMarketDataConnector;
import com.xinyue.router.io.server.ClientWebSocketServer;
import com.xinyue.router.web.service.JwtTokenService;
import com.xinyue.router.web.service.UserService;
import org.noear.solon.annotation.Component;
import org.noear.solon.annotation.Init;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 应用上下文管理器。
 * 负责初始化和管理系统的核心组件：先恢复持久化状态，再启动行情管道和客户端服务。
 */
@Component
public class AppContext {

    private static final Logger LOG = LoggerFactory.getLogger(AppContext.class);

    private RouterSettings settings;
    private SymbolRegistry symbolRegistry;
    private MetricsService metricsService;
    private OrderManagementSystem oms;
    private UserService userService;
    private JwtTokenService tokenService;
    private SubscriptionHub hub;
    private AccessLayerCoordinator accessLayerCoordinator;
    private CoreEngine coreEngine;
    private ClientWebSocketServer clientServer;
    private StateStore stateStore;
    private SnapshotScheduler snapshotScheduler;
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    @Init
    public void init() {
        LOG.info("正在初始化应用上下文...");
        try {
            RouterSettings loaded = RouterSettings.load();
            assemble(loaded, new JsonFileStateStore(Path.of(loaded.statePath())));
            start();
            LOG.info("应用上下文初始化完成");
        } catch (Exception e) {
            LOG.error("应用上下文初始化失败", e);
            throw new IllegalStateException("应用上下文初始化失败", e);
        }
    }

    /**
     * 创建并连接所有组件，恢复状态，但不启动任何线程或网络连接。
     */
    public void assemble(RouterSettings settings, StateStore stateStore) {
        this.settings = settings;
        this.stateStore = stateStore;

        // L4 基础设施层
        metricsService = new MetricsService();
        symbolRegistry = new SymbolRegistry(settings.symbols());
        EwmaRegistry ewmaRegistry = new EwmaRegistry();

        userService = new UserService();
        tokenService = new JwtTokenService(settings.jwtSecret(), Duration.ofMinutes(settings.jwtTtlMinutes()));

        // 撮合引擎
        PositionManager positionManager = new PositionManager();
        oms = new OrderManagementSystem(symbolRegistry, positionManager, metricsService);

        // 订阅中心
        EnumSet<Exchange> exchanges = EnumSet.noneOf(Exchange.class);
        exchanges.addAll(settings.exchanges());
        hub = new SubscriptionHub(symbolRegistry, exchanges, ewmaRegistry, tokenService::verify,
                metricsService, settings.outboundQueueCapacity());
        oms.setListener(hub);

        // 持久化状态必须在行情进入之前恢复
        StateSnapshot snapshot = stateStore.load();
        userService.restore(snapshot.users());
        oms.restore(snapshot.ledger());

        // Disruptor：聚合引擎与撮合引擎并行消费
        AggregationEventHandler aggregation = new AggregationEventHandler(symbolRegistry, ewmaRegistry, metricsService, hub,
                settings.klineCloseGraceMs());
        MatchingEventHandler matching = new MatchingEventHandler(symbolRegistry, oms);
        Disruptor<CoreEvent> disruptor = CoreEngine.bootstrapDisruptor(
                new CoreEventFactory(), settings.ringBufferSize(), aggregation, matching);

        // 接入层
        Normalizer normalizer = new Normalizer(disruptor.getRingBuffer(), metricsService);
        accessLayerCoordinator = new AccessLayerCoordinator();
        for (Exchange exchange : settings.exchanges()) {
            ReconnectBackoff backoff = new ReconnectBackoff(settings.reconnectInitialMs(), settings.reconnectMaxMs());
            switch (exchange) {
                case BINANCE -> {
                    normalizer.register(new BinanceFeedParser(symbolRegistry));
                    accessLayerCoordinator.register(new BinanceMarketDataConnector(settings.binanceUrl(),
                            symbolRegistry, normalizer, metricsService, backoff,
                            settings.feedIdleSeconds(), settings.feedKeepaliveSeconds()));
                }
                case OKX -> {
                    normalizer.register(new OkxFeedParser(symbolRegistry));
                    accessLayerCoordinator.register(new OkxMarketDataConnector(settings.okxUrl(),
                            symbolRegistry, normalizer, metricsService, backoff,
                            settings.feedIdleSeconds(), settings.feedKeepaliveSeconds()));
                }
            }
        }

        coreEngine = new CoreEngine(disruptor, accessLayerCoordinator);
        clientServer = new ClientWebSocketServer(settings.wsPort(), settings.wsPath(), hub);
        snapshotScheduler = new SnapshotScheduler(stateStore, this::snapshot, settings.snapshotIntervalSeconds());
    }

    public void start() {
        coreEngine.start();
        clientServer.start();
        snapshotScheduler.start();
        // 唯一的 shutdown hook，保证停止顺序
        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "app-context-shutdown"));
    }

    /**
     * 先断开客户端和行情、排空 RingBuffer，最后保存状态。重复调用无效果。
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        LOG.info("正在停止应用上下文...");
        clientServer.stop();
        coreEngine.stop();
        snapshotScheduler.stop();
    }

    /**
     * 当前完整状态（用户 + 账本）。
     */
    public StateSnapshot snapshot() {
        return new StateSnapshot(StateSnapshot.CURRENT_VERSION, System.currentTimeMillis(),
                userService.export(), oms.exportLedger());
    }

    /**
     * 立即保存一次状态。
     */
    public void persist() {
        snapshotScheduler.saveNow();
    }

    // Getters
    public RouterSettings getSettings() {
        return settings;
    }

    public SymbolRegistry getSymbolRegistry() {
        return symbolRegistry;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public OrderManagementSystem getOms() {
        return oms;
    }

    public UserService getUserService() {
        return userService;
    }

    public JwtTokenService getTokenService() {
        return tokenService;
    }

    public SubscriptionHub getHub() {
        return hub;
    }

    public AccessLayerCoordinator getAccessLayerCoordinator() {
        return accessLayerCoordinator;
    }

    public StateStore getStateStore() {
        return stateStore;
    }
}
