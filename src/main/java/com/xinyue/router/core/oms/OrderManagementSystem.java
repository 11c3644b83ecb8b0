package com.xinyue.router.core.oms;

import com.xinyue.router.common.ScaleConstants;
import com.xinyue.router.common.Side;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.error.AlreadyTerminalException;
import com.xinyue.router.core.error.InvalidOrderException;
import com.xinyue.router.core.error.OrderNotFoundException;
import com.xinyue.router.core.market.BestTouch;
import com.xinyue.router.core.position.AccountPortfolio;
import com.xinyue.router.core.position.Asset;
import com.xinyue.router.core.position.Balance;
import com.xinyue.router.core.position.PositionManager;
import com.xinyue.router.core.position.ShardedLocks;
import com.xinyue.router.core.store.StateSnapshot;
import com.xinyue.router.infra.MetricsService;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * 模拟撮合引擎：冻结资金、挂单、按合并盘口成交和撤单。
 * <p>
 * 并发约定：
 * 1. 用户余额和订单状态只在持有该用户分片锁（{@link ShardedLocks}）时修改；
 * 2. 每个交易对的挂单队列和盘口余量由交易对锁保护；
 * 3. 加锁顺序固定为 交易对锁 -> 用户锁，成交前在用户锁内重新检查订单状态，因此撤单与成交互斥。
 */
public final class OrderManagementSystem {

    private static final Logger LOG = LoggerFactory.getLogger(OrderManagementSystem.class);

    private static final int USER_LOCK_SHARDS = 64;

    private final SymbolRegistry symbolRegistry;
    private final PositionManager positionManager;
    private final MetricsService metricsService;
    private final LongSupplier clock;
    private volatile OrderEventListener listener = OrderEventListener.NOOP;

    private final ShardedLocks userLocks = new ShardedLocks(USER_LOCK_SHARDS);
    private final SymbolMatchingState[] books;
    private final AtomicLong nextOrderId = new AtomicLong(1);

    private final ConcurrentHashMap<Long, Order> orders = new ConcurrentHashMap<>();
    // userId -> 该用户的订单（按提交顺序），只在用户锁内修改
    private final ConcurrentHashMap<String, List<Order>> ordersByUser = new ConcurrentHashMap<>();
    // userId|clientOrderId -> orderId
    private final ConcurrentHashMap<String, Long> clientOrderIds = new ConcurrentHashMap<>();

    public OrderManagementSystem(SymbolRegistry symbolRegistry,
                                 PositionManager positionManager,
                                 MetricsService metricsService,
                                 LongSupplier clock) {
        this.symbolRegistry = symbolRegistry;
        this.positionManager = positionManager;
        this.metricsService = metricsService;
        this.clock = clock;
        List<SymbolRegistry.SymbolInfo> symbols = symbolRegistry.all();
        this.books = new SymbolMatchingState[symbols.size() + 1];
        for (SymbolRegistry.SymbolInfo info : symbols) {
            books[info.id()] = new SymbolMatchingState(info.id(), info.symbol(), info.base(), info.quote());
        }
    }

    public OrderManagementSystem(SymbolRegistry symbolRegistry,
                                 PositionManager positionManager,
                                 MetricsService metricsService) {
        this(symbolRegistry, positionManager, metricsService, System::currentTimeMillis);
    }

    public void setListener(OrderEventListener listener) {
        this.listener = listener == null ? OrderEventListener.NOOP : listener;
    }

    // ==================== 账户 ====================

    public void deposit(String userId, String asset, long amountE8) {
        if (asset == null || asset.isBlank()) {
            throw new InvalidOrderException("asset is required");
        }
        if (amountE8 <= 0) {
            throw new InvalidOrderException("amount must be positive");
        }
        ReentrantLock lock = userLocks.forKey(userId);
        lock.lock();
        try {
            positionManager.deposit(userId, asset.trim().toUpperCase(), amountE8);
        } finally {
            lock.unlock();
        }
    }

    public Balance getBalance(String userId, String asset) {
        ReentrantLock lock = userLocks.forKey(userId);
        lock.lock();
        try {
            return positionManager.balance(userId, asset);
        } finally {
            lock.unlock();
        }
    }

    public List<Balance> balances(String userId) {
        ReentrantLock lock = userLocks.forKey(userId);
        lock.lock();
        try {
            return positionManager.balances(userId, symbolRegistry.assets());
        } finally {
            lock.unlock();
        }
    }

    // ==================== 下单 / 撤单 ====================

    public OrderSnapshot submitOrder(String userId, String symbol, Side side, long priceE8, long qtyE8) {
        return submitOrder(userId, symbol, side, priceE8, qtyE8, null);
    }

    /**
     * 冻结资金并挂单，随后立刻尝试用当前盘口撮合。
     *
     * @throws InvalidOrderException 参数非法、未知交易对或 clientOrderId 重复
     * @throws com.xinyue.router.core.error.InsufficientBalanceException 可用余额不足，此时不冻结任何资金
     */
    public OrderSnapshot submitOrder(String userId, String symbol, Side side,
                                     long priceE8, long qtyE8, String clientOrderId) {
        if (side == null) {
            throw new InvalidOrderException("side must be buy or sell");
        }
        if (priceE8 <= 0) {
            throw new InvalidOrderException("price must be positive");
        }
        if (qtyE8 <= 0) {
            throw new InvalidOrderException("quantity must be positive");
        }
        SymbolRegistry.SymbolInfo info = symbol == null ? null : symbolRegistry.info(symbol.trim().toUpperCase());
        if (info == null) {
            throw new InvalidOrderException("unknown symbol: " + symbol);
        }
        String clientId = clientOrderId == null || clientOrderId.isBlank() ? null : clientOrderId.trim();

        SymbolMatchingState book = books[info.id()];
        book.lock.lock();
        try {
            Order order;
            ReentrantLock userLock = userLocks.forKey(userId);
            userLock.lock();
            try {
                String clientKey = clientId == null ? null : userId + '|' + clientId;
                if (clientKey != null && clientOrderIds.containsKey(clientKey)) {
                    throw new InvalidOrderException("clientOrderId already exists: " + clientId);
                }
                long reserve;
                String reserveAsset;
                if (side == Side.BUY) {
                    reserve = ScaleConstants.notionalCeilE8(priceE8, qtyE8);
                    reserveAsset = book.quoteAsset;
                } else {
                    reserve = qtyE8;
                    reserveAsset = book.baseAsset;
                }
                positionManager.reserve(userId, reserveAsset, reserve);

                long now = clock.getAsLong();
                order = new Order(nextOrderId.getAndIncrement(), clientId, userId, info.id(), info.symbol(),
                        side, priceE8, qtyE8, reserve, now);
                orders.put(order.orderId, order);
                ordersByUser.computeIfAbsent(userId, k -> new ArrayList<>()).add(order);
                if (clientKey != null) {
                    clientOrderIds.put(clientKey, order.orderId);
                }
                book.resting.put(order.orderId, order);
            } finally {
                userLock.unlock();
            }
            metricsService.recordOrder();
            listener.onOrderUpdate(order.snapshot());

            // 新订单 ID 最大，之前的挂单已经消耗过当前盘口，只需撮合这一笔
            tryFill(book, order);
            if (!order.isActive()) {
                book.resting.remove(order.orderId);
            }
            return snapshotUnderUserLock(order);
        } finally {
            book.lock.unlock();
        }
    }

    /**
     * 撤单：释放剩余冻结资金。
     *
     * @throws OrderNotFoundException 订单不存在或不属于该用户
     * @throws AlreadyTerminalException 订单已成交或已撤销
     */
    public OrderSnapshot cancelOrder(String userId, long orderId) {
        Order order = orders.get(orderId);
        if (order == null || !order.userId.equals(userId)) {
            throw new OrderNotFoundException("order not found: " + orderId);
        }
        SymbolMatchingState book = books[order.symbolId];
        book.lock.lock();
        try {
            OrderSnapshot snapshot;
            ReentrantLock userLock = userLocks.forKey(userId);
            userLock.lock();
            try {
                if (!order.isActive()) {
                    throw new AlreadyTerminalException("order " + orderId + " is " + order.status.wire());
                }
                releaseReservation(order);
                order.status = OrderStatus.CANCELLED;
                order.updateTime = clock.getAsLong();
                snapshot = order.snapshot();
            } finally {
                userLock.unlock();
            }
            book.resting.remove(orderId);
            listener.onOrderUpdate(snapshot);
            return snapshot;
        } finally {
            book.lock.unlock();
        }
    }

    public OrderSnapshot cancelOrderByClientId(String userId, String clientOrderId) {
        Long orderId = clientOrderId == null ? null : clientOrderIds.get(userId + '|' + clientOrderId.trim());
        if (orderId == null) {
            throw new OrderNotFoundException("order not found: " + clientOrderId);
        }
        return cancelOrder(userId, orderId);
    }

    /**
     * @throws OrderNotFoundException 订单不存在或不属于该用户
     */
    public OrderSnapshot getOrder(String userId, long orderId) {
        Order order = orders.get(orderId);
        if (order == null || !order.userId.equals(userId)) {
            throw new OrderNotFoundException("order not found: " + orderId);
        }
        return snapshotUnderUserLock(order);
    }

    public OrderSnapshot getOrderByClientId(String userId, String clientOrderId) {
        Long orderId = clientOrderId == null ? null : clientOrderIds.get(userId + '|' + clientOrderId.trim());
        if (orderId == null) {
            throw new OrderNotFoundException("order not found: " + clientOrderId);
        }
        return getOrder(userId, orderId);
    }

    public List<OrderSnapshot> listOrders(String userId) {
        ReentrantLock lock = userLocks.forKey(userId);
        lock.lock();
        try {
            List<Order> own = ordersByUser.get(userId);
            if (own == null) {
                return List.of();
            }
            List<OrderSnapshot> result = new ArrayList<>(own.size());
            for (Order order : own) {
                result.add(order.snapshot());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public List<OrderSnapshot> openOrders(String userId) {
        List<OrderSnapshot> result = new ArrayList<>();
        for (OrderSnapshot order : listOrders(userId)) {
            if (!order.status().isTerminal()) {
                result.add(order);
            }
        }
        return result;
    }

    // ==================== 撮合 ====================

    /**
     * 合并盘口更新：刷新该交易对的可成交量，然后按订单 ID 升序撮合所有挂单。
     * 由撮合消费线程调用。
     */
    public void onTouch(short symbolId, BestTouch touch) {
        if (symbolId <= 0 || symbolId >= books.length || books[symbolId] == null) {
            return;
        }
        SymbolMatchingState book = books[symbolId];
        book.lock.lock();
        try {
            if (touch == null || touch.stale()) {
                book.refillTouch(0, 0, 0, 0);
                return;
            }
            book.refillTouch(touch.bidE8(), touch.bidQtyE8(), touch.askE8(), touch.askQtyE8());
            if (book.resting.isEmpty()) {
                return;
            }
            LongArrayList done = new LongArrayList();
            for (Order order : book.resting.values()) {
                if (!book.hasLiquidity()) {
                    break;
                }
                tryFill(book, order);
                if (!order.isActive()) {
                    done.add(order.orderId);
                }
            }
            for (int i = 0; i < done.size(); i++) {
                book.resting.remove(done.getLong(i));
            }
        } finally {
            book.lock.unlock();
        }
    }

    /**
     * 调用方已持有交易对锁。
     */
    private void tryFill(SymbolMatchingState book, Order order) {
        long fillQty = book.executableQty(order);
        if (fillQty <= 0) {
            return;
        }
        OrderSnapshot update = null;
        ReentrantLock userLock = userLocks.forKey(order.userId);
        userLock.lock();
        try {
            // 可能刚被撤销
            if (!order.isActive()) {
                return;
            }
            settle(book, order, fillQty);
            update = order.snapshot();
        } finally {
            userLock.unlock();
        }
        book.consume(order, fillQty);
        metricsService.recordFill();
        LOG.debug("成交 order={} user={} {} {} qtyE8={} priceE8={}",
                order.orderId, order.userId, order.side.wire(), order.symbol, fillQty, order.priceE8);
        listener.onOrderUpdate(update);
    }

    /**
     * 调用方已持有用户锁。成交价为订单限价。
     */
    private void settle(SymbolMatchingState book, Order order, long fillQty) {
        String user = order.userId;
        if (order.side == Side.BUY) {
            long cost = ScaleConstants.notionalCeilE8(order.priceE8, fillQty);
            long debit = Math.min(order.reservedE8, cost);
            positionManager.debitLocked(user, book.quoteAsset, debit);
            order.reservedE8 -= debit;
            positionManager.credit(user, book.baseAsset, fillQty);
        } else {
            positionManager.debitLocked(user, book.baseAsset, fillQty);
            order.reservedE8 -= fillQty;
            positionManager.credit(user, book.quoteAsset, ScaleConstants.notionalFloorE8(order.priceE8, fillQty));
        }
        order.filledQtyE8 += fillQty;
        order.updateTime = clock.getAsLong();
        if (order.getRemainingQtyE8() == 0) {
            order.status = OrderStatus.FILLED;
            // 向上取整留下的零头退回可用
            releaseReservation(order);
        } else {
            order.status = OrderStatus.PARTIALLY_FILLED;
        }
    }

    private void releaseReservation(Order order) {
        if (order.reservedE8 > 0) {
            SymbolMatchingState book = books[order.symbolId];
            String asset = order.side == Side.BUY ? book.quoteAsset : book.baseAsset;
            positionManager.release(order.userId, asset, order.reservedE8);
            order.reservedE8 = 0;
        }
    }

    private OrderSnapshot snapshotUnderUserLock(Order order) {
        ReentrantLock lock = userLocks.forKey(order.userId);
        lock.lock();
        try {
            return order.snapshot();
        } finally {
            lock.unlock();
        }
    }

    // ==================== 快照 ====================

    /**
     * 导出余额和订单。逐个用户在其锁内复制，单个用户内部一致。
     */
    public StateSnapshot.Ledger exportLedger() {
        Map<String, Map<String, StateSnapshot.BalanceEntry>> balances = new TreeMap<>();
        List<OrderSnapshot> orderList = new ArrayList<>();
        for (Map.Entry<String, AccountPortfolio> entry : positionManager.portfolios().entrySet()) {
            String userId = entry.getKey();
            ReentrantLock lock = userLocks.forKey(userId);
            lock.lock();
            try {
                Map<String, StateSnapshot.BalanceEntry> userBalances = new TreeMap<>();
                for (Map.Entry<String, Asset> asset : entry.getValue().assets().entrySet()) {
                    Asset a = asset.getValue();
                    userBalances.put(asset.getKey(), new StateSnapshot.BalanceEntry(a.total(), a.available));
                }
                balances.put(userId, userBalances);
                List<Order> own = ordersByUser.get(userId);
                if (own != null) {
                    for (Order order : own) {
                        orderList.add(order.snapshot());
                    }
                }
            } finally {
                lock.unlock();
            }
        }
        orderList.sort(Comparator.comparingLong(OrderSnapshot::orderId));
        return new StateSnapshot.Ledger(balances, orderList, nextOrderId.get());
    }

    /**
     * 启动时恢复余额和订单，必须在行情管道启动之前调用。
     * 未完成的订单按原 ID 重新进入挂单队列，保持原有优先级。
     */
    public void restore(StateSnapshot.Ledger ledger) {
        if (ledger == null) {
            return;
        }
        if (ledger.balances() != null) {
            ledger.balances().forEach((userId, assets) -> assets.forEach((asset, b) ->
                    positionManager.restore(userId, asset, b.totalE8(), b.availableE8())));
        }
        long maxId = 0;
        int restored = 0;
        if (ledger.orders() != null) {
            for (OrderSnapshot s : ledger.orders()) {
                SymbolRegistry.SymbolInfo info = symbolRegistry.info(s.symbol());
                if (info == null) {
                    LOG.warn("跳过未知交易对的订单 {} ({})", s.orderId(), s.symbol());
                    continue;
                }
                Order order = new Order(s.orderId(), s.clientOrderId(), s.userId(), info.id(), info.symbol(),
                        s.side(), s.priceE8(), s.quantityE8(), s.reservedE8(), s.createdAt());
                order.filledQtyE8 = s.filledQuantityE8();
                order.status = s.status();
                order.updateTime = s.updatedAt();
                orders.put(order.orderId, order);
                ordersByUser.computeIfAbsent(order.userId, k -> new ArrayList<>()).add(order);
                if (order.clientOrderId != null) {
                    clientOrderIds.put(order.userId + '|' + order.clientOrderId, order.orderId);
                }
                if (order.isActive()) {
                    books[info.id()].resting.put(order.orderId, order);
                }
                maxId = Math.max(maxId, order.orderId);
                restored++;
            }
        }
        nextOrderId.set(Math.max(ledger.nextOrderId(), maxId + 1));
        LOG.info("恢复账本：{} 个用户，{} 笔订单，nextOrderId={}",
                ledger.balances() == null ? 0 : ledger.balances().size(), restored, nextOrderId.get());
    }
}
