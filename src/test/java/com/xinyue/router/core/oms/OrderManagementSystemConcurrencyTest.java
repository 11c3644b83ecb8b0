package com.xinyue.router.core.oms;

import com.xinyue.router.common.ScaleConstants;
import com.xinyue.router.common.Side;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.core.error.AlreadyTerminalException;
import com.xinyue.router.core.market.BestTouch;
import com.xinyue.router.core.position.Balance;
import com.xinyue.router.core.position.PositionManager;
import com.xinyue.router.infra.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("模拟撮合引擎并发测试")
class OrderManagementSystemConcurrencyTest {

    private static final long E8 = ScaleConstants.SCALE_E8;

    private static BestTouch ask(long priceE8, long qtyE8) {
        return new BestTouch("BTCUSDT", "all", 0, 0, priceE8, qtyE8, null, "okx", 1_000L, false);
    }

    private static void assertConsistent(OrderManagementSystem oms, String user) {
        long reservedQuote = 0;
        long reservedBase = 0;
        for (OrderSnapshot o : oms.openOrders(user)) {
            if (o.side() == Side.BUY) {
                reservedQuote += o.reservedE8();
            } else {
                reservedBase += o.reservedE8();
            }
        }
        Balance usdt = oms.getBalance(user, "USDT");
        Balance btc = oms.getBalance(user, "BTC");
        assertEquals(usdt.totalE8(), usdt.availableE8() + reservedQuote, "USDT available + reserved == total");
        assertEquals(btc.totalE8(), btc.availableE8() + reservedBase, "BTC available + reserved == total");
        assertTrue(usdt.availableE8() >= 0);
        assertTrue(btc.availableE8() >= 0);
    }

    private static void await(CountDownLatch done) throws InterruptedException {
        assertTrue(done.await(10, TimeUnit.SECONDS), "worker threads did not finish");
    }

    @Test
    @DisplayName("撤单与盘口撮合并发时，订单不会既成交完又被撤销，余额始终守恒")
    void testCancelRacesFill() throws Exception {
        for (int round = 0; round < 300; round++) {
            SymbolRegistry symbols = new SymbolRegistry(List.of("BTCUSDT"));
            short btc = symbols.get("BTCUSDT");
            OrderManagementSystem oms = new OrderManagementSystem(symbols, new PositionManager(), new MetricsService());
            Queue<OrderSnapshot> updates = new ConcurrentLinkedQueue<>();
            oms.setListener(updates::add);

            oms.deposit("alice", "USDT", 1000 * E8);
            long orderId = oms.submitOrder("alice", "BTCUSDT", Side.BUY, 100 * E8, E8).orderId();

            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(2);
            AtomicReference<Throwable> failure = new AtomicReference<>();

            Thread canceller = new Thread(() -> {
                try {
                    start.await();
                    oms.cancelOrder("alice", orderId);
                } catch (AlreadyTerminalException e) {
                    // 已经全部成交
                } catch (Throwable t) {
                    failure.set(t);
                } finally {
                    done.countDown();
                }
            });
            Thread matcher = new Thread(() -> {
                try {
                    start.await();
                    oms.onTouch(btc, ask(99 * E8, E8 / 2));
                    oms.onTouch(btc, ask(99 * E8, E8));
                } catch (Throwable t) {
                    failure.set(t);
                } finally {
                    done.countDown();
                }
            });
            canceller.start();
            matcher.start();
            start.countDown();
            await(done);
            assertNull(failure.get(), () -> "round failed: " + failure.get());

            List<OrderStatus> seen = new ArrayList<>();
            for (OrderSnapshot update : updates) {
                if (update.orderId() == orderId) {
                    seen.add(update.status());
                }
            }
            assertFalse(seen.contains(OrderStatus.FILLED) && seen.contains(OrderStatus.CANCELLED),
                    "round " + round + " saw " + seen);

            OrderSnapshot last = oms.getOrder("alice", orderId);
            assertTrue(last.status().isTerminal(), "round " + round + " ended " + last.status());
            long filled = last.filledQuantityE8();
            if (last.status() == OrderStatus.FILLED) {
                assertEquals(E8, filled);
            } else {
                assertTrue(filled == 0 || filled == E8 / 2, "partial fill " + filled);
            }
            // 成交价为限价 100
            assertEquals(1000 * E8 - 100 * filled, oms.getBalance("alice", "USDT").totalE8());
            assertEquals(filled, oms.getBalance("alice", "BTC").totalE8());
            assertConsistent(oms, "alice");
        }
    }

    @Test
    @DisplayName("同一用户并发充值、下单，同时盘口撮合，订单号唯一且余额守恒")
    void testConcurrentDepositSubmitAndMatch() throws Exception {
        SymbolRegistry symbols = new SymbolRegistry(List.of("BTCUSDT"));
        short btc = symbols.get("BTCUSDT");
        OrderManagementSystem oms = new OrderManagementSystem(symbols, new PositionManager(), new MetricsService());
        oms.setListener(update -> {
        });

        int threads = 6;
        int perThread = 100;
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads + 1);
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Queue<Long> orderIds = new ConcurrentLinkedQueue<>();

        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        // 先充值再下单，每个线程自己的冻结额不会超过自己充进去的钱
                        oms.deposit("bob", "USDT", 10 * E8);
                        orderIds.add(oms.submitOrder("bob", "BTCUSDT", Side.BUY, 10 * E8, E8).orderId());
                    }
                } catch (Throwable e) {
                    failure.set(e);
                } finally {
                    done.countDown();
                }
            }).start();
        }
        new Thread(() -> {
            try {
                start.await();
                for (int i = 0; i < 200; i++) {
                    oms.onTouch(btc, ask(10 * E8, 3 * E8));
                }
            } catch (Throwable e) {
                failure.set(e);
            } finally {
                done.countDown();
            }
        }).start();

        start.countDown();
        await(done);
        assertNull(failure.get(), () -> "worker failed: " + failure.get());

        Set<Long> unique = new HashSet<>(orderIds);
        assertEquals(threads * perThread, unique.size());
        assertEquals(threads * perThread, oms.listOrders("bob").size());

        long filled = 0;
        for (OrderSnapshot order : oms.listOrders("bob")) {
            filled += order.filledQuantityE8();
        }
        long deposited = threads * perThread * 10 * E8;
        assertEquals(deposited - 10 * filled, oms.getBalance("bob", "USDT").totalE8());
        assertEquals(filled, oms.getBalance("bob", "BTC").totalE8());
        assertConsistent(oms, "bob");
    }
}
