package com.xinyue.router.core.store;

import com.xinyue.router.core.oms.OrderSnapshot;

import java.util.List;
import java.util.Map;

/**
 * 持久化的完整状态：用户凭证 + 账本（余额、订单、下一个订单 ID）。
 */
public record StateSnapshot(int version, long savedAt, List<UserRecord> users, Ledger ledger) {

    public static final int CURRENT_VERSION = 1;

    public static StateSnapshot empty() {
        return new StateSnapshot(CURRENT_VERSION, 0, List.of(), new Ledger(Map.of(), List.of(), 1));
    }

    public record UserRecord(String username, String passwordHash, long createdAt) {
    }

    public record BalanceEntry(long totalE8, long availableE8) {
    }

    public record Ledger(Map<String, Map<String, BalanceEntry>> balances,
                         List<OrderSnapshot> orders,
                         long nextOrderId) {
    }
}
