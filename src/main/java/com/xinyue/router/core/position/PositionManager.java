package com.xinyue.router.core.position;

import com.xinyue.router.core.error.InsufficientBalanceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 每个用户维护一份多资产账本（可用 / 冻结）。
 * <p>
 * 本类不加锁：所有写操作和需要一致性的读操作，调用方必须先持有该用户在 {@link ShardedLocks} 中的锁。
 * 任何操作都不会让 available 或 locked 变成负数。
 */
public final class PositionManager {

    private final ConcurrentHashMap<String, AccountPortfolio> portfolios = new ConcurrentHashMap<>();

    public AccountPortfolio portfolio(String userId) {
        return portfolios.computeIfAbsent(userId, AccountPortfolio::new);
    }

    public void deposit(String userId, String asset, long amountE8) {
        Asset a = portfolio(userId).getAsset(asset);
        a.available += amountE8;
    }

    /**
     * available -> locked。余额不足时抛出异常，不做任何修改。
     */
    public void reserve(String userId, String asset, long amountE8) {
        Asset a = portfolio(userId).getAsset(asset);
        if (a.available < amountE8) {
            throw new InsufficientBalanceException(
                    "insufficient " + asset + ": available " + a.available + " < required " + amountE8);
        }
        a.available -= amountE8;
        a.locked += amountE8;
    }

    /**
     * locked -> available（撤单或成交后的剩余冻结）。
     */
    public void release(String userId, String asset, long amountE8) {
        Asset a = portfolio(userId).getAsset(asset);
        long amount = Math.min(amountE8, a.locked);
        a.locked -= amount;
        a.available += amount;
    }

    /**
     * 成交扣减冻结部分，total 随之减少。
     */
    public void debitLocked(String userId, String asset, long amountE8) {
        Asset a = portfolio(userId).getAsset(asset);
        if (a.locked < amountE8) {
            throw new IllegalStateException("locked " + asset + " of " + userId + " below debit " + amountE8);
        }
        a.locked -= amountE8;
    }

    public void credit(String userId, String asset, long amountE8) {
        Asset a = portfolio(userId).getAsset(asset);
        a.available += amountE8;
    }

    public Balance balance(String userId, String asset) {
        AccountPortfolio portfolio = portfolios.get(userId);
        Asset a = portfolio == null ? null : portfolio.peekAsset(asset);
        return a == null ? Balance.empty(asset) : new Balance(asset, a.total(), a.available);
    }

    /**
     * 用户的余额列表：固定资产列表（交易对涉及的资产）加上用户实际持有的其他资产。
     */
    public List<Balance> balances(String userId, Collection<String> knownAssets) {
        AccountPortfolio portfolio = portfolios.get(userId);
        TreeSet<String> names = new TreeSet<>(knownAssets);
        if (portfolio != null) {
            names.addAll(portfolio.assets().keySet());
        }
        List<Balance> result = new ArrayList<>(names.size());
        for (String name : names) {
            result.add(balance(userId, name));
        }
        return result;
    }

    /**
     * 恢复快照时直接写入余额。
     */
    public void restore(String userId, String asset, long totalE8, long availableE8) {
        Asset a = portfolio(userId).getAsset(asset);
        a.available = availableE8;
        a.locked = totalE8 - availableE8;
    }

    public Map<String, AccountPortfolio> portfolios() {
        return portfolios;
    }
}
