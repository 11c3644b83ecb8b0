package com.xinyue.router.common;

import org.agrona.collections.Object2IntHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * 交易对字符串到 symbolId 的映射注册表，同时记录每个交易对的基础资产 / 报价资产。
 * 使用 Agrona 的 Object2IntHashMap 实现零GC映射。
 * <p>
 * 注册表在启动时由配置构建，之后只读，可以在多个线程间共享。
 */
public final class SymbolRegistry {

    /** 按后缀拆分交易对时识别的报价资产，长的放前面（USDT 优先于 USD）。 */
    private static final String[] QUOTE_SUFFIXES = {"USDT", "USDC", "USD", "BTC", "ETH"};

    private final Object2IntHashMap<String> symbolToIdMap = new Object2IntHashMap<>(-1);
    private final List<SymbolInfo> idToSymbol = new ArrayList<>();

    public SymbolRegistry(List<String> symbols) {
        // id 从 1 开始，0 保留给「无交易对」的控制事件
        idToSymbol.add(null);
        for (String symbol : symbols) {
            register(symbol.trim().toUpperCase());
        }
    }

    private void register(String symbol) {
        if (symbol.isEmpty() || symbolToIdMap.containsKey(symbol)) {
            return;
        }
        String[] parts = split(symbol);
        short id = (short) idToSymbol.size();
        symbolToIdMap.put(symbol, id);
        idToSymbol.add(new SymbolInfo(id, symbol, parts[0], parts[1]));
    }

    /**
     * 获取 symbol 对应的 symbolId，不存在返回 -1。
     */
    public short get(String symbol) {
        if (symbol == null) {
            return -1;
        }
        return (short) symbolToIdMap.getValue(symbol.toUpperCase());
    }

    public SymbolInfo info(short symbolId) {
        if (symbolId <= 0 || symbolId >= idToSymbol.size()) {
            return null;
        }
        return idToSymbol.get(symbolId);
    }

    public SymbolInfo info(String symbol) {
        short id = get(symbol);
        return id < 0 ? null : idToSymbol.get(id);
    }

    public String getSymbol(short symbolId) {
        SymbolInfo info = info(symbolId);
        return info == null ? null : info.symbol();
    }

    public List<SymbolInfo> all() {
        return Collections.unmodifiableList(idToSymbol.subList(1, idToSymbol.size()));
    }

    /**
     * 所有已注册交易对涉及的资产（基础 + 报价），按字母序。
     */
    public List<String> assets() {
        TreeSet<String> assets = new TreeSet<>();
        for (SymbolInfo info : all()) {
            assets.add(info.base());
            assets.add(info.quote());
        }
        return new ArrayList<>(assets);
    }

    /**
     * 把内部交易对拆成 [base, quote]，例如 BTCUSDT -> [BTC, USDT]。
     */
    static String[] split(String symbol) {
        for (String quote : QUOTE_SUFFIXES) {
            if (symbol.length() > quote.length() && symbol.endsWith(quote)) {
                return new String[]{symbol.substring(0, symbol.length() - quote.length()), quote};
            }
        }
        if (symbol.length() <= 3) {
            throw new IllegalArgumentException("无法识别的交易对: " + symbol);
        }
        return new String[]{symbol.substring(0, symbol.length() - 3), symbol.substring(symbol.length() - 3)};
    }

    /**
     * 单个交易对的元数据。
     */
    public record SymbolInfo(short id, String symbol, String base, String quote) {
    }
}
