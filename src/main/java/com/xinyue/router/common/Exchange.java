package com.xinyue.router.common;

/**
 * 支持的行情来源交易所。
 */
public enum Exchange {
    BINANCE((short) 1, "binance"),
    OKX((short) 2, "okx");

    /** 订阅时使用的跨交易所聚合范围名称。 */
    public static final String ALL_SCOPE = "all";

    private final short id;
    private final String wireName;

    Exchange(short id, String wireName) {
        this.id = id;
        this.wireName = wireName;
    }

    public short id() {
        return id;
    }

    /**
     * 对外协议中使用的小写名称（例如 "binance"）。
     */
    public String wireName() {
        return wireName;
    }

    public static Exchange fromId(short id) {
        for (Exchange exchange : values()) {
            if (exchange.id == id) {
                return exchange;
            }
        }
        throw new IllegalArgumentException("未知交易所 id=" + id);
    }

    /**
     * 按协议名称查找交易所，大小写不敏感；不存在时返回 null。
     */
    public static Exchange fromWireName(String name) {
        if (name == null) {
            return null;
        }
        for (Exchange exchange : values()) {
            if (exchange.wireName.equalsIgnoreCase(name)) {
                return exchange;
            }
        }
        return null;
    }
}
