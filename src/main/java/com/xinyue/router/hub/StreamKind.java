package com.xinyue.router.hub;

public enum StreamKind {
    BEST_TOUCH("best_touch"),
    TRADES("trades"),
    KLINES("klines"),
    EWMA("ewma");

    private final String wireName;

    StreamKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static StreamKind fromWire(String value) {
        for (StreamKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return kind;
            }
        }
        return null;
    }
}
