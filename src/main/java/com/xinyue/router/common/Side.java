package com.xinyue.router.common;

public enum Side {
    BUY,
    SELL;

    public static Side fromWire(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase()) {
            case "buy" -> BUY;
            case "sell" -> SELL;
            default -> null;
        };
    }

    public String wire() {
        return name().toLowerCase();
    }
}
