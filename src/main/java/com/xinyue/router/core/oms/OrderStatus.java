package com.xinyue.router.core.oms;

public enum OrderStatus {
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED;
    }

    public String wire() {
        return name().toLowerCase();
    }
}
