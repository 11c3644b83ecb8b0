package com.xinyue.router.core.market;

public record EwmaUpdate(EwmaKey key, double value, long timestamp) {
}
