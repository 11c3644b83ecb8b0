package com.xinyue.router.io.input;

import com.xinyue.router.common.Exchange;
import com.xinyue.router.io.MarketDataConnector;

import java.util.ArrayList;
import java.util.List;

/**
 * 接入层协调器，负责统一启动/终止所有行情连接器。
 * 单个连接器的断线重连由连接器自己处理，不影响其他交易所。
 */
public final class AccessLayerCoordinator {

    private final List<MarketDataConnector> connectors = new ArrayList<>();

    public AccessLayerCoordinator register(MarketDataConnector connector) {
        connectors.add(connector);
        return this;
    }

    public void startAll() {
        connectors.forEach(MarketDataConnector::start);
    }

    public void stopAll() {
        connectors.forEach(MarketDataConnector::stop);
    }

    /**
     * 根据交易所获取连接器。
     */
    public MarketDataConnector getConnector(Exchange exchange) {
        for (MarketDataConnector connector : connectors) {
            if (connector.exchange() == exchange) {
                return connector;
            }
        }
        return null;
    }

    public List<MarketDataConnector> connectors() {
        return connectors;
    }
}
