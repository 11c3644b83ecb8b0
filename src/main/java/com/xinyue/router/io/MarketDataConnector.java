package com.xinyue.router.io;

import com.xinyue.router.common.Exchange;

/**
 * 抽象出的行情连接器，统一管理多交易所接入。
 */
public interface MarketDataConnector {

    Exchange exchange();

    void start();

    void stop();

    /**
     * 握手完成且尚未断开。
     */
    boolean isConnected();
}
