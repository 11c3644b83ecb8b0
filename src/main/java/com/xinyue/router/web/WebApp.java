package com.xinyue.router.web;

import org.noear.solon.Solon;

/**
 * Solon Web 服务器启动类。
 * AppContext 在容器初始化时组装行情管道、撮合引擎和客户端 WebSocket 服务。
 */
public class WebApp {

    public static void main(String[] args) {
        Solon.start(WebApp.class, args);
    }
}
