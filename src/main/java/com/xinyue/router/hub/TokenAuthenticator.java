package com.xinyue.router.hub;

/**
 * 校验 auth 消息携带的 token。
 */
@FunctionalInterface
public interface TokenAuthenticator {

    /**
     * @return token 对应的用户名
     * @throws com.xinyue.router.core.error.UnauthorizedException token 无效或过期
     */
    String authenticate(String token);
}
