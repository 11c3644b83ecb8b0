package com.xinyue.router.web.controller;

import com.xinyue.router.web.context.AppContext;
import org.noear.solon.annotation.Body;
import org.noear.solon.annotation.Controller;
import org.noear.solon.annotation.Get;
import org.noear.solon.annotation.Inject;
import org.noear.solon.annotation.Mapping;
import org.noear.solon.annotation.Post;
import org.noear.solon.core.handle.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * 认证控制器。
 * 提供注册、登录以及可交易资产列表。
 */
@Controller
public class AuthController {

    private static final Logger LOG = LoggerFactory.getLogger(AuthController.class);

    @Inject
    private AppContext appContext;

    public AuthController() {
    }

    AuthController(AppContext appContext) {
        this.appContext = appContext;
    }

    /**
     * 注册接口，成功后直接返回 token。
     * POST /register
     * <p>
     * 请求体示例：
     * {
     *   "username": "trader1",
     *   "password": "secret1"
     * }
     */
    @Post
    @Mapping("/register")
    public Map<String, Object> register(Context ctx, @Body Map<String, Object> params) {
        try {
            String username = ApiResponses.parseString(params == null ? null : params.get("username"), "");
            String password = ApiResponses.parseString(params == null ? null : params.get("password"), "");
            appContext.getUserService().register(username, password);
            appContext.persist();
            LOG.info("新用户注册: {}", username);
            return ApiResponses.ok("注册成功", tokenData(username));
        } catch (IllegalArgumentException e) {
            return ApiResponses.fail(ctx, 400, e.getMessage());
        } catch (Exception e) {
            LOG.error("注册失败", e);
            return ApiResponses.fail(ctx, 500, "注册失败: " + e.getMessage());
        }
    }

    /**
     * 登录接口。
     * POST /login
     */
    @Post
    @Mapping("/login")
    public Map<String, Object> login(Context ctx, @Body Map<String, Object> params) {
        try {
            String username = ApiResponses.parseString(params == null ? null : params.get("username"), "");
            String password = ApiResponses.parseString(params == null ? null : params.get("password"), "");
            if (username.isEmpty() || password.isEmpty()) {
                return ApiResponses.fail(ctx, 400, "用户名和密码不能为空");
            }
            if (!appContext.getUserService().authenticate(username, password)) {
                return ApiResponses.fail(ctx, 401, "用户名或密码错误");
            }
            LOG.info("用户登录成功: {}", username);
            return ApiResponses.ok("登录成功", tokenData(username));
        } catch (Exception e) {
            LOG.error("登录失败", e);
            return ApiResponses.fail(ctx, 500, "登录失败: " + e.getMessage());
        }
    }

    /**
     * 可交易的资产和交易对。
     * GET /info
     */
    @Get
    @Mapping("/info")
    public Map<String, Object> info() {
        Map<String, Object> data = new HashMap<>();
        data.put("assets", appContext.getSymbolRegistry().assets());
        data.put("pairs", appContext.getSettings().symbols());
        return ApiResponses.ok("ok", data);
    }

    private Map<String, Object> tokenData(String username) {
        Map<String, Object> data = new HashMap<>();
        data.put("token", appContext.getTokenService().issue(username));
        data.put("tokenType", "bearer");
        data.put("username", username);
        data.put("expiresIn", appContext.getTokenService().ttlSeconds());
        return data;
    }
}
