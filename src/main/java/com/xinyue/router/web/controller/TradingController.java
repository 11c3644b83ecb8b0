package com.xinyue.router.web.controller;

import com.xinyue.router.common.Side;
import com.xinyue.router.core.error.TradingException;
import com.xinyue.router.core.oms.OrderManagementSystem;
import com.xinyue.router.core.oms.OrderSnapshot;
import com.xinyue.router.core.position.Balance;
import com.xinyue.router.web.context.AppContext;
import org.noear.solon.annotation.Body;
import org.noear.solon.annotation.Controller;
import org.noear.solon.annotation.Delete;
import org.noear.solon.annotation.Get;
import org.noear.solon.annotation.Header;
import org.noear.solon.annotation.Inject;
import org.noear.solon.annotation.Mapping;
import org.noear.solon.annotation.Param;
import org.noear.solon.annotation.Path;
import org.noear.solon.annotation.Post;
import org.noear.solon.core.handle.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 模拟交易控制器：充值、下单、撤单、查单、查余额。
 * 所有接口都需要请求头 Authorization: Bearer {token}。
 */
@Controller
public class TradingController {

    private static final Logger LOG = LoggerFactory.getLogger(TradingController.class);

    @Inject
    private AppContext appContext;

    public TradingController() {
    }

    TradingController(AppContext appContext) {
        this.appContext = appContext;
    }

    /**
     * 充值。
     * POST /deposit
     * <p>
     * 请求体示例：{"asset": "USDT", "amount": "1000"}
     */
    @Post
    @Mapping("/deposit")
    public Map<String, Object> deposit(Context ctx,
                                       @Header("Authorization") String authorization,
                                       @Body Map<String, Object> params) {
        try {
            String username = appContext.getTokenService().verifyBearer(authorization);
            String asset = ApiResponses.parseString(params == null ? null : params.get("asset"), "").toUpperCase();
            long amountE8 = ApiResponses.parseE8(params == null ? null : params.get("amount"));
            appContext.getOms().deposit(username, asset, amountE8);
            return ApiResponses.ok("充值成功", ApiResponses.balance(appContext.getOms().getBalance(username, asset)));
        } catch (TradingException e) {
            return ApiResponses.fail(ctx, e);
        } catch (NumberFormatException | ArithmeticException e) {
            return ApiResponses.fail(ctx, 400, "amount 不是合法数字");
        } catch (Exception e) {
            LOG.error("充值失败", e);
            return ApiResponses.fail(ctx, 500, "充值失败: " + e.getMessage());
        }
    }

    /**
     * 下限价单。
     * POST /orders
     * <p>
     * 请求体示例：
     * {
     *   "symbol": "BTCUSDT",
     *   "side": "buy",
     *   "price": "50000",
     *   "quantity": "0.01",
     *   "client_order_id": "my-order-1"
     * }
     * client_order_id 也可以写成 token_id。
     */
    @Post
    @Mapping("/orders")
    public Map<String, Object> submitOrder(Context ctx,
                                           @Header("Authorization") String authorization,
                                           @Body Map<String, Object> params) {
        try {
            String username = appContext.getTokenService().verifyBearer(authorization);
            if (params == null) {
                return ApiResponses.fail(ctx, 400, "请求体不能为空");
            }
            String symbol = ApiResponses.parseString(params.get("symbol"), "");
            Side side = Side.fromWire(ApiResponses.parseString(params.get("side"), ""));
            long priceE8 = ApiResponses.parseE8(params.get("price"));
            long qtyE8 = ApiResponses.parseE8(params.get("quantity"));
            Object clientId = params.containsKey("client_order_id") ? params.get("client_order_id") : params.get("token_id");

            OrderSnapshot order = appContext.getOms().submitOrder(username, symbol, side, priceE8, qtyE8,
                    ApiResponses.parseString(clientId, null));
            return ApiResponses.ok("下单成功", ApiResponses.order(order));
        } catch (TradingException e) {
            return ApiResponses.fail(ctx, e);
        } catch (NumberFormatException | ArithmeticException e) {
            return ApiResponses.fail(ctx, 400, "price 和 quantity 必须是合法数字");
        } catch (Exception e) {
            LOG.error("下单失败", e);
            return ApiResponses.fail(ctx, 500, "下单失败: " + e.getMessage());
        }
    }

    /**
     * 当前用户的全部订单，open=true 时只返回活动订单。
     * GET /orders
     */
    @Get
    @Mapping("/orders")
    public Map<String, Object> listOrders(Context ctx,
                                          @Header("Authorization") String authorization,
                                          @Param("open") String open) {
        try {
            String username = appContext.getTokenService().verifyBearer(authorization);
            OrderManagementSystem oms = appContext.getOms();
            List<OrderSnapshot> orders = "true".equalsIgnoreCase(open) ? oms.openOrders(username) : oms.listOrders(username);
            List<Map<String, Object>> data = new ArrayList<>(orders.size());
            for (OrderSnapshot order : orders) {
                data.add(ApiResponses.order(order));
            }
            return ApiResponses.ok("ok", data);
        } catch (TradingException e) {
            return ApiResponses.fail(ctx, e);
        } catch (Exception e) {
            LOG.error("查询订单列表失败", e);
            return ApiResponses.fail(ctx, 500, "查询订单列表失败: " + e.getMessage());
        }
    }

    /**
     * 查单。纯数字按订单号查，否则按 client_order_id 查。
     * GET /orders/{id}
     */
    @Get
    @Mapping("/orders/{id}")
    public Map<String, Object> getOrder(Context ctx,
                                        @Header("Authorization") String authorization,
                                        @Path("id") String id) {
        try {
            String username = appContext.getTokenService().verifyBearer(authorization);
            OrderManagementSystem oms = appContext.getOms();
            Long orderId = parseOrderId(id);
            OrderSnapshot order = orderId != null ? oms.getOrder(username, orderId) : oms.getOrderByClientId(username, id);
            return ApiResponses.ok("ok", ApiResponses.order(order));
        } catch (TradingException e) {
            return ApiResponses.fail(ctx, e);
        } catch (Exception e) {
            LOG.error("查询订单失败: {}", id, e);
            return ApiResponses.fail(ctx, 500, "查询订单失败: " + e.getMessage());
        }
    }

    /**
     * 撤单。
     * DELETE /orders/{id}
     */
    @Delete
    @Mapping("/orders/{id}")
    public Map<String, Object> cancelOrder(Context ctx,
                                           @Header("Authorization") String authorization,
                                           @Path("id") String id) {
        try {
            String username = appContext.getTokenService().verifyBearer(authorization);
            OrderManagementSystem oms = appContext.getOms();
            Long orderId = parseOrderId(id);
            OrderSnapshot order = orderId != null
                    ? oms.cancelOrder(username, orderId)
                    : oms.cancelOrderByClientId(username, id);
            LOG.info("用户 {} 撤单: {}", username, order.orderId());
            return ApiResponses.ok("撤单成功", ApiResponses.order(order));
        } catch (TradingException e) {
            return ApiResponses.fail(ctx, e);
        } catch (Exception e) {
            LOG.error("撤单失败: {}", id, e);
            return ApiResponses.fail(ctx, 500, "撤单失败: " + e.getMessage());
        }
    }

    /**
     * 所有可交易资产的余额（没有记录的资产返回 0）。
     * GET /balance
     */
    @Get
    @Mapping("/balance")
    public Map<String, Object> balance(Context ctx, @Header("Authorization") String authorization) {
        try {
            String username = appContext.getTokenService().verifyBearer(authorization);
            List<Map<String, Object>> balances = new ArrayList<>();
            for (Balance b : appContext.getOms().balances(username)) {
                balances.add(ApiResponses.balance(b));
            }
            Map<String, Object> data = new HashMap<>();
            data.put("username", username);
            data.put("balances", balances);
            return ApiResponses.ok("ok", data);
        } catch (TradingException e) {
            return ApiResponses.fail(ctx, e);
        } catch (Exception e) {
            LOG.error("查询余额失败", e);
            return ApiResponses.fail(ctx, 500, "查询余额失败: " + e.getMessage());
        }
    }

    private static Long parseOrderId(String id) {
        if (id == null || id.isEmpty()) {
            return null;
        }
        for (int i = 0; i < id.length(); i++) {
            if (!Character.isDigit(id.charAt(i))) {
                return null;
            }
        }
        try {
            return Long.parseLong(id);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
