package com.xinyue.router.web.controller;

import com.xinyue.router.common.ScaleConstants;
import com.xinyue.router.core.error.TradingException;
import com.xinyue.router.core.oms.OrderSnapshot;
import com.xinyue.router.core.position.Balance;
import org.noear.solon.core.handle.Context;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一的响应体：{code, message, success, data}，HTTP 状态码与 code 一致。
 */
final class ApiResponses {

    private ApiResponses() {
    }

    static Map<String, Object> ok(String message, Object data) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", 200);
        result.put("message", message);
        result.put("success", true);
        if (data != null) {
            result.put("data", data);
        }
        return result;
    }

    static Map<String, Object> fail(Context ctx, int code, String message) {
        if (ctx != null) {
            ctx.status(code);
        }
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("code", code);
        result.put("message", message);
        result.put("success", false);
        return result;
    }

    static Map<String, Object> fail(Context ctx, TradingException e) {
        Map<String, Object> result = fail(ctx, e.code().httpStatus(), e.getMessage());
        result.put("error", e.code().name());
        return result;
    }

    static Map<String, Object> order(OrderSnapshot o) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("orderId", o.orderId());
        data.put("clientOrderId", o.clientOrderId());
        data.put("symbol", o.symbol());
        data.put("side", o.side().wire());
        data.put("price", ScaleConstants.toDecimal(o.priceE8()));
        data.put("quantity", ScaleConstants.toDecimal(o.quantityE8()));
        data.put("filledQuantity", ScaleConstants.toDecimal(o.filledQuantityE8()));
        data.put("status", o.status().wire());
        data.put("createdAt", o.createdAt());
        data.put("updatedAt", o.updatedAt());
        return data;
    }

    static Map<String, Object> balance(Balance b) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("asset", b.asset());
        data.put("total", ScaleConstants.toDecimal(b.totalE8()));
        data.put("available", ScaleConstants.toDecimal(b.availableE8()));
        return data;
    }

    static String parseString(Object value, String defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        return value.toString().trim();
    }

    /**
     * 数值或数值字符串 -> 放大 1e8 的 long。
     *
     * @throws NumberFormatException 不是合法数字
     */
    static long parseE8(Object value) {
        if (value == null) {
            throw new NumberFormatException("missing number");
        }
        return ScaleConstants.parseE8(value.toString());
    }
}
