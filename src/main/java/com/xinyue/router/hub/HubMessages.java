package com.xinyue.router.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.xinyue.router.common.ScaleConstants;
import com.xinyue.router.core.market.BestTouch;
import com.xinyue.router.core.market.EwmaUpdate;
import com.xinyue.router.core.market.KlineBucket;
import com.xinyue.router.core.market.TradePrint;
import com.xinyue.router.core.oms.OrderSnapshot;

/**
 * 出站 JSON 渲染。每个事件只序列化一次，所有订阅者共享同一个字符串。
 */
final class HubMessages {

    private final ObjectMapper mapper;

    HubMessages(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    String bestTouch(BestTouch t) {
        ObjectNode root = envelope("best_touch");
        ObjectNode data = root.putObject("data");
        data.put("symbol", t.symbol());
        data.put("exchange", t.scope());
        putDecimalOrNull(data, "best_bid", t.bidE8(), t.hasBid());
        putDecimalOrNull(data, "best_bid_size", t.bidQtyE8(), t.hasBid());
        putDecimalOrNull(data, "best_ask", t.askE8(), t.hasAsk());
        putDecimalOrNull(data, "best_ask_size", t.askQtyE8(), t.hasAsk());
        data.put("best_bid_exchange", t.bidExchange());
        data.put("best_ask_exchange", t.askExchange());
        data.put("timestamp", t.updatedAt());
        data.put("stale", t.stale());
        return write(root);
    }

    String trade(TradePrint t) {
        ObjectNode root = envelope("trades");
        ObjectNode data = root.putObject("data");
        data.put("symbol", t.symbol());
        data.put("scope", t.scope());
        data.put("exchange", t.exchange());
        data.put("price", ScaleConstants.toDecimal(t.priceE8()));
        data.put("quantity", ScaleConstants.toDecimal(t.qtyE8()));
        data.put("timestamp", t.timestamp());
        return write(root);
    }

    String kline(KlineBucket k) {
        ObjectNode root = envelope("klines");
        ObjectNode data = root.putObject("data");
        data.put("symbol", k.symbol());
        data.put("exchange", k.scope());
        data.put("interval", k.interval().label());
        data.put("start", k.bucketStart());
        data.put("end", k.bucketEnd());
        data.put("open", ScaleConstants.toDecimal(k.openE8()));
        data.put("high", ScaleConstants.toDecimal(k.highE8()));
        data.put("low", ScaleConstants.toDecimal(k.lowE8()));
        data.put("close", ScaleConstants.toDecimal(k.closeE8()));
        data.put("volume", ScaleConstants.toDecimal(k.volumeE8()));
        data.put("closed", k.closed());
        return write(root);
    }

    String ewma(EwmaUpdate u) {
        ObjectNode root = envelope("ewma");
        ObjectNode data = root.putObject("data");
        data.put("symbol", u.key().symbol());
        data.put("exchange", u.key().scope());
        data.put("half_life", u.key().halfLifeSeconds());
        data.put("value", u.value());
        data.put("timestamp", u.timestamp());
        return write(root);
    }

    String order(OrderSnapshot o) {
        ObjectNode root = envelope("order");
        ObjectNode data = root.putObject("data");
        data.put("order_id", o.orderId());
        data.put("client_order_id", o.clientOrderId());
        data.put("symbol", o.symbol());
        data.put("side", o.side().wire());
        data.put("price", ScaleConstants.toDecimal(o.priceE8()));
        data.put("quantity", ScaleConstants.toDecimal(o.quantityE8()));
        data.put("filled_quantity", ScaleConstants.toDecimal(o.filledQuantityE8()));
        data.put("status", o.status().wire());
        data.put("created_at", o.createdAt());
        data.put("updated_at", o.updatedAt());
        return write(root);
    }

    String authOk(String userId) {
        ObjectNode root = envelope("auth");
        root.put("status", "ok");
        root.put("user", userId);
        return write(root);
    }

    String subscription(String type, StreamSpec spec) {
        ObjectNode root = envelope(type);
        root.put("stream", spec.kind().wireName());
        root.put("symbol", spec.symbol());
        root.put("exchange", spec.scope());
        if (spec.interval() != null) {
            root.put("interval", spec.interval().label());
        }
        if (spec.kind() == StreamKind.EWMA) {
            root.put("half_life", spec.halfLifeSeconds());
        }
        return write(root);
    }

    String unsubscribed(String stream, String symbol, int removed) {
        ObjectNode root = envelope("unsubscribed");
        root.put("stream", stream);
        root.put("symbol", symbol);
        root.put("removed", removed);
        return write(root);
    }

    String pong() {
        return write(envelope("pong"));
    }

    String error(String code, String message) {
        ObjectNode root = envelope("error");
        root.put("code", code);
        root.put("message", message);
        return write(root);
    }

    private ObjectNode envelope(String type) {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", type);
        return root;
    }

    private static void putDecimalOrNull(ObjectNode node, String field, long valueE8, boolean present) {
        if (present) {
            node.put(field, ScaleConstants.toDecimal(valueE8));
        } else {
            node.putNull(field);
        }
    }

    private String write(ObjectNode root) {
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("序列化出站消息失败", e);
        }
    }
}
