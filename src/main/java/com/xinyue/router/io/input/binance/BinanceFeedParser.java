package com.xinyue.router.io.input.binance;

import com.fasterxml.jackson.databind.JsonNode;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.io.input.FeedFields;
import com.xinyue.router.io.input.FeedParser;
import com.xinyue.router.io.input.MalformedMessageException;

/**
 * Binance 组合流（/stream?streams=...）消息解析。
 * <pre>
 * {"stream":"btcusdt@bookTicker","data":{"u":1,"s":"BTCUSDT","b":"50000.1","B":"1.2","a":"50000.2","A":"0.8"}}
 * {"stream":"btcusdt@trade","data":{"e":"trade","s":"BTCUSDT","p":"50000.1","q":"0.01","T":1700000000000}}
 * </pre>
 * bookTicker 不带时间戳，使用本地接收时间。
 */
public final class BinanceFeedParser implements FeedParser {

    private final SymbolRegistry symbolRegistry;

    public BinanceFeedParser(SymbolRegistry symbolRegistry) {
        this.symbolRegistry = symbolRegistry;
    }

    @Override
    public Exchange exchange() {
        return Exchange.BINANCE;
    }

    @Override
    public int parse(JsonNode root, long recvTime, TickSink sink) {
        if (!root.isObject()) {
            throw new MalformedMessageException("not an object");
        }
        // 订阅确认 {"result":null,"id":1}
        if (root.has("id") && root.has("result")) {
            return 0;
        }
        String stream = root.path("stream").asText("");
        JsonNode data = root.has("data") ? root.get("data") : root;
        if (!data.isObject()) {
            throw new MalformedMessageException("data is not an object");
        }

        if (stream.endsWith("@trade") || "trade".equals(data.path("e").asText())) {
            short symbolId = symbol(data);
            long price = FeedFields.positiveE8(data, "p");
            long qty = FeedFields.positiveE8(data, "q");
            long ts = FeedFields.epochMillis(data, "T");
            sink.onTrade(symbolId, price, qty, ts);
            return 1;
        }
        if (stream.endsWith("@bookTicker") || data.has("b") && data.has("a")) {
            short symbolId = symbol(data);
            long bid = FeedFields.decimalE8(data, "b");
            long bidQty = FeedFields.decimalE8(data, "B");
            long ask = FeedFields.decimalE8(data, "a");
            long askQty = FeedFields.decimalE8(data, "A");
            sink.onQuote(symbolId, bid, bidQty, ask, askQty, recvTime);
            return 1;
        }
        throw new MalformedMessageException("unknown stream " + stream);
    }

    private short symbol(JsonNode data) {
        String raw = data.path("s").asText("");
        short symbolId = symbolRegistry.get(raw.toUpperCase());
        if (symbolId <= 0) {
            throw new MalformedMessageException("unknown symbol " + raw);
        }
        return symbolId;
    }
}
