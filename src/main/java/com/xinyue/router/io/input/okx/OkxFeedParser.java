package com.xinyue.router.io.input.okx;

import com.fasterxml.jackson.databind.JsonNode;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.common.SymbolRegistry;
import com.xinyue.router.io.input.FeedFields;
import com.xinyue.router.io.input.FeedParser;
import com.xinyue.router.io.input.MalformedMessageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * OKX v5 公共频道消息解析。
 * <pre>
 * {"arg":{"channel":"tickers","instId":"BTC-USDT"},"data":[{"instId":"BTC-USDT","bidPx":"50000.1","bidSz":"1","askPx":"50000.2","askSz":"2","ts":"1700000000000"}]}
 * {"arg":{"channel":"trades","instId":"BTC-USDT"},"data":[{"instId":"BTC-USDT","px":"50000.1","sz":"0.01","ts":"1700000000000"}]}
 * </pre>
 * 一条消息可能带多条 data，整条消息全部校验通过后才发布，避免只发布一半。
 */
public final class OkxFeedParser implements FeedParser {

    private static final Logger LOG = LoggerFactory.getLogger(OkxFeedParser.class);

    private final SymbolRegistry symbolRegistry;

    public OkxFeedParser(SymbolRegistry symbolRegistry) {
        this.symbolRegistry = symbolRegistry;
    }

    /**
     * BTCUSDT -> BTC-USDT
     */
    public static String toInstId(SymbolRegistry.SymbolInfo info) {
        return info.base() + "-" + info.quote();
    }

    @Override
    public Exchange exchange() {
        return Exchange.OKX;
    }

    @Override
    public int parse(JsonNode root, long recvTime, TickSink sink) {
        if (!root.isObject()) {
            throw new MalformedMessageException("not an object");
        }
        if (root.has("event")) {
            String event = root.get("event").asText();
            if ("error".equals(event)) {
                LOG.warn("OKX 返回错误: code={} msg={}", root.path("code").asText(), root.path("msg").asText());
            }
            return 0;
        }
        String channel = root.path("arg").path("channel").asText("");
        JsonNode data = root.get("data");
        if (data == null || !data.isArray()) {
            throw new MalformedMessageException("missing data array");
        }

        switch (channel) {
            case "tickers" -> {
                List<long[]> quotes = new ArrayList<>(data.size());
                for (JsonNode item : data) {
                    quotes.add(new long[]{
                            symbol(item),
                            FeedFields.decimalE8(item, "bidPx"),
                            FeedFields.decimalE8(item, "bidSz"),
                            FeedFields.decimalE8(item, "askPx"),
                            FeedFields.decimalE8(item, "askSz"),
                            FeedFields.epochMillis(item, "ts")
                    });
                }
                for (long[] q : quotes) {
                    sink.onQuote((short) q[0], q[1], q[2], q[3], q[4], q[5]);
                }
                return quotes.size();
            }
            case "trades" -> {
                List<long[]> trades = new ArrayList<>(data.size());
                for (JsonNode item : data) {
                    trades.add(new long[]{
                            symbol(item),
                            FeedFields.positiveE8(item, "px"),
                            FeedFields.positiveE8(item, "sz"),
                            FeedFields.epochMillis(item, "ts")
                    });
                }
                for (long[] t : trades) {
                    sink.onTrade((short) t[0], t[1], t[2], t[3]);
                }
                return trades.size();
            }
            default -> throw new MalformedMessageException("unknown channel " + channel);
        }
    }

    private short symbol(JsonNode item) {
        String instId = FeedFields.text(item, "instId");
        short symbolId = symbolRegistry.get(instId.replace("-", "").toUpperCase());
        if (symbolId <= 0) {
            throw new MalformedMessageException("unknown instId " + instId);
        }
        return symbolId;
    }
}
