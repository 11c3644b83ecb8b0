package com.xinyue.router.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lmax.disruptor.RingBuffer;
import com.xinyue.router.common.CoreEvent;
import com.xinyue.router.common.CoreEventType;
import com.xinyue.router.common.Exchange;
import com.xinyue.router.infra.MetricsService;
import com.xinyue.router.io.input.FeedParser;
import com.xinyue.router.io.input.MalformedMessageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;

/**
 * 将交易所原始 JSON 转换成统一的 CoreEvent 并发布到 RingBuffer。
 * <p>
 * 每个交易所的消息只在该连接器的 EventLoop 线程上进入本类，因此同一交易所的 tick 按接收顺序发布。
 * 格式错误的消息计数后丢弃，不会抛到网络层。
 */
public final class Normalizer {

    private static final Logger LOG = LoggerFactory.getLogger(Normalizer.class);

    private final RingBuffer<CoreEvent> ringBuffer;
    private final MetricsService metricsService;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<Exchange, FeedParser> parsers = new EnumMap<>(Exchange.class);
    private final Map<Exchange, FeedParser.TickSink> sinks = new EnumMap<>(Exchange.class);

    public Normalizer(RingBuffer<CoreEvent> ringBuffer, MetricsService metricsService) {
        this.ringBuffer = ringBuffer;
        this.metricsService = metricsService;
    }

    public Normalizer register(FeedParser parser) {
        parsers.put(parser.exchange(), parser);
        sinks.put(parser.exchange(), new RingBufferSink(parser.exchange()));
        return this;
    }

    /**
     * @return 发布的 tick 数量，消息被丢弃时返回 0
     */
    public int onJsonMessage(Exchange exchange, String payload, long recvTime) {
        FeedParser parser = parsers.get(exchange);
        if (parser == null) {
            LOG.warn("没有注册 {} 的解析器，丢弃消息", exchange);
            return 0;
        }
        try {
            JsonNode root = objectMapper.readTree(payload);
            return parser.parse(root, recvTime, sinks.get(exchange));
        } catch (JsonProcessingException | MalformedMessageException e) {
            metricsService.recordMalformed(exchange);
            LOG.debug("丢弃 {} 格式错误的消息: {} ({})", exchange.wireName(), abbreviate(payload), e.getMessage());
            return 0;
        }
    }

    /**
     * 连接断开：通知下游该交易所的报价已经不可信。
     */
    public void onDisconnect(Exchange exchange) {
        long seq = ringBuffer.next();
        try {
            CoreEvent event = ringBuffer.get(seq);
            event.reset();
            event.type = CoreEventType.FEED_STALE;
            event.exchangeId = exchange.id();
            event.timestamp = System.currentTimeMillis();
            event.recvTime = event.timestamp;
        } finally {
            ringBuffer.publish(seq);
        }
    }

    private static String abbreviate(String payload) {
        return payload.length() <= 256 ? payload : payload.substring(0, 256) + "...";
    }

    private final class RingBufferSink implements FeedParser.TickSink {
        private final Exchange exchange;

        RingBufferSink(Exchange exchange) {
            this.exchange = exchange;
        }

        @Override
        public void onQuote(short symbolId, long bidE8, long bidQtyE8, long askE8, long askQtyE8, long timestamp) {
            long seq = ringBuffer.next();
            try {
                CoreEvent event = ringBuffer.get(seq);
                event.reset();
                event.type = CoreEventType.QUOTE_TICK;
                event.exchangeId = exchange.id();
                event.symbolId = symbolId;
                event.timestamp = timestamp;
                event.recvTime = System.currentTimeMillis();
                event.setQuote(bidE8, bidQtyE8, askE8, askQtyE8);
            } finally {
                ringBuffer.publish(seq);
            }
            metricsService.recordTick();
        }

        @Override
        public void onTrade(short symbolId, long priceE8, long qtyE8, long timestamp) {
            long seq = ringBuffer.next();
            try {
                CoreEvent event = ringBuffer.get(seq);
                event.reset();
                event.type = CoreEventType.TRADE_TICK;
                event.exchangeId = exchange.id();
                event.symbolId = symbolId;
                event.timestamp = timestamp;
                event.recvTime = System.currentTimeMillis();
                event.setTrade(priceE8, qtyE8);
            } finally {
                ringBuffer.publish(seq);
            }
            metricsService.recordTick();
        }
    }
}
