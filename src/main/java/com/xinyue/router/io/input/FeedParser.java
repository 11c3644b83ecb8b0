package com.xinyue.router.io.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.xinyue.router.common.Exchange;

/**
 * 单个交易所的消息格式解析器：把交易所私有 JSON 转成统一的报价 / 成交回调。
 * <p>
 * 格式不对的消息抛出 {@link MalformedMessageException}，由 {@link com.xinyue.router.io.Normalizer} 统一计数丢弃。
 */
public interface FeedParser {

    Exchange exchange();

    /**
     * @param root      已解析的 JSON
     * @param recvTime  本地接收时间，交易所没有给时间戳时使用
     * @return 产出的 tick 数量，订阅确认等控制消息返回 0
     */
    int parse(JsonNode root, long recvTime, TickSink sink);

    interface TickSink {
        void onQuote(short symbolId, long bidE8, long bidQtyE8, long askE8, long askQtyE8, long timestamp);

        void onTrade(short symbolId, long priceE8, long qtyE8, long timestamp);
    }
}
