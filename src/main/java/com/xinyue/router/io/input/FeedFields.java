package com.xinyue.router.io.input;

import com.fasterxml.jackson.databind.JsonNode;
import com.xinyue.router.common.ScaleConstants;

/**
 * 解析器共用的字段读取工具。交易所的价格和数量都以字符串下发。
 */
public final class FeedFields {

    private FeedFields() {
    }

    public static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw new MalformedMessageException("missing field " + field);
        }
        String text = value.asText();
        if (text.isEmpty()) {
            throw new MalformedMessageException("empty field " + field);
        }
        return text;
    }

    public static long decimalE8(JsonNode node, String field) {
        String text = text(node, field);
        long value;
        try {
            value = ScaleConstants.parseE8(text);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new MalformedMessageException("bad decimal " + field + "=" + text);
        }
        if (value < 0) {
            throw new MalformedMessageException("negative " + field + "=" + text);
        }
        return value;
    }

    public static long positiveE8(JsonNode node, String field) {
        long value = decimalE8(node, field);
        if (value == 0) {
            throw new MalformedMessageException("zero " + field);
        }
        return value;
    }

    public static long epochMillis(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedMessageException("missing field " + field);
        }
        if (value.canConvertToLong()) {
            return value.asLong();
        }
        try {
            return Long.parseLong(value.asText());
        } catch (NumberFormatException e) {
            throw new MalformedMessageException("bad timestamp " + field + "=" + value.asText());
        }
    }
}
