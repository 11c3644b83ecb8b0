package com.xinyue.router.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 价格和数量的精度缩放常量。
 * <p>
 * 系统中所有价格、数量和余额都使用 long 类型存储，通过固定缩放因子（1e8）来保证精度。
 */
public final class ScaleConstants {

    /** 价格和数量的精度缩放因子（1e8，即 100,000,000） */
    public static final long SCALE_E8 = 100_000_000L;

    private static final BigDecimal SCALE = BigDecimal.valueOf(SCALE_E8);

    private ScaleConstants() {
        // 工具类，禁止实例化
    }

    /**
     * 计算 price * qty（两者都放大 1e8），结果同样放大 1e8，向上取整。
     * 用于买单冻结/扣减报价资产，保证不会少扣。
     */
    public static long notionalCeilE8(long priceE8, long qtyE8) {
        return BigDecimal.valueOf(priceE8)
                .multiply(BigDecimal.valueOf(qtyE8))
                .divide(SCALE, 0, RoundingMode.CEILING)
                .longValueExact();
    }

    /**
     * 计算 price * qty，向下取整。用于卖单入账报价资产，保证不会多给。
     */
    public static long notionalFloorE8(long priceE8, long qtyE8) {
        return BigDecimal.valueOf(priceE8)
                .multiply(BigDecimal.valueOf(qtyE8))
                .divide(SCALE, 0, RoundingMode.FLOOR)
                .longValueExact();
    }

    /**
     * 将十进制字符串（例如 "50000.12"）转换为放大 1e8 的 long，超出 8 位小数的部分截断。
     *
     * @throws NumberFormatException 字符串不是合法数字
     */
    public static long parseE8(String decimal) {
        return new BigDecimal(decimal.trim())
                .movePointRight(8)
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
    }

    public static long toE8(double value) {
        return BigDecimal.valueOf(value)
                .movePointRight(8)
                .setScale(0, RoundingMode.DOWN)
                .longValueExact();
    }

    public static double toDouble(long valueE8) {
        return valueE8 / (double) SCALE_E8;
    }

    /**
     * 转成十进制 BigDecimal（去掉尾部多余的 0），用于对外 JSON 输出。
     */
    public static BigDecimal toDecimal(long valueE8) {
        BigDecimal value = BigDecimal.valueOf(valueE8, 8).stripTrailingZeros();
        // 100 -> 1E+2 的情况，保持普通写法
        return value.scale() < 0 ? value.setScale(0) : value;
    }
}
