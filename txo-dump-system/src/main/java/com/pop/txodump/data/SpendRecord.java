package com.pop.txodump.data;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One consumed output: where it was spent, how old it was, the fee rate of the spending transaction and its value.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class SpendRecord {

    public static final char DELIMITER = ';';

    /**
     * 花费所在区块高度
     */
    private final long height;

    /**
     * 币龄：花费高度 - 产生高度
     */
    private final long coinAge;

    /**
     * 花费交易的每字节手续费
     */
    private final long feeRate;

    /**
     * 被花费输出的金额
     */
    private final long value;

    /**
     * @return {@code height;coin_age;fee_rate;value} without line terminator
     */
    public String toCsvLine() {
        return Long.toUnsignedString(height) + DELIMITER
                + Long.toUnsignedString(coinAge) + DELIMITER
                + Long.toUnsignedString(feeRate) + DELIMITER
                + Long.toUnsignedString(value);
    }
}
