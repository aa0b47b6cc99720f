package com.pop.txodump.storage;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value and creation height of an unspent output.
 */
@Getter
@AllArgsConstructor
@EqualsAndHashCode
@ToString
public class UTXOEntry {

    /**
     * 金额，无符号64位
     */
    private final long value;

    /**
     * 产生该输出的区块高度
     */
    private final long height;
}
