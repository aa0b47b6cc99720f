package com.pop.txodump.service;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Totals of a completed dump.
 */
@Getter
@AllArgsConstructor
@ToString
public class DumpSummary {

    private final long startHeight;
    private final long finalHeight;
    private final long blockCount;
    private final long txCount;
    private final long inCount;
    private final long outCount;
    private final long spendCount;
    private final long remainingUtxoCount;
}
