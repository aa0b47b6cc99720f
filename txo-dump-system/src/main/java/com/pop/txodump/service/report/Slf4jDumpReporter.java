package com.pop.txodump.service.report;

import com.pop.txodump.api.callback.CoinType;
import com.pop.txodump.service.DumpSummary;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;

/**
 * Reports through SLF4J.
 */
@Slf4j
public class Slf4jDumpReporter implements DumpReporter {

    @Override
    public void started(Path dumpFolder, CoinType coinType, long startHeight) {
        log.info("Using `TXODump` with dump folder: {} and start block {} ({})...", dumpFolder, startHeight, coinType.getDisplayName());
    }

    @Override
    public void utxosLoaded(long count) {
        log.info("Loaded {} UTXOs.", count);
    }

    @Override
    public void noUtxosLoaded(Exception cause) {
        log.info("No previous UTXO loaded: {}", cause.getMessage());
    }

    @Override
    public void blockProcessed(long height, int txCount) {
        log.debug("Block: {} ({} transactions).", height, txCount);
    }

    @Override
    public void completed(DumpSummary summary) {
        log.info(String.format("Done.%nDumped all %d blocks (%d..%d):%n"
                        + "\t-> transactions: %9d%n"
                        + "\t-> inputs:       %9d%n"
                        + "\t-> outputs:      %9d%n"
                        + "\t-> spends:       %9d%n"
                        + "\t-> unspent:      %9d",
                summary.getBlockCount(), summary.getStartHeight(), summary.getFinalHeight(),
                summary.getTxCount(), summary.getInCount(), summary.getOutCount(),
                summary.getSpendCount(), summary.getRemainingUtxoCount()));
    }
}
