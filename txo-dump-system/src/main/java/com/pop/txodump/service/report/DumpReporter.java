package com.pop.txodump.service.report;

import com.pop.txodump.api.callback.CoinType;
import com.pop.txodump.service.DumpSummary;

import java.nio.file.Path;

/**
 * Progress channel of a dump, handed to it at construction.
 */
public interface DumpReporter {

    void started(Path dumpFolder, CoinType coinType, long startHeight);

    void utxosLoaded(long count);

    void noUtxosLoaded(Exception cause);

    void blockProcessed(long height, int txCount);

    void completed(DumpSummary summary);
}
