package com.pop.txodump.service;

import com.google.common.base.Preconditions;
import com.pop.txodump.api.callback.Abortable;
import com.pop.txodump.api.callback.BlockCallback;
import com.pop.txodump.api.callback.CoinType;
import com.pop.txodump.api.data.block.Block;
import com.pop.txodump.api.data.transaction.Transaction;
import com.pop.txodump.api.exception.TxoDumpException;
import com.pop.txodump.service.report.DumpReporter;
import com.pop.txodump.service.report.Slf4jDumpReporter;
import com.pop.txodump.storage.NoopUTXOSetLoader;
import com.pop.txodump.storage.TxoLogWriter;
import com.pop.txodump.storage.UTXOSet;
import com.pop.txodump.storage.UTXOSetLoader;
import com.pop.txodump.storage.hash.GuavaOutPointHasher;
import com.pop.txodump.storage.hash.OutPointHasher;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Dumps every spent transaction output of a block stream into {@code txo.csv}.
 * <p>
 * Each line is {@code height;coin_age;fee_rate;value}. The UTXO set is built from the stream itself and dropped
 * when the stream completes. The final file only appears after {@link #onComplete}.
 */
@Slf4j
public class TXODump implements BlockCallback, Abortable {

    @Getter
    private final Path dumpFolder;
    private final TxoLogWriter writer;
    private final OutPointHasher hasher;
    private final int expectedUtxoCount;
    private final UTXOSetLoader loader;
    private final DumpReporter reporter;

    @Getter
    private LifecycleState state = LifecycleState.IDLE;
    @Getter
    private boolean aborted;

    @Getter
    private UTXOSet utxoSet;
    private SpendRecorder recorder;

    @Getter
    private long startHeight;
    @Getter
    private long lastHeight = -1;
    @Getter
    private long blockCount;
    @Getter
    private long txCount;
    @Getter
    private long inCount;
    @Getter
    private long outCount;
    @Getter
    private DumpSummary summary;

    private TXODump(Path dumpFolder, TxoLogWriter writer, OutPointHasher hasher, int expectedUtxoCount,
                    UTXOSetLoader loader, DumpReporter reporter) {
        this.dumpFolder = dumpFolder;
        this.writer = writer;
        this.hasher = hasher;
        this.expectedUtxoCount = expectedUtxoCount;
        this.loader = loader;
        this.reporter = reporter;
    }

    /**
     * Opens the working file in {@code dumpFolder}.
     *
     * @throws TxoDumpException if the folder is unusable or the file cannot be created
     */
    public static TXODump create(Path dumpFolder, OutPointHasher hasher, int expectedUtxoCount,
                                 UTXOSetLoader loader, DumpReporter reporter) throws TxoDumpException {
        try {
            return create(TxoLogWriter.open(dumpFolder), hasher, expectedUtxoCount, loader, reporter);
        } catch (IOException e) {
            throw new TxoDumpException("Couldn't initialize TXODump with folder: `" + dumpFolder + "`", e);
        }
    }

    static TXODump create(TxoLogWriter writer, OutPointHasher hasher, int expectedUtxoCount,
                          UTXOSetLoader loader, DumpReporter reporter) {
        return new TXODump(writer.getFinalFile().getParent(), writer, hasher, expectedUtxoCount, loader, reporter);
    }

    public static TXODump create(Path dumpFolder) throws TxoDumpException {
        return create(dumpFolder, new GuavaOutPointHasher(), UTXOSet.DEFAULT_EXPECTED_SIZE,
                new NoopUTXOSetLoader(), new Slf4jDumpReporter());
    }

    @Override
    public void onStart(CoinType coinType, long startHeight) {
        checkUsable();
        Preconditions.checkState(state == LifecycleState.IDLE, "onStart called in state %s", state);
        Preconditions.checkArgument(startHeight >= 0, "start height must not be negative: %s", startHeight);
        this.startHeight = startHeight;
        this.utxoSet = new UTXOSet(hasher, expectedUtxoCount);
        this.recorder = new SpendRecorder(utxoSet, new FeeRateCalculator(utxoSet), writer);
        this.state = LifecycleState.STARTED;
        reporter.started(dumpFolder, coinType, startHeight);
        try {
            reporter.utxosLoaded(loader.load(utxoSet));
        } catch (IOException e) {
            reporter.noUtxosLoaded(e);
        }
    }

    @Override
    public void onBlock(Block block, long height) throws TxoDumpException {
        checkUsable();
        Preconditions.checkState(state == LifecycleState.STARTED || state == LifecycleState.RUNNING,
                "onBlock called in state %s", state);
        Preconditions.checkState(height > lastHeight, "block height %s not above previous height %s", height, lastHeight);
        state = LifecycleState.RUNNING;

        for (Transaction tx : block.getTransactions()) {
            inCount += tx.getInCount();
            outCount += tx.getOutCount();
            try {
                recorder.record(tx, height);
            } catch (IOException e) {
                throw new TxoDumpException("Unable to write spend records of block " + height + " to " + writer.getTmpFile(), e);
            }
        }
        txCount += block.getTxCount();
        blockCount++;
        lastHeight = height;
        reporter.blockProcessed(height, block.getTxCount());
    }

    @Override
    public void onComplete(long finalHeight) throws TxoDumpException {
        checkUsable();
        Preconditions.checkState(state == LifecycleState.STARTED || state == LifecycleState.RUNNING,
                "onComplete called in state %s", state);
        // Rename temp files
        try {
            writer.commit();
        } catch (IOException e) {
            throw new TxoDumpException("Unable to rename tmp file! " + writer.getTmpFile() + " -> " + writer.getFinalFile(), e);
        }
        summary = new DumpSummary(startHeight, finalHeight, blockCount, txCount, inCount, outCount,
                recorder.getRecordCount(), utxoSet.size());
        // 内存中的UTXO集合不再需要
        utxoSet.clear();
        utxoSet = null;
        recorder = null;
        state = LifecycleState.COMPLETED;
        reporter.completed(summary);
    }

    /**
     * Stops a failed run. The working file is closed and kept, the final file is never created.
     */
    @Override
    public void abort() {
        if (aborted || state == LifecycleState.COMPLETED) {
            return;
        }
        aborted = true;
        try {
            writer.close();
        } catch (IOException e) {
            log.warn("Failed to close {} while aborting", writer.getTmpFile(), e);
        }
        log.warn("TXODump aborted in state {} after {} blocks, {} left incomplete", state, blockCount, writer.getTmpFile());
    }

    private void checkUsable() {
        Preconditions.checkState(!aborted, "TXODump was aborted");
    }
}
