package com.pop.txodump.service;

import com.pop.txodump.api.callback.CoinType;
import com.pop.txodump.service.report.DumpReporter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class RecordingDumpReporter implements DumpReporter {

    public final List<String> events = new ArrayList<>();
    public DumpSummary summary;

    @Override
    public void started(Path dumpFolder, CoinType coinType, long startHeight) {
        events.add("started " + coinType + " " + startHeight);
    }

    @Override
    public void utxosLoaded(long count) {
        events.add("loaded " + count);
    }

    @Override
    public void noUtxosLoaded(Exception cause) {
        events.add("not loaded");
    }

    @Override
    public void blockProcessed(long height, int txCount) {
        events.add("block " + height);
    }

    @Override
    public void completed(DumpSummary summary) {
        this.summary = summary;
        events.add("completed");
    }
}
