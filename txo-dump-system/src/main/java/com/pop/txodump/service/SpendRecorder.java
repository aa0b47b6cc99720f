package com.pop.txodump.service;

import com.google.common.base.Preconditions;
import com.pop.txodump.api.data.transaction.OutPoint;
import com.pop.txodump.api.data.transaction.TXInput;
import com.pop.txodump.api.data.transaction.TXOutput;
import com.pop.txodump.api.data.transaction.Transaction;
import com.pop.txodump.data.SpendRecord;
import com.pop.txodump.storage.TxoLogWriter;
import com.pop.txodump.storage.UTXOEntry;
import com.pop.txodump.storage.UTXOSet;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Applies one transaction to the UTXO set: every known spent output is written to the spend log and removed,
 * then the transaction's own outputs are added.
 * <p>
 * The fee rate belongs to the transaction but is repeated on each record it produces.
 */
@Slf4j
public class SpendRecorder {

    private final UTXOSet utxoSet;
    private final FeeRateCalculator feeRateCalculator;
    private final TxoLogWriter writer;

    @Getter
    private long recordCount;
    @Getter
    private long unknownInputCount;

    public SpendRecorder(UTXOSet utxoSet, FeeRateCalculator feeRateCalculator, TxoLogWriter writer) {
        this.utxoSet = utxoSet;
        this.feeRateCalculator = feeRateCalculator;
        this.writer = writer;
    }

    /**
     * @return number of spend records written for this transaction
     */
    public int record(Transaction transaction, long height) throws IOException {
        int written = 0;
        // 惰性计算：第一个命中的输入之前集合未被修改，结果与预先计算一致
        long feeRate = -1;
        for (TXInput input : transaction.getInputs()) {
            // coinbase txinput has previous index of 0xFFFFFFFF
            if (input.isCoinbase()) {
                continue;
            }
            OutPoint outPoint = input.getOutPoint();
            Optional<UTXOEntry> utxo = utxoSet.lookup(outPoint);
            if (utxo.isEmpty()) {
                unknownInputCount++;
                log.trace("Input {} references an unknown output, skipped", outPoint);
                continue;
            }
            if (feeRate < 0) {
                feeRate = feeRateCalculator.getFeeRate(transaction);
            }
            UTXOEntry entry = utxo.get();
            long coinAge = height - entry.getHeight();
            Preconditions.checkState(coinAge >= 0, "Output %s created at %s spent at lower height %s",
                    outPoint, entry.getHeight(), height);
            writer.append(new SpendRecord(height, coinAge, feeRate, entry.getValue()));
            utxoSet.remove(outPoint);
            log.trace("Removed {} from UTXO set", outPoint);
            written++;
        }

        List<TXOutput> outputs = transaction.getOutputs();
        for (int i = 0; i < outputs.size(); i++) {
            OutPoint outPoint = new OutPoint(transaction.getTxId(), i);
            utxoSet.insert(outPoint, outputs.get(i).getValue(), height);
            log.trace("Added UTXO {} to the UTXO set", outPoint);
        }
        recordCount += written;
        return written;
    }
}
