package com.pop.txodump.service;

import com.pop.txodump.api.data.transaction.TXInput;
import com.pop.txodump.api.data.transaction.TXOutput;
import com.pop.txodump.api.data.transaction.Transaction;
import com.pop.txodump.storage.UTXOEntry;
import com.pop.txodump.storage.UTXOSet;

import java.util.Optional;

/**
 * Fee and fee rate of a transaction, priced against the current UTXO set.
 * Must be called before the transaction's inputs are removed from the set.
 */
public class FeeRateCalculator {

    private final UTXOSet utxoSet;

    public FeeRateCalculator(UTXOSet utxoSet) {
        this.utxoSet = utxoSet;
    }

    //输入 = 输出 + 手续费
    public long getFee(Transaction transaction) {
        long totalInput = 0;
        for (TXInput input : transaction.getInputs()) {
            if (input.isCoinbase()) {
                continue;
            }
            // 未知的输出（裁剪过的历史）按0计
            Optional<UTXOEntry> utxo = utxoSet.lookup(input.getOutPoint());
            if (utxo.isPresent()) {
                totalInput += utxo.get().getValue();
            }
        }
        long totalOutput = transaction.getOutputs().stream()
                .mapToLong(TXOutput::getValue)
                .sum();
        return Math.max(0, totalInput - totalOutput);
    }

    /**
     * Fee divided by serialized size, truncated. Zero for a transaction without a known size.
     */
    public long getFeeRate(Transaction transaction) {
        long size = transaction.getSize();
        if (size <= 0) {
            return 0;
        }
        return getFee(transaction) / size;
    }
}
