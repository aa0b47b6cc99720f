package com.pop.txodump.api.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * A decoded transaction as delivered by the block stream.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class Transaction implements Serializable {

    /**
     * Transaction id
     */
    private byte[] txId;

    /**
     * Serialized size in bytes
     */
    private long size;

    /**
     * Inputs in declaration order
     */
    private List<TXInput> inputs = new ArrayList<>();

    /**
     * Outputs in declaration order, the position is the output index
     */
    private List<TXOutput> outputs = new ArrayList<>();

    public int getInCount() {
        return inputs.size();
    }

    public int getOutCount() {
        return outputs.size();
    }
}
