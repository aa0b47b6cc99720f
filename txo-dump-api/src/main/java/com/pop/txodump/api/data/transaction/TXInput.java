package com.pop.txodump.api.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Transaction input. Only the spent output reference is carried; scripts and witnesses are not needed to
 * follow coins through the chain.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class TXInput implements Serializable {

    /**
     * Id of the transaction that created the spent output
     */
    private byte[] txId;

    /**
     * Index of the spent output inside that transaction
     */
    private int vout;

    public OutPoint getOutPoint() {
        return new OutPoint(txId, vout);
    }

    public boolean isCoinbase() {
        return vout == OutPoint.COINBASE_INDEX;
    }
}
