package com.pop.txodump.api.data.transaction;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.apache.commons.codec.binary.Hex;

import java.io.Serializable;

/**
 * Reference to one specific output: the owning transaction's id plus the output's position.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
public class OutPoint implements Serializable {

    /**
     * Previous-index value carried by coinbase inputs (0xFFFFFFFF as an unsigned 32-bit number).
     */
    public static final int COINBASE_INDEX = 0xFFFFFFFF;

    /**
     * Transaction id (32 byte hash)
     */
    private byte[] txId;

    /**
     * Output index, unsigned 32-bit
     */
    private int vout;

    public boolean isCoinbase() {
        return vout == COINBASE_INDEX;
    }

    /**
     * @return the output index as an unsigned value
     */
    public long getUnsignedVout() {
        return Integer.toUnsignedLong(vout);
    }

    @Override
    public String toString() {
        return (txId == null ? "null" : Hex.encodeHexString(txId)) + ":" + getUnsignedVout();
    }
}
