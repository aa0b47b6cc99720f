package com.pop.txodump.storage;

import java.io.IOException;

/**
 * Restores a previously saved UTXO set before the first block is processed.
 */
public interface UTXOSetLoader {

    /**
     * @param utxoSet empty set to fill
     * @return number of entries loaded
     * @throws IOException if no previous set could be read
     */
    long load(UTXOSet utxoSet) throws IOException;
}
