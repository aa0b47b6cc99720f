package com.pop.txodump.storage;

import lombok.extern.slf4j.Slf4j;

/**
 * Placeholder loader. No on-disk format for a saved UTXO set exists yet, so every run starts from an empty set
 * and an interrupted run has to be repeated from the beginning.
 */
@Slf4j
public class NoopUTXOSetLoader implements UTXOSetLoader {

    @Override
    public long load(UTXOSet utxoSet) {
        log.info("Loading a saved UTXO set is not implemented, starting empty");
        return 0;
    }
}
