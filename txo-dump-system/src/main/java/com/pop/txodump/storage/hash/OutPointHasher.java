package com.pop.txodump.storage.hash;

/**
 * 64-bit hash of an output reference, used as the bucket hash of the UTXO set.
 * Chain data is trusted, so implementations only need to be fast and well distributed.
 */
public interface OutPointHasher {

    long hash(byte[] txId, int vout);
}
