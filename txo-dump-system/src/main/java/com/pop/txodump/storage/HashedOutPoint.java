package com.pop.txodump.storage;

import java.util.Arrays;

/**
 * Map key of the UTXO set. The 64-bit hash is computed once by the set's hasher and folded for
 * {@link #hashCode()}.
 */
final class HashedOutPoint {

    private final byte[] txId;
    private final int vout;
    private final long hash;

    HashedOutPoint(byte[] txId, int vout, long hash) {
        this.txId = txId;
        this.vout = vout;
        this.hash = hash;
    }

    @Override
    public int hashCode() {
        return (int) (hash ^ (hash >>> 32));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HashedOutPoint)) return false;
        HashedOutPoint that = (HashedOutPoint) o;
        return vout == that.vout && hash == that.hash && Arrays.equals(txId, that.txId);
    }
}
