package com.pop.txodump.storage.hash;

import com.google.common.hash.HashFunction;
import lombok.Getter;

/**
 * {@link OutPointHasher} backed by a Guava {@link HashFunction}. Hashes wider than 64 bits are truncated to
 * their first eight bytes.
 */
public class GuavaOutPointHasher implements OutPointHasher {

    @Getter
    private final HashAlgorithm algorithm;
    private final HashFunction function;

    public GuavaOutPointHasher(HashAlgorithm algorithm) {
        this.algorithm = algorithm;
        this.function = algorithm.function();
    }

    public GuavaOutPointHasher() {
        this(HashAlgorithm.FARM_HASH_64);
    }

    @Override
    public long hash(byte[] txId, int vout) {
        return function.newHasher(txId.length + Integer.BYTES)
                .putBytes(txId)
                .putInt(vout)
                .hash()
                .asLong();
    }
}
