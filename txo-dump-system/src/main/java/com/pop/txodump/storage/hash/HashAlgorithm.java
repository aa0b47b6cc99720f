package com.pop.txodump.storage.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Non-cryptographic hash functions available for UTXO keys.
 */
public enum HashAlgorithm {
    FARM_HASH_64 {
        @Override
        public HashFunction function() {
            return Hashing.farmHashFingerprint64();
        }
    },
    MURMUR3_128 {
        @Override
        public HashFunction function() {
            return Hashing.murmur3_128();
        }
    },
    // 固定密钥，这里只取分布
    SIP_HASH_24 {
        @Override
        public HashFunction function() {
            return Hashing.sipHash24();
        }
    };

    public abstract HashFunction function();
}
