package com.pop.txodump.storage.hash;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static com.pop.txodump.TestBlocks.txId;

public class GuavaOutPointHasherTest {

    @Test
    void testDeterministic() {
        GuavaOutPointHasher first = new GuavaOutPointHasher(HashAlgorithm.FARM_HASH_64);
        GuavaOutPointHasher second = new GuavaOutPointHasher(HashAlgorithm.FARM_HASH_64);
        Assertions.assertEquals(first.hash(txId(7), 1), second.hash(txId(7), 1));
    }

    @Test
    void testIndexChangesHash() {
        GuavaOutPointHasher hasher = new GuavaOutPointHasher();
        Assertions.assertEquals(HashAlgorithm.FARM_HASH_64, hasher.getAlgorithm());
        Assertions.assertNotEquals(hasher.hash(txId(7), 0), hasher.hash(txId(7), 1));
    }

    @Test
    void testSpreadsSequentialKeys() {
        for (HashAlgorithm algorithm : HashAlgorithm.values()) {
            GuavaOutPointHasher hasher = new GuavaOutPointHasher(algorithm);
            Set<Long> hashes = new HashSet<>();
            for (int i = 0; i < 10_000; i++) {
                hashes.add(hasher.hash(txId(i), 0));
            }
            Assertions.assertEquals(10_000, hashes.size(), algorithm.name());
        }
    }
}
