package com.pop.txodump.storage;

import com.google.common.collect.Maps;
import com.pop.txodump.api.data.transaction.OutPoint;
import com.pop.txodump.storage.hash.OutPointHasher;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Optional;

/**
 * In-memory set of unspent outputs keyed by output reference.
 * <p>
 * Entries live until they are removed, there is no eviction. The backing map is sized up front from the
 * expected number of live outputs. Not thread safe; owned by a single dump.
 */
@Slf4j
public class UTXOSet {

    public static final int DEFAULT_EXPECTED_SIZE = 1 << 20;

    private final OutPointHasher hasher;
    private final HashMap<HashedOutPoint, UTXOEntry> utxos;

    // 重复插入次数（同一个txid重复出现）
    private long overwriteCount;

    public UTXOSet(OutPointHasher hasher, int expectedSize) {
        this.hasher = hasher;
        this.utxos = Maps.newHashMapWithExpectedSize(expectedSize);
    }

    public UTXOSet(OutPointHasher hasher) {
        this(hasher, DEFAULT_EXPECTED_SIZE);
    }

    /**
     * Adds an output. A second insert of the same reference replaces the first one.
     */
    public void insert(OutPoint outPoint, long value, long height) {
        UTXOEntry previous = utxos.put(storedKey(outPoint), new UTXOEntry(value, height));
        if (previous != null) {
            overwriteCount++;
            log.warn("UTXO {} inserted twice, replacing {} created at height {}", outPoint, previous.getValue(), previous.getHeight());
        }
    }

    public Optional<UTXOEntry> lookup(OutPoint outPoint) {
        return Optional.ofNullable(utxos.get(key(outPoint)));
    }

    public Optional<UTXOEntry> remove(OutPoint outPoint) {
        return Optional.ofNullable(utxos.remove(key(outPoint)));
    }

    public boolean contains(OutPoint outPoint) {
        return utxos.containsKey(key(outPoint));
    }

    public int size() {
        return utxos.size();
    }

    public boolean isEmpty() {
        return utxos.isEmpty();
    }

    public long getOverwriteCount() {
        return overwriteCount;
    }

    public void clear() {
        utxos.clear();
    }

    // stored keys must not share the caller's id buffer
    private HashedOutPoint storedKey(OutPoint outPoint) {
        byte[] txId = outPoint.getTxId().clone();
        return new HashedOutPoint(txId, outPoint.getVout(), hasher.hash(txId, outPoint.getVout()));
    }

    private HashedOutPoint key(OutPoint outPoint) {
        byte[] txId = outPoint.getTxId();
        return new HashedOutPoint(txId, outPoint.getVout(), hasher.hash(txId, outPoint.getVout()));
    }
}
