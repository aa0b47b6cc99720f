package com.pop.txodump.api.callback;

import com.pop.txodump.api.data.block.Block;
import com.pop.txodump.api.exception.TxoDumpException;

/**
 * Lifecycle contract between a block stream driver and a consumer.
 * <p>
 * The driver calls {@link #onStart} once, then {@link #onBlock} once per block with strictly increasing heights,
 * then {@link #onComplete} once. Calls are never concurrent.
 */
public interface BlockCallback {

    /**
     * Called before the first block is delivered.
     *
     * @param coinType    chain being read
     * @param startHeight height of the first block that will be delivered
     */
    void onStart(CoinType coinType, long startHeight) throws TxoDumpException;

    /**
     * Called for every block in height order.
     *
     * @param block  the decoded block
     * @param height its height
     */
    void onBlock(Block block, long height) throws TxoDumpException;

    /**
     * Called once after the last block.
     *
     * @param finalHeight height of the last delivered block
     */
    void onComplete(long finalHeight) throws TxoDumpException;
}
