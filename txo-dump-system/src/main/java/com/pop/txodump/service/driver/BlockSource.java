package com.pop.txodump.service.driver;

import com.pop.txodump.api.data.block.Block;
import com.pop.txodump.api.exception.TxoDumpException;

import java.io.Closeable;
import java.util.Optional;

/**
 * Sequential source of decoded blocks in chain order.
 */
public interface BlockSource extends Closeable {

    /**
     * @return the next block, or empty at the end of the stream
     */
    Optional<Block> next() throws TxoDumpException;
}
