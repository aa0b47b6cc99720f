package com.pop.txodump.service.driver;

import com.pop.txodump.api.callback.Abortable;
import com.pop.txodump.api.callback.BlockCallback;
import com.pop.txodump.api.callback.CoinType;
import com.pop.txodump.api.data.block.Block;
import com.pop.txodump.api.exception.TxoDumpException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Feeds a {@link BlockSource} into a {@link BlockCallback}, one block at a time.
 * <p>
 * Blocks below the start height are skipped and reading stops after the end height ({@code -1} reads to the end
 * of the source). Heights must increase strictly; a repeated or lower height fails the run.
 */
@Slf4j
public class BlockStreamDriver {

    public static final long UNBOUNDED = -1;

    @Getter
    private final CoinType coinType;
    @Getter
    private final long startHeight;
    @Getter
    private final long endHeight;

    public BlockStreamDriver(CoinType coinType, long startHeight, long endHeight) {
        if (startHeight < 0) {
            throw new IllegalArgumentException("start height must not be negative: " + startHeight);
        }
        if (endHeight != UNBOUNDED && endHeight < startHeight) {
            throw new IllegalArgumentException("end height " + endHeight + " below start height " + startHeight);
        }
        this.coinType = coinType;
        this.startHeight = startHeight;
        this.endHeight = endHeight;
    }

    /**
     * Runs the whole lifecycle. On failure an {@link Abortable} callback is aborted before the error is rethrown.
     *
     * @return number of blocks delivered
     */
    public long run(BlockSource source, BlockCallback callback) throws TxoDumpException {
        try {
            callback.onStart(coinType, startHeight);
            long lastHeight = -1;
            long delivered = 0;
            while (true) {
                Optional<Block> next = source.next();
                if (next.isEmpty()) {
                    break;
                }
                Block block = next.get();
                long height = block.getHeight();
                if (height < startHeight) {
                    continue;
                }
                if (endHeight != UNBOUNDED && height > endHeight) {
                    break;
                }
                if (lastHeight >= 0 && height <= lastHeight) {
                    throw new TxoDumpException("Block heights must be strictly increasing, got " + height + " after " + lastHeight);
                }
                callback.onBlock(block, height);
                lastHeight = height;
                delivered++;
            }
            callback.onComplete(delivered == 0 ? startHeight : lastHeight);
            log.debug("Delivered {} blocks to {}", delivered, callback.getClass().getSimpleName());
            return delivered;
        } catch (TxoDumpException | RuntimeException e) {
            if (callback instanceof Abortable) {
                ((Abortable) callback).abort();
            }
            throw e;
        }
    }
}
