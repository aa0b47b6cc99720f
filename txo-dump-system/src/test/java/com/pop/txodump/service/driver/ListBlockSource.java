package com.pop.txodump.service.driver;

import com.pop.txodump.api.data.block.Block;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;

class ListBlockSource implements BlockSource {

    private final Iterator<Block> blocks;
    boolean closed;

    ListBlockSource(List<Block> blocks) {
        this.blocks = blocks.iterator();
    }

    @Override
    public Optional<Block> next() {
        return blocks.hasNext() ? Optional.of(blocks.next()) : Optional.empty();
    }

    @Override
    public void close() {
        closed = true;
    }
}
