package com.pop.txodump.api.callback;

/**
 * Implemented by callbacks that hold resources which must be released when the stream fails part way.
 * Aborting never produces the artifacts of a completed run.
 */
public interface Abortable {

    void abort();
}
