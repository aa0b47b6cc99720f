package com.pop.txodump.api.exception;


/**
 * Thrown when a dump cannot be set up, written or finalized.
 */
public class TxoDumpException extends Exception {

    /**
     * Creates an empty TxoDumpException
     */
    public TxoDumpException() {
        super();
    }

    /**
     * @param message detail message
     */
    public TxoDumpException(String message) {
        super(message);
    }

    /**
     * @param message detail message
     * @param cause   underlying failure
     */
    public TxoDumpException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @param cause underlying failure
     */
    public TxoDumpException(Throwable cause) {
        super(cause);
    }
}
