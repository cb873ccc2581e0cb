package com.stealthprompt.chain.support;

/**
 * Durable write of the chain store failed; the in-memory collection is left as it was.
 */
public class ChainStoreException extends RuntimeException {

    public ChainStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
