package com.listinglab.scraper.store;

/**
 * Raised when a store call fails at the transport level, returns a non-2xx
 * status, or returns a body the caller cannot use.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
