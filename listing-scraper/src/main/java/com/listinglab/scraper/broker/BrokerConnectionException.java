package com.listinglab.scraper.broker;

/**
 * The broker could not be reached within the configured number of attempts.
 */
public class BrokerConnectionException extends RuntimeException {

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
