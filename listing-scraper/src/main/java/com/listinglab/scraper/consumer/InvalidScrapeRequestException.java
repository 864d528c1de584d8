package com.listinglab.scraper.consumer;

/**
 * A queue message that can never be processed, however often it is redelivered.
 */
public class InvalidScrapeRequestException extends Exception {

    public InvalidScrapeRequestException(String message) {
        super(message);
    }

    public InvalidScrapeRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
