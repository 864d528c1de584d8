package com.listinglab.scraper.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Request/response access to the persistence store. Implementations throw
 * {@link StoreException} on any failure; nothing is retried here.
 */
public interface StoreClient {

    /**
     * Raw call; the returned node is already normalized.
     */
    JsonNode call(String entity, String method, Map<String, Object> arguments);

    /**
     * Creates one row and returns its id.
     */
    long create(String entity, Map<String, Object> values);

    /**
     * Writes the same values to every given row. Returns the store's verdict.
     */
    boolean write(String entity, List<Long> ids, Map<String, Object> values);

    List<Long> search(String entity, List<List<Object>> domain);

    List<Map<String, Object>> searchRead(String entity, List<List<Object>> domain, List<String> fields);

    /**
     * Cheap authenticated call used to check the session before consuming.
     */
    void verifyConnection();
}
