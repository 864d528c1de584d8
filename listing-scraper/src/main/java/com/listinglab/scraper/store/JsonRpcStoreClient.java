package com.listinglab.scraper.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.listinglab.scraper.config.ListingScraperProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Store client over the JSON-2 endpoint: {@code POST {url}/json/2/{entity}/{method}}
 * with the method's keyword arguments as the JSON body.
 *
 * Timeouts come from the RestTemplate; there is no retry for data calls, a
 * failed call fails whatever message triggered it.
 */
@Service
@Slf4j
public class JsonRpcStoreClient implements StoreClient {

    static final String DATABASE_HEADER = "X-Odoo-Database";

    private static final List<String> SENSITIVE_KEYS =
            List.of("password", "token", "apikey", "api_key", "authorization");
    private static final int LOGGED_BODY_LIMIT = 500;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ListingScraperProperties.Store properties;

    public JsonRpcStoreClient(@Qualifier("storeRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              ListingScraperProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties.getStore();
    }

    @Override
    public JsonNode call(String entity, String method, Map<String, Object> arguments) {
        String url = properties.getUrl() + "/json/2/" + entity + "/" + method;
        log.debug("Store request URL={} payload={}", url, masked(arguments));

        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    url, HttpMethod.POST, new HttpEntity<>(arguments, headers()), String.class);
            String body = response.getBody();
            log.debug("Store response {}: {}", response.getStatusCode().value(), abbreviate(body));

            if (!StringUtils.hasText(body)) {
                return NullNode.getInstance();
            }
            return StoreResponses.normalize(objectMapper.readTree(body));

        } catch (RestClientResponseException e) {
            throw new StoreException(String.format("%s/%s failed: %d - %s",
                    entity, method, e.getStatusCode().value(), abbreviate(e.getResponseBodyAsString())), e);
        } catch (RestClientException | JsonProcessingException e) {
            throw new StoreException(entity + "/" + method + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public long create(String entity, Map<String, Object> values) {
        // JSON-2 create takes a batch; a single record goes in as a batch of one
        Map<String, Object> arguments = Map.of("vals_list", List.of(values));
        JsonNode result = call(entity, "create", arguments);
        return StoreResponses.firstId(result)
                .orElseThrow(() -> new StoreException(entity + "/create returned no id: " + result));
    }

    @Override
    public boolean write(String entity, List<Long> ids, Map<String, Object> values) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("ids", ids);
        arguments.put("vals", values);
        return StoreResponses.isTruthy(call(entity, "write", arguments));
    }

    @Override
    public List<Long> search(String entity, List<List<Object>> domain) {
        return StoreResponses.ids(call(entity, "search", Map.of("domain", domain)));
    }

    @Override
    public List<Map<String, Object>> searchRead(String entity, List<List<Object>> domain, List<String> fields) {
        Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("domain", domain);
        arguments.put("fields", fields);
        JsonNode result = call(entity, "search_read", arguments);
        if (!result.isArray()) {
            return new ArrayList<>();
        }
        return objectMapper.convertValue(result, new TypeReference<List<Map<String, Object>>>() {
        });
    }

    @Override
    @Retry(name = "storeHandshake")
    public void verifyConnection() {
        log.info("Connecting to store at {}", properties.getUrl());
        call("res.users", "context_get", Map.of());
        log.info("Connected to store at {}", properties.getUrl());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(HttpHeaders.AUTHORIZATION, "bearer " + properties.getApiKey());
        if (StringUtils.hasText(properties.getDatabase())) {
            headers.set(DATABASE_HEADER, properties.getDatabase());
        }
        return headers;
    }

    static Map<String, Object> masked(Map<String, Object> arguments) {
        Map<String, Object> masked = new LinkedHashMap<>();
        arguments.forEach((key, value) -> {
            String lower = key.toLowerCase(Locale.ROOT);
            boolean sensitive = SENSITIVE_KEYS.stream().anyMatch(lower::contains);
            masked.put(key, sensitive ? "****" : value);
        });
        return masked;
    }

    private static String abbreviate(String body) {
        if (body == null || body.length() <= LOGGED_BODY_LIMIT) {
            return body;
        }
        return body.substring(0, LOGGED_BODY_LIMIT) + "...";
    }
}
