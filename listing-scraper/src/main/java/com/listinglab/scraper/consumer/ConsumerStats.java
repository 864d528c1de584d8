package com.listinglab.scraper.consumer;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Outcome counters for consumed messages.
 */
@Component
public class ConsumerStats {

    private final AtomicLong acknowledged = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong rejected = new AtomicLong();

    void recordAcknowledged() {
        acknowledged.incrementAndGet();
    }

    /** Acknowledged without processing because the message was unusable. */
    void recordDropped() {
        dropped.incrementAndGet();
    }

    void recordRejected() {
        rejected.incrementAndGet();
    }

    public long getAcknowledged() {
        return acknowledged.get();
    }

    public long getDropped() {
        return dropped.get();
    }

    public long getRejected() {
        return rejected.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> snapshot = new LinkedHashMap<>();
        snapshot.put("acknowledged", getAcknowledged());
        snapshot.put("dropped", getDropped());
        snapshot.put("rejected", getRejected());
        return snapshot;
    }
}
