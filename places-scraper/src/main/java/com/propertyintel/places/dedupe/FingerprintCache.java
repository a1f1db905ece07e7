package com.propertyintel.places.dedupe;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bounded set of record fingerprints with least-recently-used eviction.
 *
 * One instance is shared by every area of a job. The check and the insert in
 * {@link #probeAndMark(String)} happen under one lock, so two areas racing on the
 * same listing cannot both see it as new.
 */
public class FingerprintCache {

    private final int capacity;
    private final LinkedHashMap<String, Boolean> entries;
    private long evictions;

    public FingerprintCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Cache capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        // access-order: get() moves an entry to the tail, eldest = least recently probed
        this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                if (size() > FingerprintCache.this.capacity) {
                    evictions++;
                    return true;
                }
                return false;
            }
        };
    }

    /**
     * @return true if the fingerprint was not present (it is now), false if it was already seen
     */
    public synchronized boolean probeAndMark(String fingerprint) {
        if (entries.get(fingerprint) != null) {
            return false;
        }
        entries.put(fingerprint, Boolean.TRUE);
        return true;
    }

    /** Does not touch recency. */
    public synchronized boolean contains(String fingerprint) {
        return entries.containsKey(fingerprint);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long evictions() {
        return evictions;
    }

    public int capacity() {
        return capacity;
    }
}
