package com.example.tenantsync.workflow;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Insertion-ordered set of processed event keys with oldest-first eviction.
 *
 * Lives inside workflow state, so it is rebuilt by replay; across continue-as-new it is
 * carried as a list via {@link #snapshot()} and {@link #restore(Collection)}.
 */
public class IdempotencyLedger {

    private final int capacity;
    private final LinkedHashSet<String> keys = new LinkedHashSet<>();

    public IdempotencyLedger(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Ledger capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return false if the key was already present
     */
    public boolean add(String key) {
        if (!keys.add(key)) {
            return false;
        }
        evictOverflow();
        return true;
    }

    public boolean contains(String key) {
        return keys.contains(key);
    }

    public int size() {
        return keys.size();
    }

    /**
     * Keys oldest first.
     */
    public List<String> snapshot() {
        return new ArrayList<>(keys);
    }

    /**
     * Put carried keys in front of anything already recorded, then trim to capacity.
     */
    public void restore(Collection<String> carried) {
        if (carried == null || carried.isEmpty()) {
            return;
        }
        LinkedHashSet<String> merged = new LinkedHashSet<>(carried);
        merged.addAll(keys);
        keys.clear();
        keys.addAll(merged);
        evictOverflow();
    }

    private void evictOverflow() {
        Iterator<String> oldest = keys.iterator();
        while (keys.size() > capacity && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
    }
}
