package com.lexintel.service.ingest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

public class DedupWindow {
    private final int capacity;
    private final Duration maxAge;
    private final Deque<Entry> order = new ArrayDeque<>();
    private final Map<String, Instant> seenAt = new HashMap<>();

    public DedupWindow(int capacity, Duration maxAge) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.maxAge = maxAge;
    }

    public synchronized boolean contains(String titleNorm, Instant now) {
        evictExpired(now);
        return seenAt.containsKey(titleNorm);
    }

    // Records a title as seen. Insertion order is processing order; re-adding a title moves it to the newest end.
    public synchronized void add(String titleNorm, Instant at) {
        if (seenAt.containsKey(titleNorm)) {
            order.removeIf(entry -> entry.titleNorm().equals(titleNorm));
        }
        order.addLast(new Entry(titleNorm, at));
        seenAt.put(titleNorm, at);
        while (order.size() > capacity) {
            Entry oldest = order.removeFirst();
            seenAt.remove(oldest.titleNorm());
        }
        evictExpired(at);
    }

    public synchronized int size() {
        return order.size();
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(maxAge);
        while (!order.isEmpty() && order.peekFirst().seenAt().isBefore(cutoff)) {
            Entry expired = order.removeFirst();
            seenAt.remove(expired.titleNorm());
        }
    }

    private record Entry(String titleNorm, Instant seenAt) {
    }
}
