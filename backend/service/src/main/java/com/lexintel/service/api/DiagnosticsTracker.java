package com.lexintel.service.api;

import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.CycleCompleted;
import com.lexintel.core.events.CycleStarted;
import com.lexintel.core.events.Event;
import com.lexintel.core.events.PostFailed;
import com.lexintel.core.events.PostPublished;
import com.lexintel.service.store.EventCodec;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayDeque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class DiagnosticsTracker {
    private final Clock clock;
    private final LongAdder eventsTotal = new LongAdder();
    private final LongAdder postsPublished = new LongAdder();
    private final LongAdder postsPublishedViaFallback = new LongAdder();
    private final LongAdder postsFailedTerminal = new LongAdder();
    private final ArrayDeque<Instant> recentEvents = new ArrayDeque<>();
    private final Object recentLock = new Object();
    private final ConcurrentHashMap<String, CycleStatus> cycleStatuses = new ConcurrentHashMap<>();

    public DiagnosticsTracker(EventBus eventBus, Clock clock) {
        this.clock = clock;
        EventCodec.subscribeAll(eventBus, this::onAnyEvent);
        eventBus.subscribe(CycleStarted.class, this::onCycleStarted);
        eventBus.subscribe(CycleCompleted.class, this::onCycleCompleted);
        eventBus.subscribe(AlertRaised.class, this::onAlertRaised);
        eventBus.subscribe(PostPublished.class, this::onPostPublished);
        eventBus.subscribe(PostFailed.class, this::onPostFailed);
    }

    public Map<String, Object> metricsSnapshot() {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("eventsTotal", eventsTotal.longValue());
        metrics.put("eventsLastMinute", eventsLastMinute());
        metrics.put("postsPublished", postsPublished.longValue());
        metrics.put("postsPublishedViaFallback", postsPublishedViaFallback.longValue());
        metrics.put("postsFailed", postsFailedTerminal.longValue());
        metrics.put("cycles", cyclesSnapshot());
        return metrics;
    }

    public Map<String, Object> cyclesSnapshot() {
        Map<String, Object> cycles = new TreeMap<>();
        for (Map.Entry<String, CycleStatus> entry : cycleStatuses.entrySet()) {
            cycles.put(entry.getKey(), entry.getValue().toMap());
        }
        return cycles;
    }

    private void onAnyEvent(Event event) {
        eventsTotal.increment();
        Instant now = clock.instant();
        synchronized (recentLock) {
            recentEvents.addLast(now);
            trimOld(now);
        }
    }

    private int eventsLastMinute() {
        synchronized (recentLock) {
            trimOld(clock.instant());
            return recentEvents.size();
        }
    }

    private void trimOld(Instant now) {
        Instant threshold = now.minus(1, ChronoUnit.MINUTES);
        while (!recentEvents.isEmpty() && recentEvents.peekFirst().isBefore(threshold)) {
            recentEvents.removeFirst();
        }
    }

    private void onCycleStarted(CycleStarted event) {
        cycleStatuses.compute(event.cycleName(), (name, current) ->
                (current == null ? CycleStatus.EMPTY : current).started(event.timestamp()));
    }

    private void onCycleCompleted(CycleCompleted event) {
        cycleStatuses.compute(event.cycleName(), (name, current) ->
                (current == null ? CycleStatus.EMPTY : current)
                        .completed(event.timestamp(), event.durationMillis(), event.success()));
    }

    private void onAlertRaised(AlertRaised event) {
        if (!"cycle".equalsIgnoreCase(event.category()) || event.details() == null) {
            return;
        }
        if (!(event.details().get("cycle") instanceof String cycleName) || cycleName.isBlank()) {
            return;
        }
        cycleStatuses.compute(cycleName, (name, current) ->
                (current == null ? CycleStatus.EMPTY : current).withError(event.message()));
    }

    private void onPostPublished(PostPublished event) {
        postsPublished.increment();
        if (event.viaFallback()) {
            postsPublishedViaFallback.increment();
        }
    }

    private void onPostFailed(PostFailed event) {
        if (event.terminal()) {
            postsFailedTerminal.increment();
        }
    }

    private record CycleStatus(
            Instant lastStartedAt,
            Instant lastCompletedAt,
            Long lastDurationMillis,
            Boolean lastSuccess,
            String lastError,
            int runs
    ) {
        private static final CycleStatus EMPTY = new CycleStatus(null, null, null, null, null, 0);

        private CycleStatus started(Instant at) {
            return new CycleStatus(at, lastCompletedAt, lastDurationMillis, lastSuccess, lastError, runs);
        }

        private CycleStatus completed(Instant at, long durationMillis, boolean success) {
            return new CycleStatus(lastStartedAt, at, durationMillis, success, success ? null : lastError, runs + 1);
        }

        private CycleStatus withError(String message) {
            return new CycleStatus(lastStartedAt, lastCompletedAt, lastDurationMillis, lastSuccess, message, runs);
        }

        private Map<String, Object> toMap() {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put("lastStartedAt", lastStartedAt == null ? null : lastStartedAt.toString());
            map.put("lastCompletedAt", lastCompletedAt == null ? null : lastCompletedAt.toString());
            map.put("lastDurationMillis", lastDurationMillis);
            map.put("lastSuccess", lastSuccess);
            map.put("lastError", lastError);
            map.put("runs", runs);
            return map;
        }
    }
}
