package com.lexintel.service.runtime;

import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.CycleCompleted;
import com.lexintel.core.events.CycleStarted;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each enabled cycle on its own fixed interval. A cycle never overlaps itself: a
 * tick that finds the previous run still going is dropped. Different cycles run
 * independently, and one failing never stops the others.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final Map<String, ScheduledCycle> cycles = new LinkedHashMap<>();
    private final Map<String, ReentrantLock> locks = new LinkedHashMap<>();
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService cycleExecutor;

    public SchedulerService(List<ScheduledCycle> cycles, EventBus eventBus, Clock clock) {
        this(cycles, eventBus, clock, 1_000);
    }

    SchedulerService(List<ScheduledCycle> cycles, EventBus eventBus, Clock clock, long minIntervalMillis) {
        for (ScheduledCycle scheduled : cycles) {
            String name = scheduled.cycle().name();
            if (this.cycles.putIfAbsent(name, scheduled) != null) {
                throw new IllegalArgumentException("Duplicate cycle name: " + name);
            }
            locks.put(name, new ReentrantLock());
        }
        this.eventBus = eventBus;
        this.clock = clock;
        this.minIntervalMillis = minIntervalMillis;
        this.cycleExecutor = Executors.newFixedThreadPool(Math.max(1, cycles.size()));
    }

    public void start() {
        for (ScheduledCycle scheduled : cycles.values()) {
            if (!scheduled.enabled()) {
                LOGGER.info("Cycle " + scheduled.cycle().name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, scheduled.interval().toMillis());
            timerExecutor.scheduleAtFixedRate(
                    () -> cycleExecutor.submit(() -> runScheduled(scheduled.cycle())),
                    0,
                    intervalMillis,
                    TimeUnit.MILLISECONDS
            );
            LOGGER.info("Scheduled cycle " + scheduled.cycle().name() + " every " + intervalMillis / 1000 + "s");
        }
    }

    public Optional<CycleResult> runOnce(String name) {
        return runOnce(name, Map.of());
    }

    public Optional<CycleResult> runOnce(String name, Map<String, String> options) {
        ScheduledCycle scheduled = cycles.get(name);
        if (scheduled == null) {
            return Optional.empty();
        }
        ReentrantLock lock = locks.get(name);
        if (!lock.tryLock()) {
            return Optional.of(CycleResult.failure(name, "Cycle " + name + " is already running", Map.of()));
        }
        try {
            return Optional.of(runSafely(scheduled.cycle(), options));
        } finally {
            lock.unlock();
        }
    }

    public List<CycleResult> runOnceAll() {
        List<CycleResult> results = new ArrayList<>();
        for (ScheduledCycle scheduled : cycles.values()) {
            if (scheduled.enabled()) {
                runOnce(scheduled.cycle().name()).ifPresent(results::add);
            }
        }
        return results;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        cycleExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            if (!cycleExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                cycleExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            cycleExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledCycle> scheduledCycles() {
        return List.copyOf(cycles.values());
    }

    public boolean isRunning(String name) {
        ReentrantLock lock = locks.get(name);
        return lock != null && lock.isLocked();
    }

    private void runScheduled(Cycle cycle) {
        ReentrantLock lock = locks.get(cycle.name());
        if (!lock.tryLock()) {
            LOGGER.fine(() -> "Skipping tick of " + cycle.name() + ", previous run still in progress");
            return;
        }
        try {
            runSafely(cycle, Map.of());
        } finally {
            lock.unlock();
        }
    }

    private CycleResult runSafely(Cycle cycle, Map<String, String> options) {
        Instant started = clock.instant();
        eventBus.publish(new CycleStarted(started, cycle.name()));
        CycleResult result;
        try {
            result = cycle.run(options);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.SEVERE, "Cycle " + cycle.name() + " threw", ex);
            eventBus.publish(new AlertRaised(
                    clock.instant(),
                    "cycle",
                    "Cycle run failed: " + cycle.name() + " - " + ex.getMessage(),
                    Map.of("cycle", cycle.name())
            ));
            result = CycleResult.failure(cycle.name(), "Cycle run failed: " + ex.getMessage(), Map.of());
        }
        Instant finished = clock.instant();
        long durationMillis = Duration.between(started, finished).toMillis();
        eventBus.publish(new CycleCompleted(finished, cycle.name(), result.success(), durationMillis));
        LOGGER.info("Cycle " + cycle.name() + (result.success() ? " completed" : " failed") + " in "
                + durationMillis + "ms: " + result.message());
        return result;
    }

    public record ScheduledCycle(Cycle cycle, Duration interval, boolean enabled) {
        public ScheduledCycle {
            Objects.requireNonNull(cycle, "cycle is required");
            Objects.requireNonNull(interval, "interval is required");
        }
    }
}
