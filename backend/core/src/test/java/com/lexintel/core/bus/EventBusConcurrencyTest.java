package com.lexintel.core.bus;

import com.lexintel.core.events.ArticlesIngested;
import com.lexintel.core.events.PostFailed;
import com.lexintel.core.events.PostPublished;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventBusConcurrencyTest {
    private static final List<String> PLATFORMS = List.of("devto", "hashnode", "linkedin");

    @Test
    void parallelPublishWorkersAreTalliedPerPlatform() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler failure for " + event.type(), error);
        });
        Map<String, LongAdder> published = new ConcurrentHashMap<>();
        Map<String, LongAdder> terminal = new ConcurrentHashMap<>();
        bus.subscribe(PostPublished.class,
                event -> published.computeIfAbsent(event.platform(), ignored -> new LongAdder()).increment());
        bus.subscribe(PostFailed.class, event -> {
            if (event.terminal()) {
                terminal.computeIfAbsent(event.platform(), ignored -> new LongAdder()).increment();
            }
        });
        LongAdder ingested = new LongAdder();
        bus.subscribe(ArticlesIngested.class, event -> ingested.add(event.accepted()));

        int itemsPerPlatform = 400;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(PLATFORMS.size() + 1);
        try {
            List<Future<?>> workers = new ArrayList<>();
            for (String platform : PLATFORMS) {
                workers.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < itemsPerPlatform; i++) {
                        String itemId = platform + "-" + i;
                        if (i % 4 == 0) {
                            bus.publish(new PostFailed(Instant.now(), itemId, platform, true, "HTTP 422"));
                        } else {
                            bus.publish(new PostPublished(Instant.now(), itemId, platform, "id-" + i, i % 2 == 0));
                        }
                    }
                    return null;
                }));
            }
            workers.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < itemsPerPlatform; i++) {
                    bus.publish(new ArticlesIngested(Instant.now(), "36kr", 3, 2));
                }
                return null;
            }));
            start.countDown();
            for (Future<?> worker : workers) {
                worker.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        for (String platform : PLATFORMS) {
            assertEquals(300L, published.get(platform).sum(), platform);
            assertEquals(100L, terminal.get(platform).sum(), platform);
        }
        assertEquals(2L * itemsPerPlatform, ingested.sum());
    }

    @Test
    void lateSubscribersJoinWhileAlertsAreInFlight() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());
        LongAdder firstSubscriber = new LongAdder();
        bus.subscribe(PostFailed.class, event -> firstSubscriber.increment());
        bus.subscribe(PostFailed.class, event -> {
            if (event.message().isEmpty()) {
                throw new IllegalStateException("empty failure message");
            }
        });

        int publishes = 2_000;
        int lateSubscribers = 50;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> publisher = executor.submit(() -> {
                start.await();
                for (int i = 0; i < publishes; i++) {
                    String message = i % 10 == 0 ? "" : "HTTP 503";
                    bus.publish(new PostFailed(Instant.now(), "item-" + i, "hashnode", false, message));
                }
                return null;
            });
            Future<?> subscriber = executor.submit(() -> {
                start.await();
                for (int i = 0; i < lateSubscribers; i++) {
                    bus.subscribe(PostFailed.class, event -> { });
                }
                return null;
            });
            start.countDown();
            publisher.get(10, TimeUnit.SECONDS);
            subscriber.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(publishes, firstSubscriber.sum());
        assertEquals(publishes / 10, handlerErrors.get());
        assertEquals(2 + lateSubscribers, bus.subscriberCount(PostFailed.class));
        assertEquals(0, bus.subscriberCount(PostPublished.class));
    }
}
