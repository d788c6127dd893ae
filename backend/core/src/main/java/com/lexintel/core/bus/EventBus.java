package com.lexintel.core.bus;

import com.lexintel.core.events.Event;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous in-process publish/subscribe keyed by the concrete event class. Handlers
 * run on the publishing thread in subscription order; a failing handler is reported to
 * the error callback and the remaining handlers still receive the event.
 */
public class EventBus {
    private static final Logger LOGGER = Logger.getLogger(EventBus.class.getName());

    private final Map<Class<? extends Event>, List<Registration<?>>> registrations = new ConcurrentHashMap<>();
    private final BiConsumer<Event, Exception> onHandlerError;

    public EventBus() {
        this((event, ex) -> LOGGER.log(Level.WARNING, "Handler for " + event.type() + " threw", ex));
    }

    public EventBus(BiConsumer<Event, Exception> onHandlerError) {
        this.onHandlerError = Objects.requireNonNull(onHandlerError, "onHandlerError");
    }

    public <T extends Event> void subscribe(Class<T> type, Consumer<T> handler) {
        Registration<T> registration = new Registration<>(type, Objects.requireNonNull(handler, "handler"));
        registrations.computeIfAbsent(type, ignored -> new CopyOnWriteArrayList<>()).add(registration);
    }

    public void publish(Event event) {
        List<Registration<?>> forType = registrations.get(event.getClass());
        if (forType == null) {
            return;
        }
        for (Registration<?> registration : forType) {
            try {
                registration.deliver(event);
            } catch (Exception ex) {
                onHandlerError.accept(event, ex);
            }
        }
    }

    public int subscriberCount(Class<? extends Event> type) {
        List<Registration<?>> forType = registrations.get(type);
        return forType == null ? 0 : forType.size();
    }

    private record Registration<T extends Event>(Class<T> type, Consumer<T> handler) {
        void deliver(Event event) {
            handler.accept(type.cast(event));
        }
    }
}
