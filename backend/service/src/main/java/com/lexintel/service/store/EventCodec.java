package com.lexintel.service.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexintel.core.bus.EventBus;
import com.lexintel.core.events.AlertRaised;
import com.lexintel.core.events.ArticlesIngested;
import com.lexintel.core.events.BriefingGenerated;
import com.lexintel.core.events.CycleCompleted;
import com.lexintel.core.events.CycleStarted;
import com.lexintel.core.events.Event;
import com.lexintel.core.events.PostFailed;
import com.lexintel.core.events.PostPublished;
import com.lexintel.core.util.JsonUtils;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

public final class EventCodec {
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();
    private static final Map<String, Class<? extends Event>> TYPES = Map.of(
            "CycleStarted", CycleStarted.class,
            "CycleCompleted", CycleCompleted.class,
            "ArticlesIngested", ArticlesIngested.class,
            "BriefingGenerated", BriefingGenerated.class,
            "PostPublished", PostPublished.class,
            "PostFailed", PostFailed.class,
            "AlertRaised", AlertRaised.class
    );

    private EventCodec() {
    }

    public static List<Class<? extends Event>> allEventTypes() {
        return List.copyOf(TYPES.values());
    }

    public static String toJsonLine(Event event) {
        try {
            return MAPPER.writeValueAsString(new StoredEvent(event.type(), event.timestamp(), event));
        } catch (IOException e) {
            throw new IllegalStateException("Unable to serialize event", e);
        }
    }

    public static Event fromJsonLine(String line) {
        try {
            JsonNode node = MAPPER.readTree(line);
            String type = node.path("type").asText();
            Class<? extends Event> eventClass = TYPES.get(type);
            if (eventClass == null) {
                throw new IllegalArgumentException("Unsupported event type: " + type);
            }
            return MAPPER.treeToValue(node.path("event"), eventClass);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to deserialize event", e);
        }
    }

    public static void subscribeAll(EventBus bus, Consumer<Event> consumer) {
        for (Class<? extends Event> type : TYPES.values()) {
            subscribe(bus, type, consumer);
        }
    }

    private static <T extends Event> void subscribe(EventBus bus, Class<T> type, Consumer<Event> consumer) {
        bus.subscribe(type, consumer::accept);
    }

    private record StoredEvent(String type, Instant timestamp, Event event) {
    }
}
