package com.lexintel.service.publish;

import com.lexintel.core.model.PublishLogEntry;
import com.lexintel.core.model.PublishQueueItem;

public record PublishRequest(String itemId, String title, String body, String variant) {
    public static PublishRequest primary(PublishQueueItem item) {
        return new PublishRequest(item.id(), item.title(), item.body(), PublishLogEntry.PRIMARY);
    }

    public static PublishRequest fallback(PublishQueueItem item) {
        return new PublishRequest(item.id(), item.title(), item.fallbackBody(), PublishLogEntry.FALLBACK);
    }

    public boolean fallbackVariant() {
        return PublishLogEntry.FALLBACK.equals(variant);
    }
}
