package com.lexintel.service.publish;

/**
 * Uniform publish contract for one external platform. Implementations hold no state
 * between calls, never touch queue state, and classify every failure.
 */
public interface PlatformAdapter {
    String platform();

    PublishOutcome publish(PublishRequest request);
}
