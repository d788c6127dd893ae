package com.lexintel.service.publish;

import java.time.Duration;

public sealed interface PublishOutcome permits PublishOutcome.Published, PublishOutcome.Failed {
    static PublishOutcome published(String platformId) {
        return new Published(platformId);
    }

    static Failed transientFailure(String message) {
        return new Failed(FailureKind.TRANSIENT, message, null);
    }

    static Failed transientFailure(String message, Duration retryAfter) {
        return new Failed(FailureKind.TRANSIENT, message, retryAfter);
    }

    static Failed authFailure(String message) {
        return new Failed(FailureKind.AUTH, message, null);
    }

    static Failed contentRejected(String message) {
        return new Failed(FailureKind.CONTENT, message, null);
    }

    static Failed unconfirmed(String message) {
        return new Failed(FailureKind.UNCONFIRMED, message, null);
    }

    record Published(String platformId) implements PublishOutcome {
    }

    record Failed(FailureKind kind, String message, Duration retryAfter) implements PublishOutcome {
        public boolean retryable() {
            return kind == FailureKind.TRANSIENT;
        }
    }

    enum FailureKind {
        TRANSIENT,
        AUTH,
        // Payload or content policy rejection. The simpler fallback body may still pass.
        CONTENT,
        // Accepted with 2xx but no usable post id. Resending could duplicate the post.
        UNCONFIRMED
    }
}
