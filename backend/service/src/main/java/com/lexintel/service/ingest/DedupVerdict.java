package com.lexintel.service.ingest;

public enum DedupVerdict {
    ACCEPTED,
    REJECTED_EXACT,
    REJECTED_SEMANTIC
}
