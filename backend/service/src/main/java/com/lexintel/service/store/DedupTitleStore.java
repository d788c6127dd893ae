package com.lexintel.service.store;

import java.time.Instant;
import java.util.List;

public interface DedupTitleStore {
    void add(DedupTitle title);

    boolean seenSince(String titleNorm, Instant since);

    List<DedupTitle> seenSince(Instant since);

    int pruneBefore(Instant cutoff);

    record DedupTitle(String titleNorm, String source, Instant seenAt) {
    }
}
