package com.lexintel.collectors.api;

import java.util.concurrent.CompletableFuture;

public interface SourceFetcher {
    String name();

    CompletableFuture<FetchResult> fetch(FetchContext ctx);
}
