package com.lexintel.service.llm;

import java.util.concurrent.CompletableFuture;

public interface LlmClient {
    CompletableFuture<String> complete(String prompt, String schemaHint);

    String model();

    default LlmClient withModel(String model) {
        return this;
    }

    static LlmClient unavailable(String model) {
        return new LlmClient() {
            @Override
            public CompletableFuture<String> complete(String prompt, String schemaHint) {
                return CompletableFuture.failedFuture(new LlmException("No language model API key configured"));
            }

            @Override
            public String model() {
                return model;
            }

            @Override
            public LlmClient withModel(String other) {
                return unavailable(other);
            }
        };
    }
}
