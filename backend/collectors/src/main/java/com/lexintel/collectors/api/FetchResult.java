package com.lexintel.collectors.api;

import com.lexintel.core.model.RawRecord;

import java.util.List;

public sealed interface FetchResult permits FetchResult.Ok, FetchResult.Err {
    String source();

    boolean success();

    static FetchResult ok(String source, List<RawRecord> records) {
        return new Ok(source, records);
    }

    static FetchResult err(String source, String message) {
        return new Err(source, message);
    }

    record Ok(String source, List<RawRecord> records) implements FetchResult {
        public Ok {
            records = List.copyOf(records);
        }

        @Override
        public boolean success() {
            return true;
        }
    }

    record Err(String source, String message) implements FetchResult {
        @Override
        public boolean success() {
            return false;
        }
    }
}
