package com.lexintel.service.runtime;

import java.util.Map;

public record CycleResult(String cycle, boolean success, String message, Map<String, Object> stats) {
    public CycleResult {
        stats = stats == null ? Map.of() : Map.copyOf(stats);
    }

    public static CycleResult success(String cycle, String message, Map<String, Object> stats) {
        return new CycleResult(cycle, true, message, stats);
    }

    public static CycleResult failure(String cycle, String message, Map<String, Object> stats) {
        return new CycleResult(cycle, false, message, stats);
    }
}
