package com.lexintel.service.runtime;

import java.util.Map;

public interface Cycle {
    String name();

    CycleResult run();

    default CycleResult run(Map<String, String> options) {
        return run();
    }
}
