package com.agentorchestra.orchestrator.capability.input;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class InputMaps {

    private InputMaps() {}

    /** Unmodifiable ordered copy; null becomes an empty object. */
    static Map<String, Object> frozen(Map<String, Object> map) {
        return Collections.unmodifiableMap(map == null ? new LinkedHashMap<>() : new LinkedHashMap<>(map));
    }
}
