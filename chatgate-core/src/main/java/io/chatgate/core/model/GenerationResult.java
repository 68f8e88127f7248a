package io.chatgate.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record GenerationResult(String content, String model, Map<String, Object> usage) {
    public GenerationResult {
        content = content == null ? "" : content;
        usage = usage == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(usage));
    }

    public boolean hasUsage() {
        return !usage.isEmpty();
    }
}
