package io.chatgate.core.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rejected request body. Carries one or more messages per offending field.
 */
public final class RequestValidationException extends RuntimeException {
    private final Map<String, List<String>> errors;

    public RequestValidationException(Map<String, List<String>> errors) {
        super(firstMessage(errors));
        this.errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public Map<String, List<String>> errors() {
        return errors;
    }

    private static String firstMessage(Map<String, List<String>> errors) {
        return errors.values().stream()
            .flatMap(List::stream)
            .findFirst()
            .orElse("The given data was invalid.");
    }
}
