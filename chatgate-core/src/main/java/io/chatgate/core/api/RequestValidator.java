package io.chatgate.core.api;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects field errors while a request body is read, then fails once with all of them.
 */
final class RequestValidator {
    private final JsonNode body;
    private final Map<String, List<String>> errors = new LinkedHashMap<>();

    RequestValidator(JsonNode body) {
        this.body = body;
    }

    String requiredString(String field, int maxLength) {
        String value = optionalString(field, maxLength);
        if (value == null && !errors.containsKey(field)) {
            reject(field, "The " + label(field) + " field is required.");
        }
        return value;
    }

    String optionalString(String field, int maxLength) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            reject(field, "The " + label(field) + " field must be a string.");
            return null;
        }
        String value = node.asText();
        if (value.isBlank()) {
            return null;
        }
        if (maxLength > 0 && value.length() > maxLength) {
            reject(field, "The " + label(field) + " field must not be greater than " + maxLength + " characters.");
            return null;
        }
        return value;
    }

    boolean optionalBoolean(String field, boolean fallback) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isTextual()) {
            String raw = node.asText().trim().toLowerCase();
            if (raw.equals("true") || raw.equals("1")) {
                return true;
            }
            if (raw.equals("false") || raw.equals("0")) {
                return false;
            }
        }
        if (node.isInt() && (node.intValue() == 0 || node.intValue() == 1)) {
            return node.intValue() == 1;
        }
        reject(field, "The " + label(field) + " field must be true or false.");
        return fallback;
    }

    List<String> optionalStringArray(String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            reject(field, "The " + label(field) + " field must be an array.");
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            if (!item.isTextual()) {
                reject(field, "Each " + label(field) + " entry must be a string.");
                return List.of();
            }
            values.add(item.asText());
        }
        return values;
    }

    JsonNode optionalObject(String field) {
        JsonNode node = body.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            reject(field, "The " + label(field) + " field must be an object.");
            return null;
        }
        return node;
    }

    void reject(String field, String message) {
        errors.computeIfAbsent(field, ignored -> new ArrayList<>()).add(message);
    }

    void throwIfInvalid() {
        if (!errors.isEmpty()) {
            throw new RequestValidationException(errors);
        }
    }

    private static String label(String field) {
        return field.replace('_', ' ');
    }
}
