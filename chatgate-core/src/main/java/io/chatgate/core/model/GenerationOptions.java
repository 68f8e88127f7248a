package io.chatgate.core.model;

import java.util.Map;

/**
 * Sampling knobs passed through to the provider.
 */
public record GenerationOptions(double temperature, int maxTokens) {
    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 1000;

    public GenerationOptions {
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0 and 2");
        }
        if (maxTokens < 1 || maxTokens > 4000) {
            throw new IllegalArgumentException("max_tokens must be between 1 and 4000");
        }
    }

    public static GenerationOptions defaults() {
        return new GenerationOptions(DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS);
    }

    /**
     * Reads {@code temperature} and {@code max_tokens} (or {@code maxTokens}); other keys are ignored.
     */
    public static GenerationOptions fromMap(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return defaults();
        }
        double temperature = asDouble(raw.get("temperature"), DEFAULT_TEMPERATURE);
        Object tokens = raw.containsKey("max_tokens") ? raw.get("max_tokens") : raw.get("maxTokens");
        int maxTokens = asInt(tokens, DEFAULT_MAX_TOKENS);
        return new GenerationOptions(temperature, maxTokens);
    }

    private static double asDouble(Object value, double fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("temperature must be numeric", e);
        }
    }

    private static int asInt(Object value, int fallback) {
        if (value == null) {
            return fallback;
        }
        if (value instanceof Number number) {
            double raw = number.doubleValue();
            if (raw != Math.rint(raw)) {
                throw new IllegalArgumentException("max_tokens must be an integer");
            }
            if (raw < Integer.MIN_VALUE || raw > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("max_tokens must be between 1 and 4000");
            }
            return number.intValue();
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("max_tokens must be an integer", e);
        }
    }
}
