package io.chatgate.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("CHATGATE_CONFIG");
        if (override != null && !override.isBlank()) {
            return expand(override.trim());
        }
        return Path.of(System.getProperty("user.home"), ".chatgate", "config.json");
    }

    public static Path expand(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".chatgate");
        }
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
