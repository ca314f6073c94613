package io.ragent.core.config;

import java.nio.file.Path;

public final class ConfigPaths {

    private ConfigPaths() {
    }

    public static Path defaultConfigPath() {
        String override = System.getenv("RAGENT_CONFIG");
        if (override != null && !override.isBlank()) {
            return resolve(override);
        }
        return Path.of(System.getProperty("user.home"), ".ragent", "config.json");
    }

    public static Path resolve(String rawPath) {
        if (rawPath.startsWith("~/")) {
            return Path.of(System.getProperty("user.home")).resolve(rawPath.substring(2));
        }
        return Path.of(rawPath);
    }
}
