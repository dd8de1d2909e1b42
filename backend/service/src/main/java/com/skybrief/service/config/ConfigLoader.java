package com.skybrief.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.skybrief.core.model.Domain;
import com.skybrief.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public final class ConfigLoader {
    public static final String SOURCES_FILE = "sources.json";
    public static final String OFFLINE_ENV = "SKYBRIEF_OFFLINE";
    public static final String N2YO_KEY_ENV = "SKYBRIEF_N2YO_API_KEY";

    private ConfigLoader() {
    }

    public static EngineConfig loadSources(Path configDir) {
        return load(configDir.resolve(SOURCES_FILE));
    }

    public static EngineConfig load(Path path) {
        EngineConfig config = read(path, new TypeReference<>() {
        });
        return config == null ? EngineConfig.defaults() : config;
    }

    public static boolean offlineRequested(Map<String, String> env) {
        return "true".equalsIgnoreCase(env.getOrDefault(OFFLINE_ENV, "false").trim());
    }

    // A key in sources.json wins over the environment.
    public static EngineConfig withEnvironment(EngineConfig config, Map<String, String> env) {
        String key = env.get(N2YO_KEY_ENV);
        if (key == null || key.isBlank() || config.apiKeyFor(Domain.ISS_PASSES).isPresent()) {
            return config;
        }
        return config.withApiKey(Domain.ISS_PASSES, key);
    }

    // Validation failures inside record constructors surface as IllegalStateException naming the file too.
    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
