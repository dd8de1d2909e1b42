package com.skybrief.service.config;

import com.skybrief.core.model.Domain;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsSourceSettings() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-");
        Files.writeString(dir.resolve("sources.json"), """
                {
                  "requestTimeout": "PT3S",
                  "domainTimeout": "PT6S",
                  "workerThreads": 4,
                  "sources": {
                    "moon": {"liveEnabled": false},
                    "planets": {"timeout": "PT2S", "endpoint": "https://planets.example.test/v3"}
                  }
                }
                """);

        EngineConfig config = ConfigLoader.loadSources(dir);

        assertEquals(4, config.workerThreads());
        assertFalse(config.liveEnabled(Domain.MOON));
        assertTrue(config.liveEnabled(Domain.SUN));
        assertEquals(Duration.ofSeconds(2), config.timeoutFor(Domain.PLANETS));
        assertEquals(Duration.ofSeconds(2), config.requestTimeoutFor(Domain.PLANETS));
        assertEquals(Duration.ofSeconds(6), config.timeoutFor(Domain.SUN));
        assertEquals(Duration.ofSeconds(3), config.requestTimeoutFor(Domain.SUN));
        assertEquals(URI.create("https://planets.example.test/v3"), config.endpointFor(Domain.PLANETS).orElseThrow());
        assertTrue(config.endpointFor(Domain.MOON).isEmpty());
    }

    @Test
    void missingOrInvalidConfigFailsFastWithPathInMessage() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-invalid-");

        IllegalStateException missing = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(dir));
        assertTrue(missing.getMessage().contains("sources.json"));

        Files.writeString(dir.resolve("sources.json"), "{not-json");
        IllegalStateException invalid = assertThrows(IllegalStateException.class, () -> ConfigLoader.loadSources(dir));
        assertTrue(invalid.getMessage().contains("sources.json"));
    }

    @Test
    void unknownSourceOrBadTimeoutNamesTheFile() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-values-");
        Path unknown = dir.resolve("unknown.json");
        Files.writeString(unknown, """
                {"sources": {"iss": {"liveEnabled": true}}}
                """);
        Path negative = dir.resolve("negative.json");
        Files.writeString(negative, """
                {"sources": {"moon": {"timeout": "PT-1S"}}}
                """);

        IllegalStateException unknownError = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(unknown));
        assertTrue(unknownError.getMessage().contains("unknown.json"));
        IllegalStateException negativeError = assertThrows(IllegalStateException.class, () -> ConfigLoader.load(negative));
        assertTrue(negativeError.getMessage().contains("negative.json"));
    }

    @Test
    void offlineDisablesEveryLiveSource() {
        EngineConfig config = new EngineConfig(null, null, null, Map.of(
                "moon", new SourceSettings(true, Duration.ofSeconds(1), URI.create("https://moon.example.test"), null)
        )).offline();

        for (Domain domain : Domain.values()) {
            assertFalse(config.liveEnabled(domain), domain.key());
        }
        assertEquals(Duration.ofSeconds(1), config.timeoutFor(Domain.MOON));
        assertEquals(EngineConfig.DEFAULT_WORKER_THREADS, config.workerThreads());
    }

    @Test
    void offlineCanBeRequestedThroughEnvironment() {
        assertTrue(ConfigLoader.offlineRequested(Map.of("SKYBRIEF_OFFLINE", "true")));
        assertTrue(ConfigLoader.offlineRequested(Map.of("SKYBRIEF_OFFLINE", " TRUE ")));
        assertFalse(ConfigLoader.offlineRequested(Map.of("SKYBRIEF_OFFLINE", "no")));
        assertFalse(ConfigLoader.offlineRequested(Map.of()));
    }

    @Test
    void issApiKeyComesFromTheFileBeforeTheEnvironment() throws Exception {
        Path dir = Files.createTempDirectory("config-loader-keys-");
        Path file = dir.resolve("sources.json");
        Files.writeString(file, """
                {"sources": {"iss_passes": {"apiKey": " file-key "}}}
                """);
        Map<String, String> env = Map.of(ConfigLoader.N2YO_KEY_ENV, "env-key");

        EngineConfig fromFile = ConfigLoader.withEnvironment(ConfigLoader.load(file), env);
        EngineConfig fromEnv = ConfigLoader.withEnvironment(EngineConfig.defaults(), env);
        EngineConfig none = ConfigLoader.withEnvironment(EngineConfig.defaults(), Map.of(ConfigLoader.N2YO_KEY_ENV, "  "));

        assertEquals("file-key", fromFile.apiKeyFor(Domain.ISS_PASSES).orElseThrow());
        assertEquals("env-key", fromEnv.apiKeyFor(Domain.ISS_PASSES).orElseThrow());
        assertTrue(none.apiKeyFor(Domain.ISS_PASSES).isEmpty());
        assertFalse(fromEnv.settingsFor(Domain.ISS_PASSES).toString().contains("env-key"));
        assertEquals("env-key", fromEnv.offline().apiKeyFor(Domain.ISS_PASSES).orElseThrow());
    }

    @Test
    void defaultsApplyWithoutAFile() {
        EngineConfig config = EngineConfig.defaults();

        assertEquals(EngineConfig.DEFAULT_REQUEST_TIMEOUT, config.requestTimeout());
        assertEquals(EngineConfig.DEFAULT_DOMAIN_TIMEOUT, config.timeoutFor(Domain.WEATHER));
        assertTrue(config.liveEnabled(Domain.SPACE_WEATHER));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(Duration.ZERO, null, null, null));
        assertThrows(IllegalArgumentException.class, () -> new EngineConfig(null, null, 0, null));
    }
}
