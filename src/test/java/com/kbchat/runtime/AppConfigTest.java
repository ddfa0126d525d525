package com.kbchat.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.kbchat.retrieval.RetrievalSettings;
import com.kbchat.sync.SyncSettings;

class AppConfigTest {

    @Test
    void shouldExposeDocumentedDefaults() {
        AppConfig config = new AppConfig();

        SyncSettings sync = config.getSync().toSettings();
        assertEquals(Duration.ofSeconds(60), sync.pollInterval());
        assertEquals(Duration.ofSeconds(5), sync.initialDelay());
        assertEquals(Duration.ofSeconds(300), sync.sourceUptimeThreshold());
        assertEquals(Duration.ofSeconds(300), sync.minRebuildInterval());

        RetrievalSettings retrieval = config.getRetrieval().toSettings();
        assertEquals(5, retrieval.defaultTopK());
        assertEquals(50, retrieval.maxTopK());
        assertEquals(0.65, retrieval.confidenceThreshold(), 1e-9);
        assertEquals(Duration.ofSeconds(30), retrieval.generationTimeout());

        assertEquals(400, config.getGenerator().toSampling().maxTokens());
        assertEquals(1.3, config.getGenerator().toSampling().repeatPenalty(), 1e-9);
        assertEquals("knowledge_entries", config.getKnowledge().getTable());
        assertEquals(384, config.getEncoder().getDimension());
    }

    @Test
    void shouldBindYamlAndIgnoreUnknownKeys() throws Exception {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        AppConfig config = mapper.readValue("""
                index:
                  structurePath: /tmp/kb.kbvi
                sync:
                  enabled: false
                  minRebuildIntervalSeconds: 10
                  somethingNew: true
                generator:
                  provider: extractive
                  stop: ["###"]
                retrieval: null
                unknownSection:
                  a: 1
                """, AppConfig.class);

        assertEquals("/tmp/kb.kbvi", config.getIndex().getStructurePath());
        assertFalse(config.getSync().isEnabled());
        assertEquals(Duration.ofSeconds(10), config.getSync().toSettings().minRebuildInterval());
        assertEquals(60, config.getSync().getPollIntervalSeconds());
        assertEquals("extractive", config.getGenerator().getProvider());
        assertEquals(List.of("###"), config.getGenerator().toSampling().stop());
        assertNotNull(config.getRetrieval());
        assertEquals(5, config.getRetrieval().getDefaultTopK());
    }

    @Test
    void shouldPreferConfiguredSecretsOverEnvironment() {
        Map<String, String> env = Map.of(Secrets.DB_PASSWORD, "from-env");

        assertEquals("from-yaml", Secrets.resolve("from-yaml", Secrets.DB_PASSWORD, env));
        assertEquals("from-env", Secrets.resolve("", Secrets.DB_PASSWORD, env));
        assertEquals("from-env", Secrets.resolve(null, Secrets.DB_PASSWORD, env));
        assertTrue(Secrets.resolve("", Secrets.GENERATOR_API_KEY, env).isEmpty());
    }
}
