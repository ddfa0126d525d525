package com.kbchat.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.kbchat.embedding.HashingVectorEncoder;
import com.kbchat.inference.ExtractiveGenerator;
import com.kbchat.inference.GeneratorHandle;
import com.kbchat.inference.HttpGenerator;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;

class GeneratorsTest {

    private final OkHttpClient httpClient = new OkHttpClient();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldBeUnavailableWhenDisabled() {
        AppConfig.GeneratorConfig config = new AppConfig.GeneratorConfig();
        config.setProvider("none");

        GeneratorHandle handle = Generators.fromConfig(config, httpClient, Map.of());

        assertEquals(new GeneratorHandle.Unavailable("disabled"), handle);
    }

    @Test
    void shouldBuildExtractiveGenerator() {
        AppConfig.GeneratorConfig config = new AppConfig.GeneratorConfig();
        config.setProvider("extractive");

        GeneratorHandle handle = Generators.fromConfig(config, httpClient, Map.of());

        assertInstanceOf(ExtractiveGenerator.class, ((GeneratorHandle.Available) handle).generator());
    }

    @Test
    void shouldBuildHttpGeneratorWhenHealthCheckPasses() {
        server.enqueue(new MockResponse().setBody("{\"status\":\"ok\"}"));
        AppConfig.GeneratorConfig config = new AppConfig.GeneratorConfig();
        config.setEndpoint(server.url("/").toString());

        GeneratorHandle handle = Generators.fromConfig(config, httpClient, Map.of());

        assertTrue(handle.isAvailable());
        assertInstanceOf(HttpGenerator.class, ((GeneratorHandle.Available) handle).generator());
    }

    @Test
    void shouldTurnSetupFailuresIntoUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(503));
        AppConfig.GeneratorConfig unhealthy = new AppConfig.GeneratorConfig();
        unhealthy.setEndpoint(server.url("/").toString());
        assertFalse(Generators.fromConfig(unhealthy, httpClient, Map.of()).isAvailable());

        AppConfig.GeneratorConfig invalid = new AppConfig.GeneratorConfig();
        invalid.setEndpoint("not a url");
        assertFalse(Generators.fromConfig(invalid, httpClient, Map.of()).isAvailable());

        AppConfig.GeneratorConfig unknown = new AppConfig.GeneratorConfig();
        unknown.setProvider("quantum");
        assertFalse(Generators.fromConfig(unknown, httpClient, Map.of()).isAvailable());
    }

    @Test
    void shouldSelectEncoderByProvider() {
        AppConfig.EncoderConfig hashing = new AppConfig.EncoderConfig();
        hashing.setDimension(64);
        assertInstanceOf(HashingVectorEncoder.class, VectorEncoders.fromConfig(hashing, httpClient, Map.of()));

        AppConfig.EncoderConfig http = new AppConfig.EncoderConfig();
        http.setProvider("http");
        http.setEndpoint(server.url("/embed").toString());
        assertEquals("http-all-MiniLM-L6-v2", VectorEncoders.fromConfig(http, httpClient, Map.of()).version());
    }
}
