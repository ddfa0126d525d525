package com.kbchat.runtime;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.inference.ExtractiveGenerator;
import com.kbchat.inference.GeneratorHandle;
import com.kbchat.inference.HttpGenerator;

import okhttp3.OkHttpClient;

/**
 * Decides once, at startup, whether answers can be generated. Any failure to set up the
 * configured generator is logged and turned into {@link GeneratorHandle.Unavailable}.
 */
public final class Generators {
    private static final Logger log = LoggerFactory.getLogger(Generators.class);

    private Generators() {
    }

    public static GeneratorHandle fromConfig(
            AppConfig.GeneratorConfig config,
            OkHttpClient httpClient,
            Map<String, String> environment) {
        String provider = config.getProvider() == null ? "none" : config.getProvider().toLowerCase(Locale.ROOT);
        try {
            GeneratorHandle handle = switch (provider) {
                case "none", "disabled" -> GeneratorHandle.unavailable("disabled");
                case "extractive" -> GeneratorHandle.available(new ExtractiveGenerator(config.getExtractiveMaxSentences()));
                case "http" -> GeneratorHandle.available(httpGenerator(config, httpClient, environment));
                default -> GeneratorHandle.unavailable("unknown provider " + config.getProvider());
            };
            if (handle instanceof GeneratorHandle.Available available) {
                log.info("generator.available generator={}", available.generator().describe());
            } else if (handle instanceof GeneratorHandle.Unavailable unavailable) {
                log.info("generator.unavailable reason={}", unavailable.reason());
            }
            return handle;
        } catch (IOException | RuntimeException e) {
            log.warn("generator.unavailable provider={} reason={}", provider, e.getMessage());
            return GeneratorHandle.unavailable(provider + ": " + e.getMessage());
        }
    }

    private static HttpGenerator httpGenerator(
            AppConfig.GeneratorConfig config,
            OkHttpClient httpClient,
            Map<String, String> environment) throws IOException {
        OkHttpClient client = httpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .readTimeout(Duration.ofMillis(config.getReadTimeoutMs()))
                .build();
        HttpGenerator generator = new HttpGenerator(
                client,
                config.getEndpoint(),
                Secrets.resolve(config.getApiKey(), Secrets.GENERATOR_API_KEY, environment),
                config.toSampling());
        generator.probe();
        return generator;
    }
}
