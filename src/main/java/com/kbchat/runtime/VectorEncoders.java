package com.kbchat.runtime;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kbchat.embedding.HashingVectorEncoder;
import com.kbchat.embedding.HttpVectorEncoder;
import com.kbchat.embedding.VectorEncoder;

import okhttp3.OkHttpClient;

public final class VectorEncoders {
    private static final Logger log = LoggerFactory.getLogger(VectorEncoders.class);

    private VectorEncoders() {
    }

    public static VectorEncoder fromConfig(
            AppConfig.EncoderConfig config,
            OkHttpClient httpClient,
            Map<String, String> environment) {
        String provider = config.getProvider() == null ? "hashing" : config.getProvider().toLowerCase(Locale.ROOT);
        VectorEncoder encoder = switch (provider) {
            case "hashing" -> new HashingVectorEncoder(config.getDimension());
            case "http" -> new HttpVectorEncoder(
                    httpClient.newBuilder().callTimeout(Duration.ofMillis(config.getTimeoutMs())).build(),
                    config.getEndpoint(),
                    config.getModel(),
                    Secrets.resolve(config.getApiKey(), Secrets.ENCODER_API_KEY, environment),
                    config.getDimension(),
                    config.getBatchSize());
            default -> throw new IllegalArgumentException("Unknown encoder provider: " + config.getProvider());
        };
        log.info("encoder.selected provider={} dimension={} version={}", provider, encoder.dimension(), encoder.version());
        return encoder;
    }
}
