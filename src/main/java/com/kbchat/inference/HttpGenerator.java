package com.kbchat.inference;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbchat.error.GenerationException;

import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Completion client for a llama.cpp style server ({@code POST /completion}, {@code GET /health}).
 */
public class HttpGenerator implements Generator {
    private static final Logger log = LoggerFactory.getLogger(HttpGenerator.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl baseUrl;
    private final String apiKey;
    private final SamplingParameters sampling;

    public HttpGenerator(OkHttpClient httpClient, String endpoint, String apiKey, SamplingParameters sampling) {
        HttpUrl parsed = endpoint == null ? null : HttpUrl.parse(endpoint);
        if (parsed == null) {
            throw new IllegalArgumentException("Invalid generator endpoint: " + endpoint);
        }
        this.httpClient = httpClient;
        this.baseUrl = parsed;
        this.apiKey = apiKey;
        this.sampling = sampling;
    }

    /**
     * Checks that the server answers its health endpoint.
     *
     * @throws IOException when it does not
     */
    public void probe() throws IOException {
        Request request = authorized(new Request.Builder().url(resolve("health")).get()).build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("Generator health check answered HTTP " + response.code());
            }
        }
    }

    @Override
    public String generate(String question, String context) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("prompt", PromptTemplate.build(question, context));
        payload.put("n_predict", sampling.maxTokens());
        payload.put("temperature", sampling.temperature());
        payload.put("top_p", sampling.topP());
        payload.put("top_k", sampling.topK());
        payload.put("repeat_penalty", sampling.repeatPenalty());
        payload.put("stop", sampling.stop());
        payload.put("stream", false);

        try {
            Request request = authorized(new Request.Builder()
                    .url(resolve("completion"))
                    .post(RequestBody.create(mapper.writeValueAsString(payload), JSON)))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new GenerationException("Generator answered HTTP " + response.code());
                }
                String text = extractText(mapper.readTree(body.string())).strip();
                if (text.isEmpty()) {
                    throw new GenerationException("Generator returned an empty completion");
                }
                log.debug("generator.completion chars={}", text.length());
                return text;
            }
        } catch (IOException e) {
            throw new GenerationException("Generator call failed: " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "http(" + baseUrl + ")";
    }

    private static String extractText(JsonNode root) {
        if (root.hasNonNull("content")) {
            return root.get("content").asText();
        }
        JsonNode choice = root.path("choices").path(0);
        if (choice.hasNonNull("text")) {
            return choice.get("text").asText();
        }
        throw new GenerationException("Generator response has no completion text");
    }

    private HttpUrl resolve(String segment) {
        return baseUrl.newBuilder().addPathSegment(segment).build();
    }

    private Request.Builder authorized(Request.Builder builder) {
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }
}
