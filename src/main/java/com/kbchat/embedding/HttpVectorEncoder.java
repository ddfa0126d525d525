package com.kbchat.embedding;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbchat.error.DimensionMismatchException;
import com.kbchat.error.EncodingException;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Encoder backed by a remote embedding server. Accepts either an {@code embeddings} array or an
 * OpenAI-style {@code data[].embedding} response body.
 */
public class HttpVectorEncoder implements VectorEncoder {
    private static final Logger log = LoggerFactory.getLogger(HttpVectorEncoder.class);
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;
    private final int batchSize;

    public HttpVectorEncoder(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            int dimension,
            int batchSize) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("encoder endpoint must be set");
        }
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
        this.batchSize = Math.max(1, batchSize);
    }

    @Override
    public float[] encode(String text) {
        return encodeBatch(List.of(text == null ? "" : text)).get(0);
    }

    @Override
    public List<float[]> encodeBatch(List<String> texts) {
        for (String text : texts) {
            if (text == null || text.isBlank()) {
                throw new EncodingException("Cannot encode empty text");
            }
        }
        List<float[]> out = new ArrayList<>(texts.size());
        for (int start = 0; start < texts.size(); start += batchSize) {
            List<String> batch = texts.subList(start, Math.min(texts.size(), start + batchSize));
            out.addAll(requestBatch(batch));
            log.debug("encoder.batch endpoint={} done={} total={}", endpoint, out.size(), texts.size());
        }
        return out;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "http-" + (model == null || model.isBlank() ? "default" : model);
    }

    private List<float[]> requestBatch(List<String> batch) {
        try {
            String payload = model == null || model.isBlank()
                    ? mapper.writeValueAsString(Map.of("input", batch))
                    : mapper.writeValueAsString(Map.of("input", batch, "model", model));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new EncodingException("Embedding server answered HTTP " + response.code());
                }
                return parse(mapper.readTree(body.string()), batch.size());
            }
        } catch (IOException e) {
            throw new EncodingException("Embedding server unavailable at " + endpoint, e);
        }
    }

    private List<float[]> parse(JsonNode root, int expectedCount) {
        List<JsonNode> vectorNodes = new ArrayList<>();
        if (root.path("embeddings").isArray()) {
            root.path("embeddings").forEach(vectorNodes::add);
        } else if (root.path("data").isArray()) {
            root.path("data").forEach(item -> vectorNodes.add(item.path("embedding")));
        }
        if (vectorNodes.size() != expectedCount) {
            throw new EncodingException("Embedding server returned " + vectorNodes.size()
                    + " vectors for " + expectedCount + " texts");
        }
        List<float[]> vectors = new ArrayList<>(expectedCount);
        for (JsonNode node : vectorNodes) {
            if (!node.isArray()) {
                throw new EncodingException("Embedding server returned a malformed vector");
            }
            if (node.size() != dimension) {
                throw new DimensionMismatchException(dimension, node.size());
            }
            float[] vector = new float[node.size()];
            for (int i = 0; i < node.size(); i++) {
                vector[i] = (float) node.get(i).asDouble();
            }
            if (!Vectors.normalizeInPlace(vector)) {
                throw new EncodingException("Embedding server returned a zero vector");
            }
            vectors.add(vector);
        }
        return vectors;
    }
}
