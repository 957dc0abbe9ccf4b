package com.datasheetrag.embed;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.error.EncoderUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Encoder backed by a remote embedding endpoint.
 *
 * <p>Posts {@code {"model": ..., "input": [...]}} and accepts either an OpenAI style
 * {@code {"data": [{"embedding": [...]}]}} body or a plain {@code {"embeddings": [[...]]}}
 * body. Any transport or format problem is raised as {@link EncoderUnavailableException}.</p>
 */
public class HttpTextEncoder implements TextEncoder {
    private static final Logger log = LoggerFactory.getLogger(HttpTextEncoder.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final int dimension;

    public HttpTextEncoder(OkHttpClient httpClient, String endpoint, String model, String apiKey, int dimension) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalArgumentException("endpoint must not be blank");
        }
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public List<float[]> encode(List<String> texts) {
        if (texts.isEmpty()) {
            throw new IllegalArgumentException("No texts to encode");
        }
        Request request = buildRequest(texts);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new EncoderUnavailableException("Embedding endpoint " + endpoint
                        + " answered with status " + response.code());
            }
            List<float[]> vectors = parse(mapper.readTree(body.string()));
            if (vectors.size() != texts.size()) {
                throw new EncoderUnavailableException("Embedding endpoint returned " + vectors.size()
                        + " vectors for " + texts.size() + " texts");
            }
            log.debug("Encoded {} texts via {}", texts.size(), endpoint);
            return vectors;
        } catch (IOException e) {
            throw new EncoderUnavailableException("Embedding request to " + endpoint + " failed", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "http-" + (model == null || model.isBlank() ? "default" : model) + "-" + dimension;
    }

    @Override
    public void close() {
        httpClient.connectionPool().evictAll();
    }

    private Request buildRequest(List<String> texts) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (model != null && !model.isBlank()) {
            payload.put("model", model);
        }
        payload.put("input", texts);
        String json;
        try {
            json = mapper.writeValueAsString(payload);
        } catch (IOException e) {
            throw new EncoderUnavailableException("Unable to serialize embedding request", e);
        }
        Request.Builder requestBuilder = new Request.Builder()
                .url(endpoint)
                .post(RequestBody.create(json, JSON));
        if (apiKey != null && !apiKey.isBlank()) {
            requestBuilder.header("Authorization", "Bearer " + apiKey);
        }
        return requestBuilder.build();
    }

    private List<float[]> parse(JsonNode root) {
        List<float[]> vectors = new ArrayList<>();
        JsonNode data = root.path("data");
        if (data.isArray()) {
            for (JsonNode item : data) {
                vectors.add(toVector(item.path("embedding")));
            }
            return vectors;
        }
        JsonNode embeddings = root.path("embeddings");
        if (embeddings.isArray()) {
            for (JsonNode item : embeddings) {
                vectors.add(toVector(item));
            }
            return vectors;
        }
        throw new EncoderUnavailableException("Embedding response from " + endpoint + " has no vectors");
    }

    private float[] toVector(JsonNode vectorNode) {
        if (!vectorNode.isArray()) {
            throw new EncoderUnavailableException("Embedding response from " + endpoint + " is malformed");
        }
        if (vectorNode.size() != dimension) {
            throw new EncoderUnavailableException("Expected " + dimension + "-dimensional vectors, got "
                    + vectorNode.size());
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
