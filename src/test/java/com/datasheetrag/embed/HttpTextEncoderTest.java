package com.datasheetrag.embed;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.datasheetrag.error.EncoderUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;

class HttpTextEncoderTest {

    private MockWebServer server;
    private HttpTextEncoder encoder;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        encoder = new HttpTextEncoder(new OkHttpClient(), server.url("/v1/embeddings").toString(),
                "all-MiniLM-L6-v2", "secret", 3);
    }

    @AfterEach
    void tearDown() throws IOException {
        encoder.close();
        server.shutdown();
    }

    @Test
    void shouldParseOpenAiStyleResponse() throws Exception {
        server.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"data\":[{\"embedding\":[0.1,0.2,0.3]},{\"embedding\":[1,0,0]}]}"));

        List<float[]> vectors = encoder.encode(List.of("first", "second"));

        assertEquals(2, vectors.size());
        assertArrayEquals(new float[] { 0.1f, 0.2f, 0.3f }, vectors.get(0));
        assertArrayEquals(new float[] { 1f, 0f, 0f }, vectors.get(1));

        RecordedRequest request = server.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("Bearer secret", request.getHeader("Authorization"));
        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertEquals("all-MiniLM-L6-v2", body.path("model").asText());
        assertEquals("second", body.path("input").get(1).asText());
    }

    @Test
    void shouldParsePlainEmbeddingsResponse() {
        server.enqueue(new MockResponse().setBody("{\"embeddings\":[[0.5,0.5,0.5]]}"));

        List<float[]> vectors = encoder.encode(List.of("only"));

        assertArrayEquals(new float[] { 0.5f, 0.5f, 0.5f }, vectors.get(0));
    }

    @Test
    void shouldFailOnServerError() {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("overloaded"));

        EncoderUnavailableException error = assertThrows(EncoderUnavailableException.class,
                () -> encoder.encode(List.of("text")));
        assertTrue(error.getMessage().contains("503"));
    }

    @Test
    void shouldFailOnUnexpectedDimension() {
        server.enqueue(new MockResponse().setBody("{\"embeddings\":[[0.5,0.5]]}"));

        assertThrows(EncoderUnavailableException.class, () -> encoder.encode(List.of("text")));
    }

    @Test
    void shouldFailOnVectorCountMismatch() {
        server.enqueue(new MockResponse().setBody("{\"embeddings\":[[0.5,0.5,0.5]]}"));

        assertThrows(EncoderUnavailableException.class, () -> encoder.encode(List.of("a", "b")));
    }

    @Test
    void shouldFailOnMalformedBody() {
        server.enqueue(new MockResponse().setBody("not json"));

        assertThrows(EncoderUnavailableException.class, () -> encoder.encode(List.of("text")));
    }

    @Test
    void shouldSurfaceFailureThroughProvider() {
        server.enqueue(new MockResponse().setResponseCode(500));
        EmbeddingProvider provider = new EmbeddingProvider(() -> encoder);

        assertThrows(EncoderUnavailableException.class, () -> provider.embedOne("query"));
    }
}
