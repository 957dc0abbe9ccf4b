package com.datasheetrag.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.datasheetrag.embed.EmbeddingProvider;
import com.datasheetrag.embed.HashingTextEncoder;
import com.datasheetrag.store.DistanceMetric;
import com.datasheetrag.store.JsonFileVectorCollection;
import com.datasheetrag.store.SearchResult;

class RetrievalServiceTest {

    private static final String[] CATEGORIES = { "microcontroller", "sensor", "power", "memory", "interface" };

    @TempDir
    Path tempDir;

    @Test
    void shouldAnswerQueriesWithinLatencyBudget() {
        try (EmbeddingProvider provider = new EmbeddingProvider(() -> new HashingTextEncoder(384));
                JsonFileVectorCollection collection = new JsonFileVectorCollection(tempDir, "component_datasheets",
                        DistanceMetric.COSINE, provider)) {
            List<String> texts = new ArrayList<>();
            List<ChunkMetadata> metadata = new ArrayList<>();
            for (int i = 0; i < 120; i++) {
                String category = CATEGORIES[i % CATEGORIES.length];
                texts.add("Part P" + i + " is a " + category + " with supply range " + (i % 7) + " V and "
                        + (i * 3) + " mA typical current. Package QFN-" + (16 + i % 5 * 8) + ".");
                metadata.add(ChunkMetadata.builder().mpn("P" + i).category(category).build());
            }
            collection.add(texts, metadata);
            RetrievalService retrieval = new RetrievalService(collection);
            String[] queries = { "low power sensor", "microcontroller with QFN package", "supply range 3 V",
                    "typical current consumption", "memory part" };

            // warm up the encoder before timing
            retrieval.search("warm up", 1);
            List<Long> latencies = new ArrayList<>();
            for (int round = 0; round < 10; round++) {
                for (String query : queries) {
                    long start = System.nanoTime();
                    List<SearchResult> results = retrieval.searchByCategory(query, CATEGORIES[round % 5], 5);
                    latencies.add((System.nanoTime() - start) / 1_000_000);
                    assertFalse(results.isEmpty());
                }
            }
            Collections.sort(latencies);
            long p95 = latencies.get((int) Math.ceil(latencies.size() * 0.95) - 1);
            assertTrue(p95 <= retrieval.latencyBudgetMs(), "p95 latency " + p95 + " ms");
        }
    }

    @Test
    void shouldFilterByCategory() {
        try (EmbeddingProvider provider = new EmbeddingProvider(() -> new HashingTextEncoder(64));
                JsonFileVectorCollection collection = new JsonFileVectorCollection(tempDir, "component_datasheets",
                        DistanceMetric.COSINE, provider)) {
            collection.add(
                    List.of("ESP32 microcontroller", "BME280 humidity sensor", "TMP36 temperature sensor"),
                    List.of(
                            ChunkMetadata.builder().category("microcontroller").build(),
                            ChunkMetadata.builder().category("sensor").build(),
                            ChunkMetadata.builder().category("sensor").build()));
            RetrievalService retrieval = new RetrievalService(collection);

            List<SearchResult> results = retrieval.searchByCategory("sensor", "sensor", 10);

            assertEquals(2, results.size());
            results.forEach(result -> assertEquals("sensor", result.metadata().category()));
        }
    }

    @Test
    void shouldFormatCitationSnippet() {
        ChunkMetadata metadata = ChunkMetadata.builder().mpn("LM317").sourceFile("lm317.pdf").chunkIndex(3).build();
        SearchResult result = new SearchResult(null, "Adjustable\n  regulator  output", metadata, 0.1);

        assertEquals("LM317 (lm317.pdf #3) Adjustable regulator output", RetrievalService.citationSnippet(result));
    }
}
