package com.datasheetrag.ingest;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.store.MetadataFilter;
import com.datasheetrag.store.SearchResult;
import com.datasheetrag.store.VectorCollection;

/**
 * Query side of the datasheet index. Times every search end to end, query embedding
 * included, and warns when a search exceeds the latency budget.
 */
public class RetrievalService {
    private static final Logger log = LoggerFactory.getLogger(RetrievalService.class);
    public static final long DEFAULT_LATENCY_BUDGET_MS = 150;

    private final VectorCollection collection;
    private final long latencyBudgetMs;

    public RetrievalService(VectorCollection collection) {
        this(collection, DEFAULT_LATENCY_BUDGET_MS);
    }

    public RetrievalService(VectorCollection collection, long latencyBudgetMs) {
        this.collection = collection;
        this.latencyBudgetMs = latencyBudgetMs;
    }

    public List<SearchResult> search(String query, int topK) {
        return search(query, topK, MetadataFilter.none());
    }

    public List<SearchResult> searchByCategory(String query, String category, int topK) {
        return search(query, topK, MetadataFilter.equalTo("category", category));
    }

    public List<SearchResult> search(String query, int topK, MetadataFilter filter) {
        long start = System.nanoTime();
        List<SearchResult> results = collection.search(query, topK, filter);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (elapsedMs > latencyBudgetMs) {
            log.warn("Search exceeded latency budget: {} ms > {} ms (collection={}, filter={}, topK={})",
                    elapsedMs, latencyBudgetMs, collection.name(), filter, topK);
        } else {
            log.debug("search.telemetry collection={} filter={} topK={} results={} latencyMs={}",
                    collection.name(), filter, topK, results.size(), elapsedMs);
        }
        return results;
    }

    /**
     * Single line citation for a result, e.g. {@code ESP32-WROOM-32 (esp32.pdf #3) WiFi module...}.
     */
    public static String citationSnippet(SearchResult result) {
        String trimmed = result.text().strip();
        if (trimmed.length() > 240) {
            trimmed = trimmed.substring(0, 240) + "...";
        }
        ChunkMetadata metadata = result.metadata();
        return "%s (%s #%s) %s".formatted(
                metadata.get("mpn").orElse(ComponentInfo.UNKNOWN),
                metadata.get("source_file").orElse("text"),
                metadata.get("chunk_index").orElse("?"),
                trimmed.replaceAll("\\s+", " "));
    }

    public long latencyBudgetMs() {
        return latencyBudgetMs;
    }
}
