package com.datasheetrag.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.error.SourceUnreadableException;
import com.datasheetrag.store.VectorCollection;

/**
 * Turns datasheet text into stored, searchable chunks: clean, chunk, attach
 * provenance and content hash, then insert everything with one collection call.
 *
 * <p>The pipeline never skips a document it has seen before. Callers that want to
 * avoid duplicates compare the {@code file_hash} of stored chunks before ingesting.</p>
 */
public class IngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final VectorCollection collection;
    private final Chunker chunker;
    private final TextCleaner cleaner;
    private final List<TextExtractor> extractors;

    public IngestionPipeline(VectorCollection collection) {
        this(collection, new Chunker(), new TextCleaner(), defaultExtractors());
    }

    public IngestionPipeline(VectorCollection collection, Chunker chunker, TextCleaner cleaner,
            List<TextExtractor> extractors) {
        this.collection = collection;
        this.chunker = chunker;
        this.cleaner = cleaner;
        this.extractors = List.copyOf(extractors);
    }

    public List<UUID> ingest(String rawText, ComponentInfo componentInfo) {
        if (rawText == null || rawText.isBlank()) {
            return List.of();
        }
        ChunkMetadata source = componentInfo(componentInfo).toSourceMetadata()
                .withSource(null, null, ContentHasher.hashText(rawText));
        return store(rawText, source, "text of " + source.mpn());
    }

    /**
     * Extracts text from the file and ingests it. The file's own bytes are hashed, and
     * its name and path are recorded on every chunk.
     */
    public List<UUID> ingestFile(Path path, ComponentInfo componentInfo) throws IOException {
        TextExtractor extractor = extractorFor(path);
        String rawText = extractor.extract(path);
        if (rawText == null || rawText.isBlank()) {
            log.warn("No text extracted from {}", path);
            return List.of();
        }
        Path fileName = path.getFileName();
        ChunkMetadata source = componentInfo(componentInfo).toSourceMetadata()
                .withSource(fileName == null ? path.toString() : fileName.toString(), path.toString(),
                        ContentHasher.hashFile(path));
        List<UUID> ids = store(rawText, source, path.toString());
        log.info("Successfully ingested datasheet {} with {} chunks", path, ids.size());
        return ids;
    }

    /**
     * Ingests every source independently. A source that is missing, unreadable or fails
     * to ingest maps to an empty list; the remaining sources are still processed.
     */
    public Map<String, List<UUID>> batchIngest(List<DatasheetSource> sources) {
        Map<String, List<UUID>> results = new LinkedHashMap<>();
        int failed = 0;
        for (DatasheetSource source : sources) {
            String key = source.path();
            try {
                Path path = checkReadable(source);
                results.put(key, ingestFile(path, source.componentInfo()));
            } catch (SourceUnreadableException e) {
                log.error("Datasheet not found or unreadable: {}", e.getMessage());
                results.put(key, List.of());
                failed++;
            } catch (IOException | RuntimeException e) {
                log.error("Failed to ingest {}", key, e);
                results.put(key, List.of());
                failed++;
            }
        }
        log.info("Batch ingestion finished: {} sources, {} failed", sources.size(), failed);
        return results;
    }

    private List<UUID> store(String rawText, ChunkMetadata source, String label) {
        String cleaned = cleaner.clean(rawText);
        List<TextChunk> chunks = chunker.chunk(cleaned, source);
        if (chunks.isEmpty()) {
            log.warn("No chunks created from {}", label);
            return List.of();
        }
        List<String> texts = new ArrayList<>(chunks.size());
        List<ChunkMetadata> metadata = new ArrayList<>(chunks.size());
        for (TextChunk chunk : chunks) {
            texts.add(chunk.text());
            metadata.add(chunk.metadata());
        }
        log.debug("Chunked {} into {} chunks ({} cleaned characters)", label, chunks.size(), cleaned.length());
        return collection.add(texts, metadata);
    }

    private Path checkReadable(DatasheetSource source) throws SourceUnreadableException {
        if (source.path() == null || source.path().isBlank()) {
            throw new SourceUnreadableException(Path.of(""), "no path configured");
        }
        Path path;
        try {
            path = source.file();
        } catch (RuntimeException e) {
            throw new SourceUnreadableException(Path.of(""), e);
        }
        if (!Files.isRegularFile(path)) {
            throw new SourceUnreadableException(path, "file does not exist");
        }
        if (!Files.isReadable(path)) {
            throw new SourceUnreadableException(path, "file is not readable");
        }
        return path;
    }

    private TextExtractor extractorFor(Path path) throws IOException {
        for (TextExtractor extractor : extractors) {
            if (extractor.supports(path)) {
                return extractor;
            }
        }
        throw new IOException("No text extractor supports " + path);
    }

    private static ComponentInfo componentInfo(ComponentInfo componentInfo) {
        return componentInfo == null ? new ComponentInfo(null, null, null, null, null, null, null) : componentInfo;
    }

    private static List<TextExtractor> defaultExtractors() {
        List<TextExtractor> all = new ArrayList<>();
        all.add(new PdfTextExtractor());
        all.add(new PlainTextExtractor());
        return all;
    }
}
