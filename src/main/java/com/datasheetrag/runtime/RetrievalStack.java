package com.datasheetrag.runtime;

import java.nio.file.Path;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.embed.EmbeddingProvider;
import com.datasheetrag.embed.TextEncoder;
import com.datasheetrag.embed.TextEncoders;
import com.datasheetrag.ingest.Chunker;
import com.datasheetrag.ingest.IngestionPipeline;
import com.datasheetrag.ingest.PdfTextExtractor;
import com.datasheetrag.ingest.PlainTextExtractor;
import com.datasheetrag.ingest.RetrievalService;
import com.datasheetrag.ingest.TextCleaner;
import com.datasheetrag.store.JsonFileVectorCollection;
import com.datasheetrag.store.VectorCollection;

/**
 * Explicitly constructed services for one storage directory: the embedding provider,
 * the collection bound to it, and the ingestion and retrieval services on top. The
 * owner opens it once and closes it when done; nothing is shared through globals.
 */
public final class RetrievalStack implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalStack.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorCollection collection;
    private final IngestionPipeline ingestionPipeline;
    private final RetrievalService retrievalService;

    private RetrievalStack(EmbeddingProvider embeddingProvider, VectorCollection collection,
            IngestionPipeline ingestionPipeline, RetrievalService retrievalService) {
        this.embeddingProvider = embeddingProvider;
        this.collection = collection;
        this.ingestionPipeline = ingestionPipeline;
        this.retrievalService = retrievalService;
    }

    public static RetrievalStack open(AppConfig config) {
        return open(config, TextEncoders.fromConfig(config.getEmbedding()));
    }

    public static RetrievalStack open(AppConfig config, Supplier<TextEncoder> encoderFactory) {
        AppConfig.StoreConfig store = config.getStore();
        AppConfig.IngestionConfig ingestion = config.getIngestion();
        EmbeddingProvider provider = new EmbeddingProvider(encoderFactory, config.getEmbedding().getBatchSize());
        VectorCollection collection = new JsonFileVectorCollection(
                Path.of(store.getPath()),
                store.getCollectionName(),
                store.getDistanceMetric(),
                provider);
        Chunker chunker = new Chunker(
                ingestion.getMinChunkSize(),
                ingestion.getMaxChunkSize(),
                ingestion.getOverlapSize());
        IngestionPipeline pipeline = new IngestionPipeline(collection, chunker, new TextCleaner(),
                List.of(new PdfTextExtractor(), new PlainTextExtractor()));
        RetrievalService retrieval = new RetrievalService(collection, config.getSearch().getLatencyBudgetMs());
        log.info("Retrieval stack ready: collection={} path={} distance={} provider={}",
                store.getCollectionName(), store.getPath(), store.getDistanceMetric(),
                config.getEmbedding().getProvider());
        return new RetrievalStack(provider, collection, pipeline, retrieval);
    }

    public EmbeddingProvider embeddingProvider() {
        return embeddingProvider;
    }

    public VectorCollection collection() {
        return collection;
    }

    public IngestionPipeline ingestionPipeline() {
        return ingestionPipeline;
    }

    public RetrievalService retrievalService() {
        return retrievalService;
    }

    @Override
    public void close() {
        try {
            collection.close();
        } finally {
            embeddingProvider.close();
        }
    }
}
