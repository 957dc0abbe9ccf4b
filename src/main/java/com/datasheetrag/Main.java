package com.datasheetrag;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.ingest.ComponentInfo;
import com.datasheetrag.ingest.DatasheetSource;
import com.datasheetrag.ingest.RetrievalService;
import com.datasheetrag.runtime.AppConfig;
import com.datasheetrag.runtime.RetrievalStack;
import com.datasheetrag.store.CollectionStats;
import com.datasheetrag.store.SearchResult;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "datasheet-rag",
        mixinStandardHelpOptions = true,
        version = "datasheet-rag 0.1.0",
        description = "Ingest component datasheets and search them by meaning.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "stats")
    Mode mode;

    @Option(names = "--store-path", description = "Override the vector store directory from config")
    Path storePath;

    @Option(names = "--file", description = "Datasheet to ingest in ingest mode (PDF or text)")
    Path file;

    @Option(names = "--manifest", description = "YAML or JSON list of {path, component_info} entries for batch mode")
    Path manifest;

    @Option(names = "--mpn", description = "Manufacturer part number of the ingested component")
    String mpn;

    @Option(names = "--manufacturer", description = "Manufacturer of the ingested component")
    String manufacturer;

    @Option(names = "--category", description = "Component category; in search mode restricts results to it")
    String category;

    @Option(names = "--datasheet-url", description = "Where the datasheet was downloaded from")
    String datasheetUrl;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return (defaults to search.defaultTopK)")
    Integer topK;

    enum Mode {
        ingest,
        batch,
        search,
        stats,
        delete
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = AppConfig.load(configPath);
        if (storePath != null) {
            config.getStore().setPath(storePath.toString());
        }
        log.info("Starting datasheet-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);

        try (RetrievalStack stack = RetrievalStack.open(config)) {
            switch (mode) {
                case ingest:
                    return runIngest(stack);
                case batch:
                    return runBatch(stack);
                case search:
                    return runSearch(stack, config);
                case delete:
                    stack.collection().deleteCollection();
                    log.info("Collection {} deleted", stack.collection().name());
                    return 0;
                case stats:
                default:
                    CollectionStats stats = stack.collection().stats();
                    log.info("Collection {} at {}: {} records",
                            stats.collectionName(), stats.storageLocation(), stats.totalRecords());
                    return 0;
            }
        }
    }

    private int runIngest(RetrievalStack stack) throws IOException {
        if (file == null) {
            log.error("--file is required in ingest mode");
            return 2;
        }
        if (!Files.isRegularFile(file)) {
            log.error("Datasheet not found: {}", file);
            return 1;
        }
        ComponentInfo info = new ComponentInfo(mpn, manufacturer, category, null, datasheetUrl, null, null);
        List<UUID> ids = stack.ingestionPipeline().ingestFile(file, info);
        log.info("Ingested {} as {} chunks", file, ids.size());
        return 0;
    }

    private int runBatch(RetrievalStack stack) throws IOException {
        if (manifest == null) {
            log.error("--manifest is required in batch mode");
            return 2;
        }
        List<DatasheetSource> sources = loadManifest(manifest);
        Map<String, List<UUID>> results = stack.ingestionPipeline().batchIngest(sources);
        results.forEach((path, ids) -> log.info("{} -> {} chunks", path, ids.size()));
        long failed = results.values().stream().filter(List::isEmpty).count();
        return failed == 0 ? 0 : 1;
    }

    private int runSearch(RetrievalStack stack, AppConfig config) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in search mode");
            return 2;
        }
        int k = topK == null ? config.getSearch().getDefaultTopK() : topK;
        RetrievalService retrieval = stack.retrievalService();
        List<SearchResult> results = category == null || category.isBlank()
                ? retrieval.search(query, k)
                : retrieval.searchByCategory(query, category, k);
        for (int i = 0; i < results.size(); i++) {
            SearchResult result = results.get(i);
            log.info("Result #{} distance={} category={} citation={}",
                    i + 1,
                    String.format("%.4f", result.distance()),
                    result.metadata().category(),
                    RetrievalService.citationSnippet(result));
        }
        if (results.isEmpty()) {
            log.info("No results for query");
        }
        return 0;
    }

    static List<DatasheetSource> loadManifest(Path path) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        List<DatasheetSource> sources = mapper.readValue(path.toFile(), new TypeReference<List<DatasheetSource>>() {
        });
        return sources == null ? List.of() : sources;
    }
}
