package com.datasheetrag.store;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.datasheetrag.embed.EmbeddingProvider;
import com.datasheetrag.error.EmbeddingMismatchException;
import com.datasheetrag.error.EmptyInputException;
import com.datasheetrag.error.LengthMismatchException;
import com.datasheetrag.error.StoreUnavailableException;
import com.datasheetrag.ingest.ChunkMetadata;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * {@link VectorCollection} kept in memory and persisted as one JSON document per
 * collection under a storage directory.
 *
 * <p>Search is an exact scan over the records that pass the filter, which stays well
 * inside the latency budget for collections of a few thousand chunks.</p>
 *
 * <p>The storage directory is owned by a single process. While open, the collection
 * holds an advisory lock on {@code <name>.lock}; a second opener, in this or another
 * process, gets a {@link StoreUnavailableException}. Threads within the owning process
 * may share one instance.</p>
 */
public class JsonFileVectorCollection implements VectorCollection {
    private static final Logger log = LoggerFactory.getLogger(JsonFileVectorCollection.class);

    private final Path directory;
    private final String name;
    private final EmbeddingProvider embeddingProvider;
    private final ObjectMapper objectMapper = JsonMapper.builder().build();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private DistanceMetric distanceMetric;
    private final List<StoredRecord> records = new ArrayList<>();
    private final Map<UUID, Integer> positions = new HashMap<>();
    private String encoderVersion;
    private int dimension;
    private boolean opened;
    private boolean closed;
    private FileChannel lockChannel;
    private FileLock fileLock;

    public JsonFileVectorCollection(Path directory, String name, DistanceMetric distanceMetric,
            EmbeddingProvider embeddingProvider) {
        if (name == null || !name.matches("[A-Za-z0-9][A-Za-z0-9._-]*")) {
            throw new IllegalArgumentException("Invalid collection name: " + name);
        }
        this.directory = directory;
        this.name = name;
        this.distanceMetric = distanceMetric == null ? DistanceMetric.COSINE : distanceMetric;
        this.embeddingProvider = embeddingProvider;
    }

    @Override
    public List<UUID> add(List<String> texts, List<ChunkMetadata> metadata) {
        if (texts.size() != metadata.size()) {
            throw new LengthMismatchException(texts.size(), metadata.size());
        }
        if (texts.isEmpty()) {
            return List.of();
        }
        for (int i = 0; i < texts.size(); i++) {
            if (texts.get(i) == null || texts.get(i).isBlank()) {
                throw new EmptyInputException("Text at index " + i + " is empty");
            }
        }

        List<Optional<float[]>> embeddings = embeddingProvider.embedMany(texts);
        String version = embeddingProvider.version();
        List<StoredRecord> batch = new ArrayList<>(texts.size());
        List<UUID> ids = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            UUID id = UUID.randomUUID();
            float[] embedding = embeddings.get(i)
                    .orElseThrow(() -> new IllegalStateException("Missing embedding for a non-blank text"));
            ChunkMetadata entryMetadata = metadata.get(i) == null ? ChunkMetadata.empty() : metadata.get(i);
            batch.add(new StoredRecord(id, texts.get(i), embedding, entryMetadata));
            ids.add(id);
        }

        lock.writeLock().lock();
        try {
            ensureOpen();
            checkEncoder(version, batch.get(0).embedding().length);
            boolean fresh = encoderVersion == null;
            if (fresh) {
                encoderVersion = version;
                dimension = batch.get(0).embedding().length;
            }
            int firstPosition = records.size();
            for (StoredRecord record : batch) {
                positions.put(record.id(), records.size());
                records.add(record);
            }
            try {
                persist();
            } catch (StoreUnavailableException e) {
                rollback(firstPosition, batch);
                if (fresh) {
                    encoderVersion = null;
                    dimension = 0;
                }
                throw e;
            }
            log.info("Added {} document chunks to collection {} (total={})", batch.size(), name, records.size());
            return ids;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SearchResult> search(String query, int k, MetadataFilter filter) {
        if (k <= 0) {
            return List.of();
        }
        MetadataFilter effective = filter == null ? MetadataFilter.none() : filter;
        float[] queryEmbedding = embeddingProvider.embedOne(query);
        String version = embeddingProvider.version();

        lock.readLock().lock();
        try {
            ensureOpenForRead();
            if (records.isEmpty()) {
                return List.of();
            }
            checkEncoder(version, queryEmbedding.length);
            List<Scored> scored = new ArrayList<>();
            for (int position = 0; position < records.size(); position++) {
                StoredRecord record = records.get(position);
                if (effective.matches(record.metadata())) {
                    scored.add(new Scored(position, distanceMetric.distance(queryEmbedding, record.embedding())));
                }
            }
            List<SearchResult> results = scored.stream()
                    .sorted(Comparator.comparingDouble(Scored::distance).thenComparingInt(Scored::position))
                    .limit(k)
                    .map(item -> {
                        StoredRecord record = records.get(item.position());
                        return new SearchResult(record.id(), record.text(), record.metadata(), item.distance());
                    })
                    .toList();
            log.debug("Found {} similar chunks in {} (filter={}, k={})", results.size(), name, effective, k);
            return results;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<StoredRecord> get(List<UUID> ids) {
        lock.readLock().lock();
        try {
            ensureOpenForRead();
            List<StoredRecord> found = new ArrayList<>(ids.size());
            for (UUID id : ids) {
                Integer position = positions.get(id);
                if (position != null) {
                    found.add(records.get(position));
                }
            }
            return found;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long count() {
        lock.readLock().lock();
        try {
            ensureOpenForRead();
            return records.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CollectionStats stats() {
        return new CollectionStats(count(), name, directory.toAbsolutePath().normalize().toString());
    }

    @Override
    public void deleteCollection() {
        lock.writeLock().lock();
        try {
            ensureOpen();
            Files.deleteIfExists(dataFile());
            int dropped = records.size();
            records.clear();
            positions.clear();
            encoderVersion = null;
            dimension = 0;
            log.info("Deleted collection {} ({} records)", name, dropped);
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to delete collection " + name, e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String name() {
        return name;
    }

    public DistanceMetric distanceMetric() {
        return distanceMetric;
    }

    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            closed = true;
            releaseFileLock();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void ensureOpenForRead() {
        if (opened && !closed) {
            return;
        }
        // opening mutates state, so upgrade to the write lock
        lock.readLock().unlock();
        lock.writeLock().lock();
        try {
            ensureOpen();
        } finally {
            lock.readLock().lock();
            lock.writeLock().unlock();
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Collection " + name + " is closed");
        }
        if (opened) {
            return;
        }
        try {
            Files.createDirectories(directory);
            acquireFileLock();
            Path dataFile = dataFile();
            if (Files.exists(dataFile)) {
                load(dataFile);
                log.info("Retrieved existing collection {} with {} records from {}", name, records.size(), directory);
            } else {
                log.info("Created new collection {} in {}", name, directory);
            }
            opened = true;
        } catch (IOException e) {
            releaseFileLock();
            throw new StoreUnavailableException("Failed to open collection " + name + " in " + directory, e);
        }
    }

    private void load(Path dataFile) throws IOException {
        CollectionFile file = objectMapper.readValue(dataFile.toFile(), CollectionFile.class);
        if (file.distanceMetric() != null && file.distanceMetric() != distanceMetric) {
            log.warn("Collection {} was created with {} distance, ignoring configured {}",
                    name, file.distanceMetric(), distanceMetric);
            distanceMetric = file.distanceMetric();
        }
        encoderVersion = file.encoderVersion();
        dimension = file.dimension();
        if (file.records() != null) {
            for (StoredRecord record : file.records()) {
                positions.put(record.id(), records.size());
                records.add(record);
            }
        }
    }

    private void persist() {
        Path dataFile = dataFile();
        Path tmp = directory.resolve(name + ".json.tmp");
        CollectionFile file = new CollectionFile(name, encoderVersion, dimension, distanceMetric, records);
        try {
            objectMapper.writeValue(tmp.toFile(), file);
            try {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StoreUnavailableException("Failed to write collection " + name + " to " + dataFile, e);
        }
    }

    private void rollback(int firstPosition, List<StoredRecord> batch) {
        for (StoredRecord record : batch) {
            positions.remove(record.id());
        }
        records.subList(firstPosition, records.size()).clear();
    }

    private void checkEncoder(String version, int vectorDimension) {
        if (encoderVersion == null) {
            return;
        }
        if (!encoderVersion.equals(version) || dimension != vectorDimension) {
            throw new EmbeddingMismatchException(name, encoderVersion + "/" + dimension, version + "/" + vectorDimension);
        }
    }

    private void acquireFileLock() throws IOException {
        if (fileLock != null) {
            return;
        }
        FileChannel channel = FileChannel.open(directory.resolve(name + ".lock"),
                StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        try {
            FileLock acquired = channel.tryLock();
            if (acquired == null) {
                channel.close();
                throw new StoreUnavailableException("Collection " + name + " in " + directory
                        + " is locked by another process");
            }
            lockChannel = channel;
            fileLock = acquired;
        } catch (OverlappingFileLockException e) {
            channel.close();
            throw new StoreUnavailableException("Collection " + name + " in " + directory
                    + " is already open in this process", e);
        }
    }

    private void releaseFileLock() {
        try {
            if (fileLock != null) {
                fileLock.release();
            }
            if (lockChannel != null) {
                lockChannel.close();
            }
        } catch (IOException e) {
            log.warn("Failed to release lock for collection {}", name, e);
        } finally {
            fileLock = null;
            lockChannel = null;
        }
    }

    private Path dataFile() {
        return directory.resolve(name + ".json");
    }

    private record Scored(int position, double distance) {
    }

    record CollectionFile(String name, String encoderVersion, int dimension, DistanceMetric distanceMetric,
            List<StoredRecord> records) {
    }
}
