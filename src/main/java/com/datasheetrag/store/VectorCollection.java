package com.datasheetrag.store;

import java.util.List;
import java.util.UUID;

import com.datasheetrag.ingest.ChunkMetadata;

/**
 * A named, persisted set of text chunks with their embeddings and metadata.
 *
 * <p>The collection embeds texts itself, on insert and on query, with the encoder it
 * was created with. Records are immutable; re-ingesting a document adds new records.</p>
 */
public interface VectorCollection extends AutoCloseable {

    /**
     * Embeds and stores each text with its metadata under a fresh random UUID.
     *
     * @return the generated ids, in input order
     * @throws com.datasheetrag.error.LengthMismatchException if the list sizes differ
     */
    List<UUID> add(List<String> texts, List<ChunkMetadata> metadata);

    /**
     * Returns up to {@code k} records matching {@code filter}, nearest first. Equal
     * distances keep insertion order.
     */
    List<SearchResult> search(String query, int k, MetadataFilter filter);

    default List<SearchResult> search(String query, int k) {
        return search(query, k, MetadataFilter.none());
    }

    default List<SearchResult> searchByCategory(String query, String category, int k) {
        return search(query, k, MetadataFilter.equalTo("category", category));
    }

    /**
     * Looks records up by id, in the order requested. Unknown ids are skipped.
     */
    List<StoredRecord> get(List<UUID> ids);

    long count();

    CollectionStats stats();

    /**
     * Irreversibly drops every record and the persisted data. The next insert starts a
     * new, empty collection under the same name.
     */
    void deleteCollection();

    String name();

    @Override
    void close();
}
