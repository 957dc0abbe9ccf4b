package com.datasheetrag.store;

import java.util.UUID;

import com.datasheetrag.ingest.ChunkMetadata;

/**
 * An immutable stored chunk. The embedding is copied on the way in and on the way out.
 */
public record StoredRecord(UUID id, String text, float[] embedding, ChunkMetadata metadata) {

    public StoredRecord {
        embedding = embedding == null ? null : embedding.clone();
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }
}
