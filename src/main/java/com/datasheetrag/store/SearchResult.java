package com.datasheetrag.store;

import java.util.UUID;

import com.datasheetrag.ingest.ChunkMetadata;

public record SearchResult(UUID id, String text, ChunkMetadata metadata, double distance) {
}
