package com.datasheetrag.ingest;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Provenance of a stored chunk: the known datasheet fields, the chunk position
 * within its source text, and an open map for any other keys a caller attaches.
 *
 * <p>Field names in {@link #get(String)} and in the persisted JSON use the snake case
 * keys ({@code category}, {@code source_file}, {@code chunk_start}, ...). Keys that are
 * not known fields are looked up in {@link #extra()}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChunkMetadata(
        @JsonProperty("mpn") String mpn,
        @JsonProperty("manufacturer") String manufacturer,
        @JsonProperty("category") String category,
        @JsonProperty("description") String description,
        @JsonProperty("datasheet_url") String datasheetUrl,
        @JsonProperty("ingestion_timestamp") String ingestionTimestamp,
        @JsonProperty("source_file") String sourceFile,
        @JsonProperty("source_path") String sourcePath,
        @JsonProperty("file_hash") String fileHash,
        @JsonProperty("chunk_index") Integer chunkIndex,
        @JsonProperty("chunk_start") Integer chunkStart,
        @JsonProperty("chunk_end") Integer chunkEnd,
        @JsonProperty("chunk_length") Integer chunkLength,
        @JsonProperty("total_text_length") Integer totalTextLength,
        @JsonProperty("extra") Map<String, String> extra) {

    public ChunkMetadata {
        extra = copyExtra(extra);
    }

    public static ChunkMetadata empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        switch (key) {
            case "mpn":
                return Optional.ofNullable(mpn);
            case "manufacturer":
                return Optional.ofNullable(manufacturer);
            case "category":
                return Optional.ofNullable(category);
            case "description":
                return Optional.ofNullable(description);
            case "datasheet_url":
                return Optional.ofNullable(datasheetUrl);
            case "ingestion_timestamp":
                return Optional.ofNullable(ingestionTimestamp);
            case "source_file":
                return Optional.ofNullable(sourceFile);
            case "source_path":
                return Optional.ofNullable(sourcePath);
            case "file_hash":
                return Optional.ofNullable(fileHash);
            case "chunk_index":
                return Optional.ofNullable(chunkIndex).map(String::valueOf);
            case "chunk_start":
                return Optional.ofNullable(chunkStart).map(String::valueOf);
            case "chunk_end":
                return Optional.ofNullable(chunkEnd).map(String::valueOf);
            case "chunk_length":
                return Optional.ofNullable(chunkLength).map(String::valueOf);
            case "total_text_length":
                return Optional.ofNullable(totalTextLength).map(String::valueOf);
            default:
                return Optional.ofNullable(extra.get(key));
        }
    }

    public ChunkMetadata withChunk(int index, int start, int end, int length, int totalLength) {
        return toBuilder()
                .chunkIndex(index)
                .chunkStart(start)
                .chunkEnd(end)
                .chunkLength(length)
                .totalTextLength(totalLength)
                .build();
    }

    public ChunkMetadata withSource(String file, String path, String hash) {
        return toBuilder()
                .sourceFile(file)
                .sourcePath(path)
                .fileHash(hash)
                .build();
    }

    /**
     * Flattens known fields and extension keys into one map, skipping unset fields.
     */
    public Map<String, String> asMap() {
        Map<String, String> out = new LinkedHashMap<>();
        for (String key : new String[] { "mpn", "manufacturer", "category", "description", "datasheet_url",
                "ingestion_timestamp", "source_file", "source_path", "file_hash", "chunk_index", "chunk_start",
                "chunk_end", "chunk_length", "total_text_length" }) {
            get(key).ifPresent(value -> out.put(key, value));
        }
        extra.forEach(out::putIfAbsent);
        return out;
    }

    /**
     * Immutable copy of extension keys. Entries with a null key or value carry no
     * information and are left out.
     */
    static Map<String, String> copyExtra(Map<String, String> extra) {
        if (extra == null || extra.isEmpty()) {
            return Map.of();
        }
        Map<String, String> present = new LinkedHashMap<>();
        extra.forEach((key, value) -> {
            if (key != null && value != null) {
                present.put(key, value);
            }
        });
        return Map.copyOf(present);
    }

    public Builder toBuilder() {
        return new Builder()
                .mpn(mpn)
                .manufacturer(manufacturer)
                .category(category)
                .description(description)
                .datasheetUrl(datasheetUrl)
                .ingestionTimestamp(ingestionTimestamp)
                .sourceFile(sourceFile)
                .sourcePath(sourcePath)
                .fileHash(fileHash)
                .chunkIndex(chunkIndex)
                .chunkStart(chunkStart)
                .chunkEnd(chunkEnd)
                .chunkLength(chunkLength)
                .totalTextLength(totalTextLength)
                .extra(extra);
    }

    public static final class Builder {
        private String mpn;
        private String manufacturer;
        private String category;
        private String description;
        private String datasheetUrl;
        private String ingestionTimestamp;
        private String sourceFile;
        private String sourcePath;
        private String fileHash;
        private Integer chunkIndex;
        private Integer chunkStart;
        private Integer chunkEnd;
        private Integer chunkLength;
        private Integer totalTextLength;
        private final Map<String, String> extra = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder mpn(String mpn) {
            this.mpn = mpn;
            return this;
        }

        public Builder manufacturer(String manufacturer) {
            this.manufacturer = manufacturer;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder datasheetUrl(String datasheetUrl) {
            this.datasheetUrl = datasheetUrl;
            return this;
        }

        public Builder ingestionTimestamp(String ingestionTimestamp) {
            this.ingestionTimestamp = ingestionTimestamp;
            return this;
        }

        public Builder sourceFile(String sourceFile) {
            this.sourceFile = sourceFile;
            return this;
        }

        public Builder sourcePath(String sourcePath) {
            this.sourcePath = sourcePath;
            return this;
        }

        public Builder fileHash(String fileHash) {
            this.fileHash = fileHash;
            return this;
        }

        public Builder chunkIndex(Integer chunkIndex) {
            this.chunkIndex = chunkIndex;
            return this;
        }

        public Builder chunkStart(Integer chunkStart) {
            this.chunkStart = chunkStart;
            return this;
        }

        public Builder chunkEnd(Integer chunkEnd) {
            this.chunkEnd = chunkEnd;
            return this;
        }

        public Builder chunkLength(Integer chunkLength) {
            this.chunkLength = chunkLength;
            return this;
        }

        public Builder totalTextLength(Integer totalTextLength) {
            this.totalTextLength = totalTextLength;
            return this;
        }

        public Builder extra(Map<String, String> values) {
            if (values != null) {
                this.extra.putAll(values);
            }
            return this;
        }

        public Builder extra(String key, String value) {
            this.extra.put(key, value);
            return this;
        }

        public ChunkMetadata build() {
            return new ChunkMetadata(mpn, manufacturer, category, description, datasheetUrl, ingestionTimestamp,
                    sourceFile, sourcePath, fileHash, chunkIndex, chunkStart, chunkEnd, chunkLength,
                    totalTextLength, extra);
        }
    }
}
