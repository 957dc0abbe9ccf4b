package com.datasheetrag.ingest;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of a batch ingestion: a source document and the component it documents.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatasheetSource(
        @JsonProperty("path") String path,
        @JsonProperty("component_info") ComponentInfo componentInfo) {

    public DatasheetSource {
        componentInfo = componentInfo == null ? new ComponentInfo(null, null, null, null, null, null, null) : componentInfo;
    }

    public static DatasheetSource of(Path path, ComponentInfo componentInfo) {
        return new DatasheetSource(path.toString(), componentInfo);
    }

    public Path file() {
        return Path.of(path);
    }
}
