package com.datasheetrag.ingest;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Caller supplied description of the component a datasheet belongs to.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComponentInfo(
        @JsonProperty("mpn") String mpn,
        @JsonProperty("manufacturer") String manufacturer,
        @JsonProperty("category") String category,
        @JsonProperty("description") String description,
        @JsonProperty("datasheet_url") String datasheetUrl,
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("extra") Map<String, String> extra) {

    static final String UNKNOWN = "unknown";

    public ComponentInfo {
        extra = ChunkMetadata.copyExtra(extra);
    }

    public static ComponentInfo of(String mpn, String manufacturer, String category) {
        return new ComponentInfo(mpn, manufacturer, category, null, null, null, null);
    }

    /**
     * Source metadata for every chunk of this component's datasheet. Missing
     * identifying fields become {@code "unknown"}, missing free text becomes empty.
     */
    public ChunkMetadata toSourceMetadata() {
        return ChunkMetadata.builder()
                .mpn(orDefault(mpn, UNKNOWN))
                .manufacturer(orDefault(manufacturer, UNKNOWN))
                .category(orDefault(category, UNKNOWN))
                .description(orDefault(description, ""))
                .datasheetUrl(orDefault(datasheetUrl, ""))
                .ingestionTimestamp(orDefault(timestamp, ""))
                .extra(extra)
                .build();
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
