package com.datasheetrag.ingest;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads a file as UTF-8 text. Accepts any path, so it belongs last in an extractor list.
 */
public class PlainTextExtractor implements TextExtractor {

    @Override
    public boolean supports(Path path) {
        return true;
    }

    @Override
    public String extract(Path path) throws IOException {
        return Files.readString(path, StandardCharsets.UTF_8);
    }
}
