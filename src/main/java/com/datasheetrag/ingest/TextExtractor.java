package com.datasheetrag.ingest;

import java.io.IOException;
import java.nio.file.Path;

public interface TextExtractor {
    boolean supports(Path path);

    /**
     * Returns the document's text, possibly empty. Failing to read or parse the
     * document is an {@link IOException}.
     */
    String extract(Path path) throws IOException;
}
