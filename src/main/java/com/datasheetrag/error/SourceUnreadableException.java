package com.datasheetrag.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Raised for a batch ingestion entry whose source file is missing or unreadable.
 */
public class SourceUnreadableException extends IOException {

    private final transient Path path;

    public SourceUnreadableException(Path path, String reason) {
        super("Source unreadable: " + path + " (" + reason + ")");
        this.path = path;
    }

    public SourceUnreadableException(Path path, Throwable cause) {
        super("Source unreadable: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
