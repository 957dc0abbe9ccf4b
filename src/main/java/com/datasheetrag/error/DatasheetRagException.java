package com.datasheetrag.error;

/**
 * Base exception for ingestion, embedding and collection failures.
 *
 * <p>Every unchecked error raised by this project extends this class, so callers
 * can catch a single type at the edge of the pipeline.</p>
 */
public class DatasheetRagException extends RuntimeException {

    public DatasheetRagException(String message) {
        super(message);
    }

    public DatasheetRagException(String message, Throwable cause) {
        super(message, cause);
    }
}
