package com.datasheetrag.error;

/**
 * Thrown when the persisted collection cannot be opened, read or written.
 */
public class StoreUnavailableException extends DatasheetRagException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
