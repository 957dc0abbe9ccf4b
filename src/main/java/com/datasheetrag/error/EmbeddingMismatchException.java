package com.datasheetrag.error;

/**
 * Thrown when a persisted collection was built with a different encoder than the
 * one it is being used with. Delete the collection or pick another name.
 */
public class EmbeddingMismatchException extends DatasheetRagException {

    public EmbeddingMismatchException(String collectionName, String persisted, String current) {
        super("Collection " + collectionName + " was built with encoder " + persisted
                + " but is being opened with " + current);
    }
}
