package com.datasheetrag.error;

/**
 * Thrown when the texts and metadata passed to a collection insert disagree in size.
 */
public class LengthMismatchException extends DatasheetRagException {

    private final int texts;
    private final int metadata;

    public LengthMismatchException(int texts, int metadata) {
        super("Number of texts (" + texts + ") must match number of metadata entries (" + metadata + ")");
        this.texts = texts;
        this.metadata = metadata;
    }

    public int getTexts() {
        return texts;
    }

    public int getMetadata() {
        return metadata;
    }
}
