package com.datasheetrag.error;

/**
 * Thrown when a single text handed to the embedding step is blank.
 */
public class EmptyInputException extends DatasheetRagException {

    public EmptyInputException(String message) {
        super(message);
    }
}
