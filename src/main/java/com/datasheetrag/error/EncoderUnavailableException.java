package com.datasheetrag.error;

/**
 * Thrown when the text encoder cannot be initialized or an encode call fails.
 */
public class EncoderUnavailableException extends DatasheetRagException {

    public EncoderUnavailableException(String message) {
        super(message);
    }

    public EncoderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
