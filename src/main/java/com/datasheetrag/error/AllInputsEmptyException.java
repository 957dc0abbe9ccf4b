package com.datasheetrag.error;

/**
 * Thrown when every entry of a batch embedding request is blank.
 */
public class AllInputsEmptyException extends DatasheetRagException {

    private final int inputCount;

    public AllInputsEmptyException(int inputCount) {
        super("All " + inputCount + " texts are empty");
        this.inputCount = inputCount;
    }

    public int getInputCount() {
        return inputCount;
    }
}
