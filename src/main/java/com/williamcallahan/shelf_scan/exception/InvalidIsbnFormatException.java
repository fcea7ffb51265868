package com.williamcallahan.shelf_scan.exception;

/**
 * Raised when an ISBN conversion is requested for input that has no valid form in the
 * target format, e.g. converting a 979-prefixed ISBN-13 to ISBN-10.
 *
 * <p>This is a caller error, not a missing-data signal. Callers must handle it explicitly
 * instead of folding it into "unknown".</p>
 */
public class InvalidIsbnFormatException extends RuntimeException {

    private final String input;

    public InvalidIsbnFormatException(String input, String reason) {
        super("Invalid ISBN '" + input + "': " + reason);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
