package com.quakesieve.core.record;

/**
 * Thrown when an input record cannot be turned into a valid event and the
 * parser runs in strict mode.
 *
 * @since 1.0.0
 */
public class InvalidRecordException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int rowNumber;
    private final String reason;

    /**
     * @param rowNumber 1-based data row number (the header is not counted)
     * @param reason    what is wrong with the record
     */
    public InvalidRecordException(int rowNumber, String reason) {
        super("Invalid record at row " + rowNumber + ": " + reason);
        this.rowNumber = rowNumber;
        this.reason = reason;
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public String getReason() {
        return reason;
    }
}
