package com.chalanbook.billing.exception;

/**
 * Raised when an invoice is saved under a chalan number that is already taken.
 */
public class DuplicateChalanException extends StorageException {
    private final int chalanNo;

    public DuplicateChalanException(int chalanNo, Throwable cause) {
        super("Chalan number already exists: " + chalanNo, "DUPLICATE_CHALAN", cause);
        this.chalanNo = chalanNo;
    }

    public int getChalanNo() {
        return chalanNo;
    }
}
