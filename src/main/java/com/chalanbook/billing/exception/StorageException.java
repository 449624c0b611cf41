package com.chalanbook.billing.exception;

/**
 * Failure reading or writing the invoice database or its files.
 */
public class StorageException extends BillingException {

    public StorageException(String message, Throwable cause) {
        super(message, "STORAGE_ERROR", cause);
    }

    public StorageException(String message, String code, Throwable cause) {
        super(message, code, cause);
    }
}
