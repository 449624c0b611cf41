package com.chalanbook.billing.exception;

/**
 * PDF rendering or template failure.
 */
public class ExportException extends BillingException {

    public ExportException(String message, Throwable cause) {
        super(message, "PDF_EXPORT_FAILED", cause);
    }
}
