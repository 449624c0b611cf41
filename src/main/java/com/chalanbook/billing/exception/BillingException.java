package com.chalanbook.billing.exception;

/**
 * Base exception for the billing application.
 *
 * <p>Unchecked, carrying a short error code so the UI and the command line can
 * tell failures apart without parsing messages.
 */
public class BillingException extends RuntimeException {
    private final String code;

    public BillingException(String message, String code) {
        this(message, code, null);
    }

    public BillingException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
