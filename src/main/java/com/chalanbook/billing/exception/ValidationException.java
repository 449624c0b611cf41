package com.chalanbook.billing.exception;

/**
 * Invalid user input or configuration value.
 */
public class ValidationException extends BillingException {
    private final String field;

    public ValidationException(String message, String field) {
        super(message, "VALIDATION_ERROR");
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
