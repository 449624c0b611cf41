package com.chalanbook.billing.model;

import com.chalanbook.billing.exception.ValidationException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding, parsing and display rules shared by the form, the store and the PDF.
 */
public final class Amounts {

    public static final int SCALE = 2;

    private Amounts() {}

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /** Two decimals, no grouping: {@code 1234.5 -> "1234.50"}. */
    public static String money(BigDecimal value) {
        return round(value == null ? BigDecimal.ZERO : value).toPlainString();
    }

    /** Quantity without trailing zeros: {@code 2.50 -> "2.5"}, {@code 3.0 -> "3"}. */
    public static String quantity(BigDecimal value) {
        if (value == null || value.signum() == 0) {
            return "0";
        }
        return value.stripTrailingZeros().toPlainString();
    }

    /**
     * Parses a user-entered number.
     *
     * @throws ValidationException if the text is blank or not a number
     */
    public static BigDecimal parse(String text, String field) {
        if (text == null || text.isBlank()) {
            throw new ValidationException(field + " is required", field);
        }
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " is not a number: " + text.trim(), field);
        }
    }

    /**
     * Lenient variant for the tax % and P &amp; F fields: blank, garbage or a
     * negative value counts as zero.
     */
    public static BigDecimal parseOrZero(String text) {
        return isNonNegative(text) ? new BigDecimal(text.trim()) : BigDecimal.ZERO;
    }

    /** True for a number that is zero or more. */
    public static boolean isNonNegative(String text) {
        if (text == null || text.isBlank()) {
            return false;
        }
        try {
            return new BigDecimal(text.trim()).signum() >= 0;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
