package com.chalanbook.billing.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Invoice totals
 */
class InvoiceTest {

    private static LineItem item(String name, String qty, String rate) {
        return new LineItem(name, new BigDecimal(qty), new BigDecimal(rate));
    }

    private static Invoice invoiceWith(LineItem... items) {
        Invoice invoice = new Invoice(7, LocalDate.of(2025, 3, 9));
        for (LineItem item : items) {
            invoice.getItems().add(item);
        }
        return invoice;
    }

    @Nested
    @DisplayName("line amount")
    class LineAmount {

        @Test
        @DisplayName("should multiply quantity by rate")
        void shouldMultiply() {
            assertEquals(new BigDecimal("21.00"), item("Bolt", "2", "10.50").getAmount());
        }

        @Test
        @DisplayName("should round half up to two decimals")
        void shouldRoundHalfUp() {
            assertEquals(new BigDecimal("0.13"), item("Washer", "1", "0.125").getAmount());
            assertEquals(new BigDecimal("100.00"), item("Nut", "3", "33.333").getAmount());
        }
    }

    @Nested
    @DisplayName("totals")
    class Totals {

        @Test
        @DisplayName("should be zero for an empty invoice")
        void shouldBeZeroWhenEmpty() {
            Invoice invoice = invoiceWith();

            assertEquals(new BigDecimal("0.00"), invoice.getSubtotal());
            assertEquals(new BigDecimal("0.00"), invoice.getTaxAmount());
            assertEquals(new BigDecimal("0.00"), invoice.getGrandTotal());
        }

        @Test
        @DisplayName("should add tax and packing & forwarding to the subtotal")
        void shouldAddTaxAndPf() {
            Invoice invoice = invoiceWith(item("Bolt", "2", "10.50"), item("Nut", "3", "33.333"));
            invoice.setTaxPercent(new BigDecimal("18"));
            invoice.setPackingForwarding(new BigDecimal("50"));

            assertEquals(new BigDecimal("121.00"), invoice.getSubtotal());
            assertEquals(new BigDecimal("21.78"), invoice.getTaxAmount());
            assertEquals(new BigDecimal("192.78"), invoice.getGrandTotal());
        }

        @Test
        @DisplayName("should round the tax amount")
        void shouldRoundTax() {
            Invoice invoice = invoiceWith(item("Pipe", "1", "10.05"));
            invoice.setTaxPercent(new BigDecimal("5"));

            // 10.05 * 5% = 0.5025
            assertEquals(new BigDecimal("0.50"), invoice.getTaxAmount());
            assertEquals(new BigDecimal("10.55"), invoice.getGrandTotal());
        }

        @Test
        @DisplayName("should treat missing charges as zero")
        void shouldTreatNullChargesAsZero() {
            Invoice invoice = invoiceWith(item("Pipe", "4", "2.5"));
            invoice.setTaxPercent(null);
            invoice.setPackingForwarding(null);

            assertEquals(new BigDecimal("10.00"), invoice.getGrandTotal());
        }
    }

    @Test
    @DisplayName("should format the date as dd/MM/yyyy")
    void shouldFormatDate() {
        assertEquals("09/03/2025", invoiceWith().getFormattedDate());
        assertEquals("", new Invoice().getFormattedDate());
    }
}
