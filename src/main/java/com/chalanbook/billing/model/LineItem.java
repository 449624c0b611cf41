package com.chalanbook.billing.model;

import java.math.BigDecimal;

/**
 * Represents a single line item on a chalan.
 */
public class LineItem {

    private String itemName;
    private BigDecimal quantity;
    private BigDecimal rate;

    public LineItem() {}

    public LineItem(String itemName, BigDecimal quantity, BigDecimal rate) {
        this.itemName = itemName;
        this.quantity = quantity;
        this.rate = rate;
    }

    // ── Derived ──────────────────────────────────────────────────────────────

    /** Returns quantity × rate, rounded to paise. */
    public BigDecimal getAmount() {
        return Amounts.round(quantity.multiply(rate));
    }

    // ── Getters & Setters ────────────────────────────────────────────────────

    public String getItemName() { return itemName; }
    public void setItemName(String itemName) { this.itemName = itemName; }

    public BigDecimal getQuantity() { return quantity; }
    public void setQuantity(BigDecimal quantity) { this.quantity = quantity; }

    public BigDecimal getRate() { return rate; }
    public void setRate(BigDecimal rate) { this.rate = rate; }

    @Override
    public String toString() {
        return "LineItem{" + itemName + ", qty=" + quantity + ", rate=" + rate + "}";
    }
}
