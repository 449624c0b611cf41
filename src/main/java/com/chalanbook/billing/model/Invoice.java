package com.chalanbook.billing.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;

/**
 * A chalan (invoice) as edited on the form, stored in the database and printed to PDF.
 */
public class Invoice {

    /** Date format used on the form, in the database and on the PDF. */
    public static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private int chalanNo;
    private LocalDate date;

    // Party details
    private String partyName = "";
    private String city = "";
    private String lrNo = "";

    // Charges
    private BigDecimal taxPercent = BigDecimal.ZERO;
    private BigDecimal packingForwarding = BigDecimal.ZERO;

    private List<LineItem> items = new ArrayList<>();

    public Invoice() {}

    public Invoice(int chalanNo, LocalDate date) {
        this.chalanNo = chalanNo;
        this.date = date;
    }

    // ── Derived ──────────────────────────────────────────────────────────────

    /** Sum of all item amounts. */
    public BigDecimal getSubtotal() {
        return Amounts.round(items.stream()
                .map(LineItem::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    /** Tax at {@link #getTaxPercent()} of the subtotal. */
    public BigDecimal getTaxAmount() {
        if (taxPercent == null || taxPercent.signum() == 0) {
            return Amounts.round(BigDecimal.ZERO);
        }
        return Amounts.round(getSubtotal().multiply(taxPercent).divide(HUNDRED));
    }

    /** Subtotal plus tax plus packing &amp; forwarding. */
    public BigDecimal getGrandTotal() {
        BigDecimal pf = packingForwarding == null ? BigDecimal.ZERO : packingForwarding;
        return Amounts.round(getSubtotal().add(getTaxAmount()).add(pf));
    }

    public String getFormattedDate() {
        return date == null ? "" : date.format(DATE_FORMAT);
    }

    // ── Getters & Setters ────────────────────────────────────────────────────

    public int getChalanNo() { return chalanNo; }
    public void setChalanNo(int chalanNo) { this.chalanNo = chalanNo; }

    public LocalDate getDate() { return date; }
    public void setDate(LocalDate date) { this.date = date; }

    public String getPartyName() { return partyName; }
    public void setPartyName(String partyName) { this.partyName = partyName; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getLrNo() { return lrNo; }
    public void setLrNo(String lrNo) { this.lrNo = lrNo; }

    public BigDecimal getTaxPercent() { return taxPercent; }
    public void setTaxPercent(BigDecimal taxPercent) { this.taxPercent = taxPercent; }

    public BigDecimal getPackingForwarding() { return packingForwarding; }
    public void setPackingForwarding(BigDecimal packingForwarding) { this.packingForwarding = packingForwarding; }

    public List<LineItem> getItems() { return items; }
    public void setItems(List<LineItem> items) { this.items = new ArrayList<>(items); }
}
