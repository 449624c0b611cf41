package com.chalanbook.billing.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * One row of the exported invoices CSV, mirroring the {@code invoices} table.
 */
@JsonPropertyOrder({"id", "chalan_no", "party_name", "city", "lr_no", "dt",
        "tax_percent", "pandf", "subtotal", "tax_amount", "grand_total"})
public class InvoiceCsvRow {

    @JsonProperty("id") private long id;
    @JsonProperty("chalan_no") private int chalanNo;
    @JsonProperty("party_name") private String partyName;
    @JsonProperty("city") private String city;
    @JsonProperty("lr_no") private String lrNo;
    @JsonProperty("dt") private String date;
    @JsonProperty("tax_percent") private BigDecimal taxPercent;
    @JsonProperty("pandf") private BigDecimal packingForwarding;
    @JsonProperty("subtotal") private BigDecimal subtotal;
    @JsonProperty("tax_amount") private BigDecimal taxAmount;
    @JsonProperty("grand_total") private BigDecimal grandTotal;

    public InvoiceCsvRow() {}

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public int getChalanNo() { return chalanNo; }
    public void setChalanNo(int chalanNo) { this.chalanNo = chalanNo; }

    public String getPartyName() { return partyName; }
    public void setPartyName(String partyName) { this.partyName = partyName; }

    public String getCity() { return city; }
    public void setCity(String city) { this.city = city; }

    public String getLrNo() { return lrNo; }
    public void setLrNo(String lrNo) { this.lrNo = lrNo; }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public BigDecimal getTaxPercent() { return taxPercent; }
    public void setTaxPercent(BigDecimal taxPercent) { this.taxPercent = taxPercent; }

    public BigDecimal getPackingForwarding() { return packingForwarding; }
    public void setPackingForwarding(BigDecimal packingForwarding) { this.packingForwarding = packingForwarding; }

    public BigDecimal getSubtotal() { return subtotal; }
    public void setSubtotal(BigDecimal subtotal) { this.subtotal = subtotal; }

    public BigDecimal getTaxAmount() { return taxAmount; }
    public void setTaxAmount(BigDecimal taxAmount) { this.taxAmount = taxAmount; }

    public BigDecimal getGrandTotal() { return grandTotal; }
    public void setGrandTotal(BigDecimal grandTotal) { this.grandTotal = grandTotal; }
}
