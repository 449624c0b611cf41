package com.chalanbook.billing.transfer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigDecimal;

/**
 * One row of the exported items CSV, mirroring the {@code invoice_items} table.
 */
@JsonPropertyOrder({"id", "invoice_id", "sr", "item_name", "qty", "rate", "amount"})
public class InvoiceItemCsvRow {

    @JsonProperty("id") private long id;
    @JsonProperty("invoice_id") private long invoiceId;
    @JsonProperty("sr") private int sr;
    @JsonProperty("item_name") private String itemName;
    @JsonProperty("qty") private BigDecimal quantity;
    @JsonProperty("rate") private BigDecimal rate;
    @JsonProperty("amount") private BigDecimal amount;

    public InvoiceItemCsvRow() {}

    public long getId() { return id; }
    public void setId(long id) { this.id = id; }

    public long getInvoiceId() { return invoiceId; }
    public void setInvoiceId(long invoiceId) { this.invoiceId = invoiceId; }

    public int getSr() { return sr; }
    public void setSr(int sr) { this.sr = sr; }

    public String getItemName() { return itemName; }
    public void setItemName(String itemName) { this.itemName = itemName; }

    public BigDecimal getQuantity() { return quantity; }
    public void setQuantity(BigDecimal quantity) { this.quantity = quantity; }

    public BigDecimal getRate() { return rate; }
    public void setRate(BigDecimal rate) { this.rate = rate; }

    public BigDecimal getAmount() { return amount; }
    public void setAmount(BigDecimal amount) { this.amount = amount; }
}
