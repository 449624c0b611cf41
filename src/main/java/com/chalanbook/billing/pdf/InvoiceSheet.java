package com.chalanbook.billing.pdf;

import com.chalanbook.billing.model.Amounts;
import com.chalanbook.billing.model.CompanySettings;
import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.LineItem;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Printable view of an invoice passed into the Thymeleaf template: every
 * number already formatted, company details resolved, logo as a file URI.
 */
public class InvoiceSheet {

    private final Invoice invoice;
    private final CompanySettings company;
    private final List<Row> rows;

    public InvoiceSheet(Invoice invoice, CompanySettings company) {
        this.invoice = invoice;
        this.company = company;
        this.rows = new ArrayList<>();
        int sr = 1;
        for (LineItem item : invoice.getItems()) {
            rows.add(new Row(sr++, item));
        }
    }

    // ── Header ───────────────────────────────────────────────────────────────

    public String getCompanyName() { return company.getCompanyName(); }
    public String getCompanyCity() { return company.getCompanyCity(); }
    public String getCompanyMobile() { return company.getCompanyMobile(); }

    /** File URI of the logo, or null when none is configured or the file is missing. */
    public String getLogoUri() {
        String path = company.getLogoPath();
        if (path == null || path.isBlank()) {
            return null;
        }
        Path logo = Paths.get(path.trim());
        return Files.isRegularFile(logo) ? logo.toUri().toString() : null;
    }

    public int getChalanNo() { return invoice.getChalanNo(); }
    public String getDate() { return invoice.getFormattedDate(); }
    public String getPartyName() { return invoice.getPartyName(); }
    public String getCity() { return invoice.getCity(); }
    public String getLrNo() { return invoice.getLrNo(); }

    // ── Table ────────────────────────────────────────────────────────────────

    public List<Row> getRows() { return rows; }

    public String getSubtotal() { return Amounts.money(invoice.getSubtotal()); }
    public String getTaxLabel() { return "Tax " + Amounts.money(invoice.getTaxPercent()) + "%"; }
    public String getTaxAmount() { return Amounts.money(invoice.getTaxAmount()); }
    public String getPackingForwarding() { return Amounts.money(invoice.getPackingForwarding()); }
    public String getGrandTotal() { return Amounts.money(invoice.getGrandTotal()); }

    // ── Bank ─────────────────────────────────────────────────────────────────

    public String getBankAccountName() { return company.getBankAccountName(); }
    public String getBankName() { return company.getBankName(); }
    public String getBankAccountNo() { return company.getBankAccountNo(); }
    public String getBankIfsc() { return company.getBankIfsc(); }

    /** One printed line of the items table. */
    public static class Row {
        private final int sr;
        private final String itemName;
        private final String quantity;
        private final String rate;
        private final String amount;

        Row(int sr, LineItem item) {
            this.sr = sr;
            String name = item.getItemName() == null ? "" : item.getItemName().strip();
            this.itemName = name.isEmpty() ? "-" : name;
            this.quantity = Amounts.quantity(item.getQuantity());
            this.rate = Amounts.money(item.getRate());
            this.amount = Amounts.money(item.getAmount());
        }

        public int getSr() { return sr; }
        public String getItemName() { return itemName; }
        public String getQuantity() { return quantity; }
        public String getRate() { return rate; }
        public String getAmount() { return amount; }
    }
}
