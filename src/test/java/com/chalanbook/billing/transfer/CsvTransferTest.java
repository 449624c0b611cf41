package com.chalanbook.billing.transfer;

import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.LineItem;
import com.chalanbook.billing.store.Database;
import com.chalanbook.billing.store.InvoiceRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CsvTransfer
 */
class CsvTransferTest {

    @TempDir
    Path tempDir;

    private Database source;
    private InvoiceRepository sourceInvoices;

    @BeforeEach
    void setUp() {
        source = new Database(tempDir.resolve("source.db"));
        source.initialize();
        sourceInvoices = new InvoiceRepository(source);
    }

    private static Invoice invoice(int chalanNo, String party, LineItem... items) {
        Invoice invoice = new Invoice(chalanNo, LocalDate.of(2025, 5, chalanNo));
        invoice.setPartyName(party);
        invoice.setCity("Morbi");
        invoice.setTaxPercent(new BigDecimal("12"));
        for (LineItem item : items) {
            invoice.getItems().add(item);
        }
        return invoice;
    }

    private static LineItem item(String name, String qty, String rate) {
        return new LineItem(name, new BigDecimal(qty), new BigDecimal(rate));
    }

    private Database freshTarget(String name) {
        Database target = new Database(tempDir.resolve(name));
        target.initialize();
        return target;
    }

    @Nested
    @DisplayName("exportAll")
    class ExportAll {

        @Test
        @DisplayName("should write invoices and a sibling items file with headers")
        void shouldWriteBothFiles() throws IOException {
            sourceInvoices.save(invoice(1, "Acme, Ltd", item("Tile", "10", "45")));

            CsvTransfer.ExportedFiles files = new CsvTransfer(source).exportAll(tempDir.resolve("all.csv"));

            assertEquals(tempDir.resolve("all_items.csv"), files.getItems());
            List<String> invoiceLines = Files.readAllLines(files.getInvoices(), StandardCharsets.UTF_8);
            assertEquals("id,chalan_no,party_name,city,lr_no,dt,tax_percent,pandf,subtotal,tax_amount,grand_total",
                    invoiceLines.get(0));
            assertEquals(2, invoiceLines.size());
            assertTrue(invoiceLines.get(1).contains("\"Acme, Ltd\""));
            assertTrue(invoiceLines.get(1).contains("01/05/2025"));

            List<String> itemLines = Files.readAllLines(files.getItems(), StandardCharsets.UTF_8);
            assertEquals("id,invoice_id,sr,item_name,qty,rate,amount", itemLines.get(0));
            assertEquals(2, itemLines.size());
        }

        @Test
        @DisplayName("should derive the items file name")
        void shouldDeriveItemsFile() {
            assertEquals(tempDir.resolve("x_items.csv"), CsvTransfer.itemsFileFor(tempDir.resolve("x.csv")));
            assertEquals(tempDir.resolve("export_items.csv"), CsvTransfer.itemsFileFor(tempDir.resolve("export")));
        }
    }

    @Nested
    @DisplayName("importAll")
    class ImportAll {

        @Test
        @DisplayName("should restore invoices with their items into another database")
        void shouldRoundTrip() {
            sourceInvoices.save(invoice(1, "Acme", item("Tile", "10", "45"), item("Grout", "2", "120")));
            sourceInvoices.save(invoice(2, "Globex", item("Cement", "5", "380")));
            CsvTransfer.ExportedFiles files = new CsvTransfer(source).exportAll(tempDir.resolve("all.csv"));

            Database target = freshTarget("target.db");
            int imported = new CsvTransfer(target).importAll(files.getInvoices(), files.getItems());

            assertEquals(2, imported);
            InvoiceRepository targetInvoices = new InvoiceRepository(target);
            Invoice first = targetInvoices.findByChalanNo(1).orElseThrow();
            assertEquals("Acme", first.getPartyName());
            assertEquals(LocalDate.of(2025, 5, 1), first.getDate());
            assertEquals(2, first.getItems().size());
            assertEquals("Grout", first.getItems().get(1).getItemName());
            assertEquals(1, targetInvoices.findByChalanNo(2).orElseThrow().getItems().size());
        }

        @Test
        @DisplayName("should re-attach items to the new ids and drop items of skipped invoices")
        void shouldRemapIds() {
            sourceInvoices.save(invoice(1, "Acme", item("Tile", "10", "45")));
            sourceInvoices.save(invoice(2, "Globex", item("Cement", "5", "380")));
            CsvTransfer.ExportedFiles files = new CsvTransfer(source).exportAll(tempDir.resolve("all.csv"));

            Database target = freshTarget("target.db");
            InvoiceRepository targetInvoices = new InvoiceRepository(target);
            // Occupies chalan 1 and row id 1 in the target
            targetInvoices.save(invoice(1, "Existing", item("Sand", "1", "900")));

            int imported = new CsvTransfer(target).importAll(files.getInvoices(), files.getItems());

            assertEquals(1, imported);
            Invoice kept = targetInvoices.findByChalanNo(1).orElseThrow();
            assertEquals("Existing", kept.getPartyName());
            assertEquals(1, kept.getItems().size());
            assertEquals("Sand", kept.getItems().get(0).getItemName());

            Invoice added = targetInvoices.findByChalanNo(2).orElseThrow();
            assertEquals(1, added.getItems().size());
            assertEquals("Cement", added.getItems().get(0).getItemName());
        }

        @Test
        @DisplayName("should skip invoice rows without a chalan number or with unreadable amounts")
        void shouldSkipMalformedInvoiceRows() throws IOException {
            Path invoices = tempDir.resolve("manual.csv");
            Path items = tempDir.resolve("manual_items.csv");
            Files.write(invoices, List.of(
                    "id,chalan_no,party_name,city,lr_no,dt,tax_percent,pandf,subtotal,tax_amount,grand_total",
                    "1,,Nobody,,,,0,0,0,0,0",
                    "2,30,Somebody,Wankaner,LR1,03/06/2025,,abc,100,0,100",
                    "3,31,Valid,Morbi,LR2,04/06/2025,,,100,0,100"), StandardCharsets.UTF_8);
            Files.write(items, List.of(
                    "id,invoice_id,sr,item_name,qty,rate,amount",
                    "1,2,1,Tile,4,25,100",
                    "2,3,1,Tile,4,25,100"), StandardCharsets.UTF_8);

            Database target = freshTarget("target.db");
            int imported = new CsvTransfer(target).importAll(invoices, items);

            assertEquals(1, imported);
            InvoiceRepository targetInvoices = new InvoiceRepository(target);
            assertFalse(targetInvoices.exists(30));
            Invoice invoice = targetInvoices.findByChalanNo(31).orElseThrow();
            assertEquals("Valid", invoice.getPartyName());
            assertEquals(0, BigDecimal.ZERO.compareTo(invoice.getTaxPercent()));
            assertEquals(new BigDecimal("100.00"), invoice.getSubtotal());
        }

        @Test
        @DisplayName("should skip item rows with unreadable numbers, bad quantities or unreadable invoice ids")
        void shouldSkipMalformedItemRows() throws IOException {
            Path invoices = tempDir.resolve("manual.csv");
            Path items = tempDir.resolve("manual_items.csv");
            Files.write(invoices, List.of(
                    "id,chalan_no,party_name,city,lr_no,dt,tax_percent,pandf,subtotal,tax_amount,grand_total",
                    "7,50,Somebody,Morbi,,05/06/2025,0,0,100,0,100"), StandardCharsets.UTF_8);
            Files.write(items, List.of(
                    "id,invoice_id,sr,item_name,qty,rate,amount",
                    "1,7,1,Tile,4,25,100",
                    "2,7,2,Grout,notanumber,10,0",
                    "3,7,3,Sand,0,10,0",
                    "4,7,4,Cement,1,-5,-5",
                    "5,xyz,1,Orphan,1,1,1"), StandardCharsets.UTF_8);

            Database target = freshTarget("target.db");
            int imported = new CsvTransfer(target).importAll(invoices, items);

            assertEquals(1, imported);
            Invoice invoice = new InvoiceRepository(target).findByChalanNo(50).orElseThrow();
            assertEquals(1, invoice.getItems().size());
            assertEquals("Tile", invoice.getItems().get(0).getItemName());
        }
    }
}
