package com.chalanbook.billing.pdf;

import com.chalanbook.billing.model.CompanySettings;
import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.LineItem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InvoicePdfExporter
 */
class InvoicePdfExporterTest {

    @TempDir
    Path tempDir;

    private InvoicePdfExporter exporter;
    private CompanySettings company;
    private Invoice invoice;

    @BeforeEach
    void setUp() {
        exporter = new InvoicePdfExporter(tempDir.resolve("pdf"), tempDir.resolve("templates"));
        company = new CompanySettings();
        company.setCompanyName("Shree Ceramics");
        invoice = new Invoice(42, LocalDate.of(2025, 3, 9));
        invoice.setPartyName("Patel <b>& Sons</b>");
        invoice.setCity("Rajkot");
        invoice.setLrNo("LR-77");
        invoice.setTaxPercent(new BigDecimal("18"));
        invoice.setPackingForwarding(new BigDecimal("50"));
        invoice.getItems().add(new LineItem("Floor tile", new BigDecimal("10.500"), new BigDecimal("40")));
        invoice.getItems().add(new LineItem("  ", new BigDecimal("1"), new BigDecimal("100")));
    }

    @Nested
    @DisplayName("renderHtml")
    class RenderHtml {

        @Test
        @DisplayName("should escape user text")
        void shouldEscapeUserText() {
            String html = exporter.renderHtml(invoice, company);

            assertTrue(html.contains("Party: Patel &lt;b&gt;&amp; Sons&lt;/b&gt;"));
            assertFalse(html.contains("<b>&"));
        }

        @Test
        @DisplayName("should print header lines and bank details")
        void shouldPrintHeader() {
            String html = exporter.renderHtml(invoice, company);

            assertTrue(html.contains("Shree Ceramics"));
            assertTrue(html.contains("CITY | MOB: +91-123456789"));
            assertTrue(html.contains("Chalan No: 42"));
            assertTrue(html.contains("Date: 09/03/2025"));
            assertTrue(html.contains("L.R. No: LR-77"));
            assertTrue(html.contains("A/C NAME : VIVEK G. RUPAPARA"));
            assertTrue(html.contains("IFSC : XYZ0123456"));
        }

        @Test
        @DisplayName("should print rows and totals with two decimals")
        void shouldPrintTotals() {
            String html = exporter.renderHtml(invoice, company);

            // 10.5 * 40 = 420, + 100 = 520, tax 93.60, P&F 50
            assertTrue(html.contains(">10.5<"));
            assertTrue(html.contains(">420.00<"));
            assertTrue(html.contains(">520.00<"));
            assertTrue(html.contains("Tax 18.00%"));
            assertTrue(html.contains(">93.60<"));
            assertTrue(html.contains(">50.00<"));
            assertTrue(html.contains(">663.60<"));
        }

        @Test
        @DisplayName("should print a dash for a blank item name")
        void shouldPrintDashForBlankName() {
            String html = exporter.renderHtml(invoice, company);

            assertTrue(html.contains(">-<"));
        }

        @Test
        @DisplayName("should leave out the logo when the file is missing")
        void shouldSkipMissingLogo() {
            company.setLogoPath(tempDir.resolve("missing.png").toString());

            String html = exporter.renderHtml(invoice, company);

            assertFalse(html.contains("<img"));
        }

        @Test
        @DisplayName("should link the logo by file URI when the file exists")
        void shouldIncludeLogo() throws IOException {
            Path logo = writeLogo();
            company.setLogoPath(logo.toString());

            String html = exporter.renderHtml(invoice, company);

            assertTrue(html.contains("<img"));
            assertTrue(html.contains("src=\"" + logo.toUri()));
        }

        @Test
        @DisplayName("should prefer a template in the template directory")
        void shouldUseExternalTemplate() throws IOException {
            Path templates = Files.createDirectories(tempDir.resolve("templates"));
            Files.writeString(templates.resolve("invoice.html"),
                    "<html><body><p th:text=\"'Custom ' + ${sheet.chalanNo}\">x</p></body></html>",
                    StandardCharsets.UTF_8);

            String html = exporter.renderHtml(invoice, company);

            assertTrue(html.contains("Custom 42"));
            assertFalse(html.contains("Grand Total"));
        }
    }

    @Nested
    @DisplayName("export")
    class Export {

        @Test
        @DisplayName("should render a PDF that carries the logo")
        void shouldWritePdfWithLogo() throws IOException {
            company.setLogoPath(writeLogo().toString());

            Path out = exporter.export(invoice, company);

            byte[] bytes = Files.readAllBytes(out);
            assertEquals("%PDF", new String(bytes, 0, 4, StandardCharsets.US_ASCII));
        }

        @Test
        @DisplayName("should write Invoice_<chalan>.pdf into a new directory")
        void shouldWritePdf() throws IOException {
            Path out = exporter.export(invoice, company);

            assertEquals(tempDir.resolve("pdf").resolve("Invoice_42.pdf"), out);
            assertTrue(Files.isRegularFile(out));
            byte[] bytes = Files.readAllBytes(out);
            assertEquals("%PDF", new String(bytes, 0, 4, StandardCharsets.US_ASCII));
        }

        @Test
        @DisplayName("should flow a long item list over several pages")
        void shouldHandleLongTables() throws IOException {
            for (int i = 0; i < 80; i++) {
                invoice.getItems().add(new LineItem("Item " + i + "\nsecond line", BigDecimal.ONE, BigDecimal.TEN));
            }

            Path out = exporter.export(invoice, company);

            assertTrue(Files.size(out) > 0);
        }
    }

    private Path writeLogo() throws IOException {
        BufferedImage image = new BufferedImage(32, 32, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(Color.BLUE);
        g.fillRect(0, 0, 32, 32);
        g.dispose();
        Path logo = tempDir.resolve("logo.png");
        assertTrue(ImageIO.write(image, "png", logo.toFile()));
        return logo;
    }
}
