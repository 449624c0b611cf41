package com.chalanbook.billing.pdf;

import com.chalanbook.billing.config.BillingConfig;
import com.chalanbook.billing.exception.ExportException;
import com.chalanbook.billing.model.CompanySettings;
import com.chalanbook.billing.model.Invoice;
import com.openhtmltopdf.pdfboxout.PdfRendererBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;
import org.thymeleaf.templateresolver.FileTemplateResolver;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Renders a chalan to an A5 PDF.
 *
 * <h2>Template resolution order</h2>
 * <ol>
 * <li>External file: {@code <templateDirectory>/invoice.html}, editable by the user</li>
 * <li>Bundled classpath template {@code /templates/invoice.html} (fallback)</li>
 * </ol>
 *
 * <p>The template is processed by Thymeleaf and the resulting XHTML is laid
 * out by openhtmltopdf. User text only ever reaches the page through
 * {@code th:text}, so it is escaped.
 */
public class InvoicePdfExporter {

    private static final Logger logger = LoggerFactory.getLogger(InvoicePdfExporter.class);

    private static final String TEMPLATE_FILENAME = "invoice.html";
    private static final String TEMPLATE_NAME = "invoice"; // classpath logical name

    private final Path pdfDirectory;
    private final Path templateDirectory;

    public InvoicePdfExporter(BillingConfig config) {
        this(config.getPdfPath(), Paths.get(config.getTemplateDirectory()));
    }

    public InvoicePdfExporter(Path pdfDirectory, Path templateDirectory) {
        this.pdfDirectory = pdfDirectory;
        this.templateDirectory = templateDirectory;
    }

    /** Output file for a chalan: {@code <pdfDirectory>/Invoice_<chalanNo>.pdf}. */
    public Path outputFileFor(int chalanNo) {
        return pdfDirectory.resolve("Invoice_" + chalanNo + ".pdf");
    }

    /**
     * Writes the PDF for an invoice, replacing any earlier export of the same chalan.
     *
     * @return the written file
     * @throws ExportException if the template or the renderer fails
     */
    public Path export(Invoice invoice, CompanySettings company) {
        Path out = outputFileFor(invoice.getChalanNo());
        String html = renderHtml(invoice, company);
        writePdf(html, out);
        logger.info("Exported chalan {} to {}", invoice.getChalanNo(), out.toAbsolutePath());
        return out;
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Thymeleaf Template Processing
    // ──────────────────────────────────────────────────────────────────────────

    public String renderHtml(Invoice invoice, CompanySettings company) {
        TemplateEngine engine = new TemplateEngine();
        boolean useClasspath;

        File externalTemplate = templateDirectory.resolve(TEMPLATE_FILENAME).toFile();
        if (externalTemplate.isFile()) {
            engine.setTemplateResolver(fileResolverFor(externalTemplate.getAbsoluteFile().getParent()));
            logger.debug("Template source → {} [external]", externalTemplate.getAbsolutePath());
            useClasspath = false;
        } else {
            engine.setTemplateResolver(classpathResolver());
            logger.debug("Template source → classpath:/templates/invoice.html [bundled]");
            useClasspath = true;
        }

        Context context = new Context(Locale.ENGLISH);
        context.setVariable("sheet", new InvoiceSheet(invoice, company));

        // File resolver needs the actual filename; classpath resolver uses the logical name
        try {
            return engine.process(useClasspath ? TEMPLATE_NAME : TEMPLATE_FILENAME, context);
        } catch (TemplateEngineException e) {
            throw new ExportException("Invoice template failed: " + e.getMessage(), e);
        }
    }

    private static FileTemplateResolver fileResolverFor(String directory) {
        FileTemplateResolver resolver = new FileTemplateResolver();
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setPrefix(directory + File.separator);
        resolver.setSuffix("");
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);
        return resolver;
    }

    private static ClassLoaderTemplateResolver classpathResolver() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCacheable(false);
        return resolver;
    }

    // ──────────────────────────────────────────────────────────────────────────
    // PDF Rendering
    // ──────────────────────────────────────────────────────────────────────────

    void writePdf(String html, Path out) {
        try {
            Path parent = out.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (OutputStream os = Files.newOutputStream(out)) {
                PdfRendererBuilder builder = new PdfRendererBuilder();
                builder.useFastMode();
                builder.withHtmlContent(html, null);
                builder.toStream(os);
                builder.run();
            }
        } catch (IOException | RuntimeException e) {
            throw new ExportException("Failed to write " + out + ": " + e.getMessage(), e);
        }
    }
}
