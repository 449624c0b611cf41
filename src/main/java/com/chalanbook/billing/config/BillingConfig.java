package com.chalanbook.billing.config;

import com.chalanbook.billing.exception.ValidationException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Application configuration: where the database, the PDFs and the editable
 * invoice template live.
 * Use the Builder pattern to construct instances
 */
public class BillingConfig {

    private final String databaseFile;
    private final String pdfDirectory;
    private final String templateDirectory;
    private final boolean openPdfAfterExport;

    private BillingConfig(Builder builder) {
        this.databaseFile = builder.databaseFile;
        this.pdfDirectory = builder.pdfDirectory;
        this.templateDirectory = builder.templateDirectory;
        this.openPdfAfterExport = builder.openPdfAfterExport;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BillingConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .databaseFile(databaseFile)
            .pdfDirectory(pdfDirectory)
            .templateDirectory(templateDirectory)
            .openPdfAfterExport(openPdfAfterExport);
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    public Path getDatabasePath() {
        return Paths.get(databaseFile);
    }

    public String getPdfDirectory() {
        return pdfDirectory;
    }

    public Path getPdfPath() {
        return Paths.get(pdfDirectory);
    }

    public String getTemplateDirectory() {
        return templateDirectory;
    }

    public boolean isOpenPdfAfterExport() {
        return openPdfAfterExport;
    }

    @Override
    public String toString() {
        return "BillingConfig{" +
            "databaseFile='" + databaseFile + '\'' +
            ", pdfDirectory='" + pdfDirectory + '\'' +
            ", templateDirectory='" + templateDirectory + '\'' +
            ", openPdfAfterExport=" + openPdfAfterExport +
            '}';
    }

    public static class Builder {
        private String databaseFile = BillingConfigConstants.DEFAULT_DATABASE_FILE;
        private String pdfDirectory = BillingConfigConstants.DEFAULT_PDF_DIRECTORY;
        private String templateDirectory = BillingConfigConstants.DEFAULT_TEMPLATE_DIRECTORY;
        private boolean openPdfAfterExport = BillingConfigConstants.DEFAULT_OPEN_PDF_AFTER_EXPORT;

        public Builder databaseFile(String databaseFile) {
            this.databaseFile = databaseFile;
            return this;
        }

        public Builder pdfDirectory(String pdfDirectory) {
            this.pdfDirectory = pdfDirectory;
            return this;
        }

        public Builder templateDirectory(String templateDirectory) {
            this.templateDirectory = templateDirectory;
            return this;
        }

        public Builder openPdfAfterExport(boolean openPdfAfterExport) {
            this.openPdfAfterExport = openPdfAfterExport;
            return this;
        }

        /**
         * @throws ValidationException if a path setting is blank
         */
        public BillingConfig build() {
            requirePath(databaseFile, BillingConfigConstants.KEY_DATABASE_FILE);
            requirePath(pdfDirectory, BillingConfigConstants.KEY_PDF_DIRECTORY);
            requirePath(templateDirectory, BillingConfigConstants.KEY_TEMPLATE_DIRECTORY);
            return new BillingConfig(this);
        }

        private static void requirePath(String value, String field) {
            if (value == null || value.trim().isEmpty()) {
                throw new ValidationException(field + " must not be empty", field);
            }
        }
    }
}
