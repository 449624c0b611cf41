package com.chalanbook.billing.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration defaults and environment variable names.
 */
public final class BillingConfigConstants {

    private BillingConfigConstants() {
        // Utility class
    }

    /** Config file picked up from the working directory when no --config is given. */
    public static final String DEFAULT_CONFIG_FILE = "billing.json";

    // Default values
    public static final String DEFAULT_DATABASE_FILE = "invoices.db";
    public static final String DEFAULT_PDF_DIRECTORY = "pdf";
    public static final String DEFAULT_TEMPLATE_DIRECTORY = "templates";
    public static final boolean DEFAULT_OPEN_PDF_AFTER_EXPORT = true;

    // Config keys
    public static final String KEY_DATABASE_FILE = "databaseFile";
    public static final String KEY_PDF_DIRECTORY = "pdfDirectory";
    public static final String KEY_TEMPLATE_DIRECTORY = "templateDirectory";
    public static final String KEY_OPEN_PDF_AFTER_EXPORT = "openPdfAfterExport";

    // Environment variable names
    public static final String ENV_DATABASE_FILE = "BILLING_DATABASE_FILE";
    public static final String ENV_PDF_DIRECTORY = "BILLING_PDF_DIRECTORY";
    public static final String ENV_TEMPLATE_DIRECTORY = "BILLING_TEMPLATE_DIRECTORY";
    public static final String ENV_OPEN_PDF = "BILLING_OPEN_PDF";

    /**
     * Environment variable to config key mapping
     */
    public static final Map<String, String> ENV_VAR_MAPPING;

    static {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(ENV_DATABASE_FILE, KEY_DATABASE_FILE);
        map.put(ENV_PDF_DIRECTORY, KEY_PDF_DIRECTORY);
        map.put(ENV_TEMPLATE_DIRECTORY, KEY_TEMPLATE_DIRECTORY);
        map.put(ENV_OPEN_PDF, KEY_OPEN_PDF_AFTER_EXPORT);
        ENV_VAR_MAPPING = Collections.unmodifiableMap(map);
    }
}
