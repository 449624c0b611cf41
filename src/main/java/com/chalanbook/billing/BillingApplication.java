package com.chalanbook.billing;

import com.chalanbook.billing.config.BillingConfig;
import com.chalanbook.billing.config.ConfigLoader;
import com.chalanbook.billing.exception.BillingException;
import com.chalanbook.billing.pdf.InvoicePdfExporter;
import com.chalanbook.billing.service.BillingService;
import com.chalanbook.billing.store.ChalanCounter;
import com.chalanbook.billing.store.Database;
import com.chalanbook.billing.store.DatabaseBackup;
import com.chalanbook.billing.store.InvoiceRepository;
import com.chalanbook.billing.store.ItemMasterRepository;
import com.chalanbook.billing.store.SettingsStore;
import com.chalanbook.billing.transfer.CsvTransfer;
import com.chalanbook.billing.ui.BillingFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Optional;

/**
 * Chalan Billing desktop entry point and wiring of the application's parts.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 *   java -jar chalan-billing.jar [OPTIONS]
 *
 *   Options:
 *     --config  &lt;path&gt;   JSON configuration file       (default: billing.json if present)
 *     --export  &lt;no&gt;     Render saved chalan &lt;no&gt; to PDF and exit, without opening the window
 * </pre>
 */
public class BillingApplication {

    private static final Logger logger = LoggerFactory.getLogger(BillingApplication.class);

    public static final String APP_TITLE = "Invoice/Chalan Generator";

    private final BillingConfig config;
    private final Database database;
    private final SettingsStore settingsStore;
    private final ItemMasterRepository itemMaster;
    private final CsvTransfer csvTransfer;
    private final DatabaseBackup backup;
    private final BillingService billingService;

    public BillingApplication(BillingConfig config) {
        this(config, Clock.systemDefaultZone());
    }

    public BillingApplication(BillingConfig config, Clock clock) {
        this.config = config;
        this.database = new Database(config.getDatabasePath());
        this.database.initialize();
        this.settingsStore = new SettingsStore(database);
        this.itemMaster = new ItemMasterRepository(database);
        this.csvTransfer = new CsvTransfer(database);
        this.backup = new DatabaseBackup(database, clock);
        this.billingService = new BillingService(
                new ChalanCounter(database),
                new InvoiceRepository(database),
                itemMaster,
                settingsStore,
                new InvoicePdfExporter(config),
                clock);
    }

    public BillingConfig getConfig() { return config; }
    public Database getDatabase() { return database; }
    public SettingsStore getSettingsStore() { return settingsStore; }
    public ItemMasterRepository getItemMaster() { return itemMaster; }
    public CsvTransfer getCsvTransfer() { return csvTransfer; }
    public DatabaseBackup getBackup() { return backup; }
    public BillingService getBillingService() { return billingService; }

    // ──────────────────────────────────────────────────────────────────────────

    public static void main(String[] args) {
        String configPath = parseArg(args, "--config", null);
        String exportChalan = parseArg(args, "--export", null);

        BillingApplication app;
        try {
            BillingConfig config = new ConfigLoader().load(configPath);
            logger.info("Starting {} with {}", APP_TITLE, config);
            app = new BillingApplication(config);
        } catch (BillingException e) {
            logger.error("Startup failed [{}]: {}", e.getCode(), e.getMessage(), e);
            System.exit(1);
            return;
        }

        if (exportChalan != null) {
            System.exit(app.exportHeadless(exportChalan));
            return;
        }

        SwingUtilities.invokeLater(() -> {
            try {
                UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
            } catch (Exception e) {
                logger.debug("System look and feel unavailable, using default: {}", e.getMessage());
            }
            new BillingFrame(app).setVisible(true);
        });
    }

    /**
     * Renders a saved chalan to PDF.
     *
     * @return process exit code
     */
    int exportHeadless(String chalanText) {
        int chalanNo;
        try {
            chalanNo = Integer.parseInt(chalanText.trim());
        } catch (NumberFormatException e) {
            logger.error("Not a chalan number: {}", chalanText);
            return 2;
        }
        try {
            Optional<Path> pdf = billingService.exportSaved(chalanNo);
            if (pdf.isEmpty()) {
                logger.error("No invoice with chalan {}", chalanNo);
                return 1;
            }
            logger.info("PDF exported → {}", pdf.get().toAbsolutePath());
            return 0;
        } catch (BillingException e) {
            logger.error("Export of chalan {} failed [{}]: {}", chalanNo, e.getCode(), e.getMessage(), e);
            return 1;
        }
    }

    // ──────────────────────────────────────────────────────────────────────────
    // CLI helpers
    // ──────────────────────────────────────────────────────────────────────────

    static String parseArg(String[] args, String key, String defaultValue) {
        for (int i = 0; i < args.length - 1; i++) {
            if (key.equalsIgnoreCase(args[i])) {
                return args[i + 1];
            }
        }
        return defaultValue;
    }
}
