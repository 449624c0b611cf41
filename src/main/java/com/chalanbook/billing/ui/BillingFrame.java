package com.chalanbook.billing.ui;

import com.chalanbook.billing.BillingApplication;
import com.chalanbook.billing.exception.BillingException;
import com.chalanbook.billing.exception.DuplicateChalanException;
import com.chalanbook.billing.exception.ValidationException;
import com.chalanbook.billing.model.Amounts;
import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.MasterItem;
import com.chalanbook.billing.service.BillingService;
import com.chalanbook.billing.transfer.CsvTransfer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.border.TitledBorder;
import javax.swing.event.DocumentEvent;
import javax.swing.event.DocumentListener;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.awt.event.FocusAdapter;
import java.awt.event.FocusEvent;
import java.awt.event.WindowEvent;
import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Main window: party details, item entry, the items table, totals and actions.
 */
public class BillingFrame extends JFrame {

    private static final Logger logger = LoggerFactory.getLogger(BillingFrame.class);

    private final BillingApplication app;
    private final BillingService billing;

    // ---- Invoice details ----
    private final JLabel lbChalan = new JLabel();
    private final JTextField tfParty = new JTextField(30);
    private final JTextField tfCity = new JTextField(18);
    private final JTextField tfLrNo = new JTextField(16);
    private final JTextField tfDate = new JTextField(12);

    // ---- Item entry ----
    private final JComboBox<String> cbItem = new JComboBox<>();
    private final JTextField tfQty = new JTextField(8);
    private final JTextField tfRate = new JTextField(10);

    // ---- Items and totals ----
    private final LineItemTableModel itemsModel = new LineItemTableModel();
    private final JTable table = new JTable(itemsModel);
    private final JTextField tfTax = new JTextField("0", 6);
    private final JTextField tfPf = new JTextField("0", 8);
    private final JLabel lbSubtotal = new JLabel("0.00");
    private final JLabel lbTaxAmount = new JLabel("0.00");
    private final JLabel lbGrandTotal = new JLabel("0.00");

    // Guard against combo selection events fired by our own refreshes
    private boolean refreshingItems = false;

    public BillingFrame(BillingApplication app) {
        super(BillingApplication.APP_TITLE);
        this.app = app;
        this.billing = app.getBillingService();

        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
        setMinimumSize(new Dimension(900, 650));
        setLocationByPlatform(true);

        cbItem.setEditable(true);
        cbItem.setPrototypeDisplayValue("XXXXXXXXXXXXXXXXXXXXXXXXXXXXXXXXXXXX");
        cbItem.addActionListener(e -> onMasterItemSelected());

        table.setRowHeight(22);
        table.setSelectionMode(ListSelectionModel.MULTIPLE_INTERVAL_SELECTION);
        table.getColumnModel().getColumn(0).setPreferredWidth(60);
        table.getColumnModel().getColumn(1).setPreferredWidth(340);
        table.getColumnModel().getColumn(2).setPreferredWidth(90);
        table.getColumnModel().getColumn(3).setPreferredWidth(100);
        table.getColumnModel().getColumn(4).setPreferredWidth(120);

        DocumentListener chargesListener = new DocumentListener() {
            @Override
            public void insertUpdate(DocumentEvent e) { refreshTotals(); }
            @Override
            public void removeUpdate(DocumentEvent e) { refreshTotals(); }
            @Override
            public void changedUpdate(DocumentEvent e) { refreshTotals(); }
        };
        tfTax.getDocument().addDocumentListener(chargesListener);
        tfPf.getDocument().addDocumentListener(chargesListener);
        FocusAdapter normalizeOnBlur = new FocusAdapter() {
            @Override
            public void focusLost(FocusEvent e) {
                normalizeChargeFields();
            }
        };
        tfTax.addFocusListener(normalizeOnBlur);
        tfPf.addFocusListener(normalizeOnBlur);

        setContentPane(buildRoot());
        setJMenuBar(buildMenu());

        billing.newInvoice();
        showInvoice(billing.getCurrent());
        refreshItemChoices();
        pack();
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Layout
    // ──────────────────────────────────────────────────────────────────────────

    private JPanel buildRoot() {
        JPanel root = new JPanel(new BorderLayout(0, 6));
        root.setBorder(new EmptyBorder(8, 8, 8, 8));

        JPanel north = new JPanel();
        north.setLayout(new BoxLayout(north, BoxLayout.Y_AXIS));
        north.add(buildDetails());
        north.add(buildEntry());

        JPanel south = new JPanel();
        south.setLayout(new BoxLayout(south, BoxLayout.Y_AXIS));
        south.add(buildTotals());
        south.add(buildActions());

        root.add(north, BorderLayout.NORTH);
        root.add(new JScrollPane(table), BorderLayout.CENTER);
        root.add(south, BorderLayout.SOUTH);
        return root;
    }

    private JComponent buildDetails() {
        JPanel p = new JPanel(new GridBagLayout());
        p.setBorder(new TitledBorder("Invoice Details"));
        GridBagConstraints c = new GridBagConstraints();
        c.insets = new Insets(4, 6, 4, 6);
        c.anchor = GridBagConstraints.WEST;

        c.gridx = 0; c.gridy = 0;
        p.add(lbChalan, c);
        c.gridx = 2;
        p.add(label("Date"), c);
        c.gridx = 3;
        p.add(tfDate, c);

        c.gridx = 0; c.gridy = 1;
        p.add(label("Party Name"), c);
        c.gridx = 1;
        p.add(tfParty, c);
        c.gridx = 2;
        p.add(label("City"), c);
        c.gridx = 3;
        p.add(tfCity, c);

        c.gridx = 0; c.gridy = 2;
        p.add(label("L.R. No."), c);
        c.gridx = 1;
        p.add(tfLrNo, c);
        return p;
    }

    private JComponent buildEntry() {
        JPanel p = new JPanel(new FlowLayout(FlowLayout.LEFT, 6, 4));
        p.setBorder(new TitledBorder("Add Item"));
        JButton btnAdd = new JButton("Add");
        btnAdd.addActionListener(e -> addItem());
        tfRate.addActionListener(e -> addItem());

        p.add(label("Item Name"));
        p.add(cbItem);
        p.add(label("Qty"));
        p.add(tfQty);
        p.add(label("Rate"));
        p.add(tfRate);
        p.add(btnAdd);
        return p;
    }

    private JComponent buildTotals() {
        JPanel p = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 4));
        p.setBorder(new TitledBorder("Totals"));
        p.add(label("Tax %"));
        p.add(tfTax);
        p.add(label("P & F"));
        p.add(tfPf);
        p.add(label("Sub Total"));
        p.add(lbSubtotal);
        p.add(label("Tax Amount"));
        p.add(lbTaxAmount);
        p.add(label("Grand Total"));
        lbGrandTotal.setFont(lbGrandTotal.getFont().deriveFont(Font.BOLD));
        p.add(lbGrandTotal);
        return p;
    }

    private JComponent buildActions() {
        JPanel p = new JPanel(new BorderLayout());
        JPanel left = new JPanel(new FlowLayout(FlowLayout.LEFT));
        JButton btnDelete = new JButton("Delete Selected");
        JButton btnSave = new JButton("Save Invoice");
        JButton btnExport = new JButton("Export PDF");
        JButton btnNew = new JButton("New Invoice");
        btnDelete.addActionListener(e -> deleteSelected());
        btnSave.addActionListener(e -> saveInvoice());
        btnExport.addActionListener(e -> exportPdf());
        btnNew.addActionListener(e -> newInvoice());
        left.add(btnDelete);
        left.add(btnSave);
        left.add(btnExport);

        JPanel right = new JPanel(new FlowLayout(FlowLayout.RIGHT));
        right.add(btnNew);

        p.add(left, BorderLayout.WEST);
        p.add(right, BorderLayout.EAST);
        return p;
    }

    private JMenuBar buildMenu() {
        JMenuBar mb = new JMenuBar();

        JMenu file = new JMenu("File");
        file.add(menuItem("New Invoice", this::newInvoice));
        file.add(menuItem("Open Invoice...", this::openInvoice));
        file.addSeparator();
        file.add(menuItem("Export All to CSV...", this::exportAllCsv));
        file.add(menuItem("Backup DB...", this::backupDatabase));
        file.addSeparator();
        file.add(menuItem("Exit", () -> dispatchEvent(new WindowEvent(this, WindowEvent.WINDOW_CLOSING))));
        mb.add(file);

        JMenu admin = new JMenu("Admin");
        admin.add(menuItem("Settings", this::openSettings));
        admin.add(menuItem("Item Master", this::openItemMaster));
        admin.add(menuItem("Import Invoices from CSV...", this::importCsv));
        admin.add(menuItem("Reset Chalan Counter", this::resetCounter));
        mb.add(admin);

        JMenu help = new JMenu("Help");
        help.add(menuItem("About", () -> JOptionPane.showMessageDialog(this,
                BillingApplication.APP_TITLE + "\nPDFs rendered with openhtmltopdf.",
                "About", JOptionPane.INFORMATION_MESSAGE)));
        mb.add(help);
        return mb;
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Item actions
    // ──────────────────────────────────────────────────────────────────────────

    private void onMasterItemSelected() {
        if (refreshingItems) {
            return;
        }
        Object selected = cbItem.getSelectedItem();
        if (selected == null) {
            return;
        }
        run(() -> billing.rateFor(selected.toString())
                .ifPresent(rate -> tfRate.setText(Amounts.money(rate))));
    }

    private void addItem() {
        try {
            billing.addItem(itemText(), tfQty.getText(), tfRate.getText());
        } catch (ValidationException e) {
            error("Invalid Input", e.getMessage());
            return;
        } catch (BillingException e) {
            failure("Add Item", e);
            return;
        }
        clearEntry();
        refreshItemChoices();
        refreshTable();
    }

    private void deleteSelected() {
        int[] rows = table.getSelectedRows();
        if (rows.length == 0) {
            return;
        }
        billing.removeItems(rows);
        refreshTable();
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Invoice actions
    // ──────────────────────────────────────────────────────────────────────────

    private void saveInvoice() {
        if (!prepareForOutput()) {
            return;
        }
        try {
            long id = billing.save();
            JOptionPane.showMessageDialog(this, "Invoice saved with ID #" + id, "Saved",
                    JOptionPane.INFORMATION_MESSAGE);
        } catch (DuplicateChalanException e) {
            error("Save Failed", "Chalan number already exists. Start a new invoice.");
        } catch (ValidationException e) {
            warning("No items", e.getMessage());
        } catch (BillingException e) {
            failure("Save Failed", e);
        }
    }

    private void exportPdf() {
        if (!prepareForOutput()) {
            return;
        }
        Path pdf;
        try {
            pdf = billing.exportPdf();
        } catch (ValidationException e) {
            warning("No items", e.getMessage());
            return;
        } catch (BillingException e) {
            failure("PDF Error", e);
            return;
        }
        if (app.getConfig().isOpenPdfAfterExport()) {
            openInViewer(pdf);
        }
        JOptionPane.showMessageDialog(this, "Saved to: " + pdf.toAbsolutePath(), "PDF Exported",
                JOptionPane.INFORMATION_MESSAGE);
    }

    /**
     * Copies the form into the current invoice and adds a fully typed entry row.
     *
     * @return false if the header is invalid
     */
    private boolean prepareForOutput() {
        normalizeChargeFields();
        if (billing.addPendingItem(itemText(), tfQty.getText(), tfRate.getText())) {
            clearEntry();
            refreshItemChoices();
            refreshTable();
        }
        try {
            billing.updateHeader(tfParty.getText(), tfCity.getText(), tfLrNo.getText(), tfDate.getText());
            tfDate.setText(billing.getCurrent().getFormattedDate());
            return true;
        } catch (ValidationException e) {
            error("Invalid Input", e.getMessage());
            return false;
        }
    }

    private void newInvoice() {
        run(() -> {
            Invoice invoice = billing.newInvoice();
            showInvoice(invoice);
            JOptionPane.showMessageDialog(this, "Chalan No: " + invoice.getChalanNo(), "New Invoice",
                    JOptionPane.INFORMATION_MESSAGE);
        });
    }

    private void openInvoice() {
        String input = JOptionPane.showInputDialog(this, "Enter chalan no", "Open Invoice",
                JOptionPane.QUESTION_MESSAGE);
        if (input == null) {
            return;
        }
        int chalanNo;
        try {
            chalanNo = Integer.parseInt(input.trim());
        } catch (NumberFormatException e) {
            error("Invalid", "Enter valid number");
            return;
        }
        run(() -> {
            Optional<Invoice> found = billing.open(chalanNo);
            if (found.isPresent()) {
                showInvoice(found.get());
            } else {
                error("Not found", "No invoice with chalan " + chalanNo);
            }
        });
    }

    private void resetCounter() {
        int answer = JOptionPane.showConfirmDialog(this,
                "Are you sure you want to reset Chalan counter to 1?", "Reset Counter",
                JOptionPane.YES_NO_OPTION);
        if (answer != JOptionPane.YES_OPTION) {
            return;
        }
        run(() -> {
            Invoice invoice = billing.resetCounter();
            showInvoice(invoice);
            JOptionPane.showMessageDialog(this,
                    "Chalan counter reset.\nCurrent Chalan No: " + invoice.getChalanNo() + "\nInvoice form cleared.",
                    "Reset Done", JOptionPane.INFORMATION_MESSAGE);
        });
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Admin actions
    // ──────────────────────────────────────────────────────────────────────────

    private void openSettings() {
        run(() -> new SettingsDialog(this, app.getSettingsStore()).setVisible(true));
    }

    private void openItemMaster() {
        run(() -> new ItemMasterDialog(this, app.getItemMaster(), this::refreshItemChoices).setVisible(true));
    }

    private void exportAllCsv() {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Export invoices to CSV");
        chooser.setFileFilter(new FileNameExtensionFilter("CSV", "csv"));
        if (chooser.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        File selected = chooser.getSelectedFile();
        if (!selected.getName().toLowerCase().endsWith(".csv")) {
            selected = new File(selected.getParentFile(), selected.getName() + ".csv");
        }
        Path target = selected.toPath();
        run(() -> {
            CsvTransfer.ExportedFiles files = app.getCsvTransfer().exportAll(target);
            JOptionPane.showMessageDialog(this,
                    "Invoices -> " + files.getInvoices() + "\nItems -> " + files.getItems(),
                    "Exported", JOptionPane.INFORMATION_MESSAGE);
        });
    }

    private void importCsv() {
        JFileChooser chooser = new JFileChooser();
        chooser.setFileFilter(new FileNameExtensionFilter("CSV", "csv"));
        chooser.setDialogTitle("Select invoices CSV");
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path invoicesFile = chooser.getSelectedFile().toPath();
        chooser.setDialogTitle("Select invoice_items CSV");
        chooser.setSelectedFile(CsvTransfer.itemsFileFor(invoicesFile).toFile());
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path itemsFile = chooser.getSelectedFile().toPath();
        run(() -> {
            int count = app.getCsvTransfer().importAll(invoicesFile, itemsFile);
            JOptionPane.showMessageDialog(this, "Imported " + count + " invoices (skipped duplicates)",
                    "Imported", JOptionPane.INFORMATION_MESSAGE);
        });
    }

    private void backupDatabase() {
        JFileChooser chooser = new JFileChooser();
        chooser.setDialogTitle("Select backup folder");
        chooser.setFileSelectionMode(JFileChooser.DIRECTORIES_ONLY);
        if (chooser.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path folder = chooser.getSelectedFile().toPath();
        run(() -> {
            Path dest = app.getBackup().backupTo(folder);
            JOptionPane.showMessageDialog(this, "Backup saved to " + dest, "Backup",
                    JOptionPane.INFORMATION_MESSAGE);
        });
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Form state
    // ──────────────────────────────────────────────────────────────────────────

    private void showInvoice(Invoice invoice) {
        lbChalan.setText("Chalan No: " + invoice.getChalanNo());
        tfParty.setText(invoice.getPartyName());
        tfCity.setText(invoice.getCity());
        tfLrNo.setText(invoice.getLrNo());
        tfDate.setText(invoice.getFormattedDate());
        tfTax.setText(Amounts.quantity(invoice.getTaxPercent()));
        tfPf.setText(Amounts.quantity(invoice.getPackingForwarding()));
        clearEntry();
        refreshTable();
    }

    private void refreshTable() {
        itemsModel.setItems(billing.getCurrent().getItems());
        refreshTotals();
    }

    private void refreshTotals() {
        billing.updateTaxPercent(tfTax.getText());
        billing.updatePackingForwarding(tfPf.getText());
        Invoice invoice = billing.getCurrent();
        lbSubtotal.setText(Amounts.money(invoice.getSubtotal()));
        lbTaxAmount.setText(Amounts.money(invoice.getTaxAmount()));
        lbGrandTotal.setText(Amounts.money(invoice.getGrandTotal()));
    }

    private void normalizeChargeFields() {
        if (!Amounts.isNonNegative(tfTax.getText())) {
            tfTax.setText("0");
        }
        if (!Amounts.isNonNegative(tfPf.getText())) {
            tfPf.setText("0");
        }
    }

    private void refreshItemChoices() {
        refreshingItems = true;
        try {
            Object typed = cbItem.getEditor().getItem();
            cbItem.removeAllItems();
            for (MasterItem item : billing.masterItems()) {
                cbItem.addItem(item.getName());
            }
            cbItem.setSelectedItem(typed);
        } catch (BillingException e) {
            logger.warn("Could not load item master: {}", e.getMessage());
        } finally {
            refreshingItems = false;
        }
    }

    private void clearEntry() {
        refreshingItems = true;
        try {
            cbItem.setSelectedItem("");
        } finally {
            refreshingItems = false;
        }
        tfQty.setText("");
        tfRate.setText("");
    }

    private String itemText() {
        Object typed = cbItem.getEditor().getItem();
        return typed == null ? "" : typed.toString();
    }

    private void openInViewer(Path pdf) {
        try {
            if (Desktop.isDesktopSupported() && Desktop.getDesktop().isSupported(Desktop.Action.OPEN)) {
                Desktop.getDesktop().open(pdf.toFile());
            } else {
                logger.info("No desktop viewer available for {}", pdf);
            }
        } catch (IOException | UnsupportedOperationException | SecurityException e) {
            logger.warn("Could not open {} in the system viewer: {}", pdf, e.getMessage());
        }
    }

    // ──────────────────────────────────────────────────────────────────────────
    // Helpers
    // ──────────────────────────────────────────────────────────────────────────

    /** Runs a UI action, reporting application errors in a dialog. */
    private void run(Runnable action) {
        try {
            action.run();
        } catch (ValidationException e) {
            error("Invalid Input", e.getMessage());
        } catch (BillingException e) {
            failure("Error", e);
        }
    }

    private void failure(String title, BillingException e) {
        logger.error("{} [{}]: {}", title, e.getCode(), e.getMessage(), e);
        error(title, e.getMessage());
    }

    private void error(String title, String message) {
        JOptionPane.showMessageDialog(this, message, title, JOptionPane.ERROR_MESSAGE);
    }

    private void warning(String title, String message) {
        JOptionPane.showMessageDialog(this, message, title, JOptionPane.WARNING_MESSAGE);
    }

    private static JMenuItem menuItem(String text, Runnable action) {
        JMenuItem mi = new JMenuItem(text);
        mi.addActionListener(e -> action.run());
        return mi;
    }

    private static JLabel label(String text) {
        return new JLabel(text);
    }
}
