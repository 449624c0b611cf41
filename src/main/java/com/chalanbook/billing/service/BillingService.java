package com.chalanbook.billing.service;

import com.chalanbook.billing.exception.ValidationException;
import com.chalanbook.billing.model.Amounts;
import com.chalanbook.billing.model.CompanySettings;
import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.LineItem;
import com.chalanbook.billing.model.MasterItem;
import com.chalanbook.billing.pdf.InvoicePdfExporter;
import com.chalanbook.billing.store.ChalanCounter;
import com.chalanbook.billing.store.InvoiceRepository;
import com.chalanbook.billing.store.ItemMasterRepository;
import com.chalanbook.billing.store.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * The chalan currently on the form and every action the form offers on it.
 *
 * <p>The Swing layer only reads text out of its widgets and hands it here;
 * parsing, validation, numbering and persistence all happen in this class.
 */
public class BillingService {

    private static final Logger logger = LoggerFactory.getLogger(BillingService.class);

    public static final String INVALID_ITEM_MESSAGE = "Enter valid Item, Qty (>0) and Rate (>=0)";
    public static final String NO_ITEMS_MESSAGE = "Please add at least one item";

    private final ChalanCounter counter;
    private final InvoiceRepository invoices;
    private final ItemMasterRepository itemMaster;
    private final SettingsStore settings;
    private final InvoicePdfExporter exporter;
    private final Clock clock;

    private Invoice current;

    public BillingService(ChalanCounter counter, InvoiceRepository invoices, ItemMasterRepository itemMaster,
                          SettingsStore settings, InvoicePdfExporter exporter, Clock clock) {
        this.counter = counter;
        this.invoices = invoices;
        this.itemMaster = itemMaster;
        this.settings = settings;
        this.exporter = exporter;
        this.clock = clock;
    }

    public Invoice getCurrent() {
        if (current == null) {
            throw new IllegalStateException("No invoice on the form; call newInvoice() first");
        }
        return current;
    }

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    // ── Invoice lifecycle ────────────────────────────────────────────────────

    /**
     * Clears the form and allocates the next chalan number.
     */
    public Invoice newInvoice() {
        current = new Invoice(counter.next(), today());
        logger.info("Started chalan {}", current.getChalanNo());
        return current;
    }

    /**
     * Loads a saved chalan onto the form.
     *
     * @return empty when no invoice has that number; the form is left unchanged
     */
    public Optional<Invoice> open(int chalanNo) {
        Optional<Invoice> found = invoices.findByChalanNo(chalanNo);
        found.ifPresent(invoice -> {
            if (invoice.getDate() == null) {
                invoice.setDate(today());
            }
            current = invoice;
            logger.info("Opened chalan {}", chalanNo);
        });
        return found;
    }

    /**
     * Resets the counter to zero and starts a fresh chalan, which will be number 1.
     */
    public Invoice resetCounter() {
        counter.reset(0);
        return newInvoice();
    }

    // ── Header and charges ───────────────────────────────────────────────────

    /**
     * Copies the party fields from the form. A blank date means today.
     *
     * @throws ValidationException if the date is not dd/MM/yyyy
     */
    public void updateHeader(String partyName, String city, String lrNo, String dateText) {
        Invoice invoice = getCurrent();
        invoice.setPartyName(trim(partyName));
        invoice.setCity(trim(city));
        invoice.setLrNo(trim(lrNo));
        invoice.setDate(parseDate(dateText));
    }

    /**
     * Applies the tax % field; anything that is not a number counts as zero.
     */
    public BigDecimal updateTaxPercent(String text) {
        BigDecimal value = Amounts.parseOrZero(text);
        getCurrent().setTaxPercent(value);
        return value;
    }

    /**
     * Applies the P &amp; F field; anything that is not a number counts as zero.
     */
    public BigDecimal updatePackingForwarding(String text) {
        BigDecimal value = Amounts.parseOrZero(text);
        getCurrent().setPackingForwarding(value);
        return value;
    }

    // ── Items ────────────────────────────────────────────────────────────────

    /**
     * Appends an item and remembers its rate in the item master.
     *
     * @throws ValidationException unless name is non-blank, qty &gt; 0 and rate &gt;= 0
     */
    public LineItem addItem(String name, String quantityText, String rateText) {
        LineItem item = parseItem(name, quantityText, rateText);
        getCurrent().getItems().add(item);
        itemMaster.remember(item.getItemName(), item.getRate());
        logger.debug("Chalan {}: added {}", current.getChalanNo(), item);
        return item;
    }

    /**
     * Adds the half-typed entry row before a save or export, when all three
     * fields are filled in.
     *
     * @return true if an item was added
     */
    public boolean addPendingItem(String name, String quantityText, String rateText) {
        if (isBlank(name) || isBlank(quantityText) || isBlank(rateText)) {
            return false;
        }
        try {
            addItem(name, quantityText, rateText);
            return true;
        } catch (ValidationException e) {
            logger.warn("Ignoring pending entry row '{}': {}", name, e.getMessage());
            return false;
        }
    }

    /**
     * Removes items by their zero-based row index; out-of-range indices are ignored.
     */
    public void removeItems(int... rows) {
        List<LineItem> items = getCurrent().getItems();
        int[] sorted = rows.clone();
        Arrays.sort(sorted);
        for (int i = sorted.length - 1; i >= 0; i--) {
            int row = sorted[i];
            if (row >= 0 && row < items.size() && (i == sorted.length - 1 || sorted[i + 1] != row)) {
                items.remove(row);
            }
        }
    }

    public Optional<BigDecimal> rateFor(String itemName) {
        return itemMaster.findRateByName(itemName);
    }

    public List<MasterItem> masterItems() {
        return itemMaster.findAll();
    }

    // ── Save / export ────────────────────────────────────────────────────────

    /**
     * @return the invoice row id
     * @throws ValidationException if the chalan has no items
     * @throws com.chalanbook.billing.exception.DuplicateChalanException if the number is already saved
     */
    public long save() {
        requireItems();
        return invoices.save(current);
    }

    /**
     * @return the written PDF
     * @throws ValidationException if the chalan has no items
     */
    public Path exportPdf() {
        requireItems();
        CompanySettings company = settings.load();
        return exporter.export(current, company);
    }

    /**
     * Renders an already saved chalan without touching the form.
     */
    public Optional<Path> exportSaved(int chalanNo) {
        return invoices.findByChalanNo(chalanNo)
                .map(invoice -> exporter.export(invoice, settings.load()));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    static LineItem parseItem(String name, String quantityText, String rateText) {
        if (isBlank(name)) {
            throw new ValidationException(INVALID_ITEM_MESSAGE, "itemName");
        }
        BigDecimal quantity;
        BigDecimal rate;
        try {
            quantity = Amounts.parse(quantityText, "quantity");
            rate = Amounts.parse(rateText, "rate");
        } catch (ValidationException e) {
            throw new ValidationException(INVALID_ITEM_MESSAGE, e.getField());
        }
        if (quantity.signum() <= 0) {
            throw new ValidationException(INVALID_ITEM_MESSAGE, "quantity");
        }
        if (rate.signum() < 0) {
            throw new ValidationException(INVALID_ITEM_MESSAGE, "rate");
        }
        return new LineItem(name.trim(), quantity, rate);
    }

    private LocalDate parseDate(String text) {
        if (isBlank(text)) {
            return today();
        }
        try {
            return LocalDate.parse(text.trim(), Invoice.DATE_FORMAT);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Date must be in dd/MM/yyyy format: " + text.trim(), "date");
        }
    }

    private void requireItems() {
        if (getCurrent().getItems().isEmpty()) {
            throw new ValidationException(NO_ITEMS_MESSAGE, "items");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    private static String trim(String s) {
        return s == null ? "" : s.trim();
    }
}
