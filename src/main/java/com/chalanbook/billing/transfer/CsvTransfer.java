package com.chalanbook.billing.transfer;

import com.chalanbook.billing.exception.StorageException;
import com.chalanbook.billing.store.Database;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CSV export and import of all saved invoices.
 *
 * <p>Invoices go to the chosen file, their items to a sibling
 * {@code <name>_items.csv}. Both files carry the database row ids so items can
 * be re-attached to their invoice on import.
 */
public class CsvTransfer {

    private static final Logger logger = LoggerFactory.getLogger(CsvTransfer.class);

    private static final String INSERT_INVOICE =
        "INSERT INTO invoices (chalan_no, party_name, city, lr_no, dt, tax_percent, pandf,"
            + " subtotal, tax_amount, grand_total) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String INSERT_ITEM =
        "INSERT INTO invoice_items (invoice_id, sr, item_name, qty, rate, amount) VALUES (?, ?, ?, ?, ?, ?)";

    private static final String[] INVOICE_AMOUNT_COLUMNS =
        { "tax_percent", "pandf", "subtotal", "tax_amount", "grand_total" };

    private static final String[] ITEM_AMOUNT_COLUMNS = { "qty", "rate", "amount" };

    private final Database database;
    private final CsvMapper mapper;

    public CsvTransfer(Database database) {
        this.database = database;
        this.mapper = new CsvMapper();
        this.mapper.enable(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN);
    }

    /** Paths written by {@link #exportAll(Path)}. */
    public static class ExportedFiles {
        private final Path invoices;
        private final Path items;

        public ExportedFiles(Path invoices, Path items) {
            this.invoices = invoices;
            this.items = items;
        }

        public Path getInvoices() { return invoices; }
        public Path getItems() { return items; }
    }

    /**
     * Sibling items file for an invoices CSV: {@code a/b/all.csv -> a/b/all_items.csv}.
     */
    public static Path itemsFileFor(Path invoicesFile) {
        String name = invoicesFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return invoicesFile.resolveSibling(base + "_items.csv");
    }

    public ExportedFiles exportAll(Path invoicesFile) {
        Path itemsFile = itemsFileFor(invoicesFile);
        try (Connection connection = database.connect()) {
            List<InvoiceCsvRow> invoices = readInvoices(connection);
            List<InvoiceItemCsvRow> items = readItems(connection);
            write(invoicesFile, InvoiceCsvRow.class, invoices);
            write(itemsFile, InvoiceItemCsvRow.class, items);
            logger.info("Exported {} invoice(s) to {} and {} item(s) to {}",
                    invoices.size(), invoicesFile, items.size(), itemsFile);
        } catch (SQLException e) {
            throw new StorageException("Failed to read invoices for export", e);
        } catch (IOException e) {
            throw new StorageException("Failed to write " + invoicesFile, "CSV_EXPORT_FAILED", e);
        }
        return new ExportedFiles(invoicesFile, itemsFile);
    }

    /**
     * Imports invoices and their items. Invoices whose chalan number is already
     * saved are skipped together with their items. Rows with an unreadable
     * number, and items with a quantity that is not positive or a negative
     * rate, are skipped with a warning.
     *
     * @return number of invoices imported
     */
    public int importAll(Path invoicesFile, Path itemsFile) {
        List<Map<String, String>> invoiceRows = readRows(invoicesFile);
        List<Map<String, String>> itemRows = readRows(itemsFile);

        int imported = 0;
        Map<Long, Long> newIdByOldId = new HashMap<>();
        try (Connection connection = database.connect()) {
            connection.setAutoCommit(false);
            try (PreparedStatement insertInvoice = connection.prepareStatement(INSERT_INVOICE, Statement.RETURN_GENERATED_KEYS);
                 PreparedStatement insertItem = connection.prepareStatement(INSERT_ITEM)) {
                for (Map<String, String> row : invoiceRows) {
                    Integer chalanNo = parseInt(row.get("chalan_no"));
                    if (chalanNo == null) {
                        logger.warn("Skipping invoice row without a chalan number: {}", row);
                        continue;
                    }
                    BigDecimal[] amounts = decimals(row, INVOICE_AMOUNT_COLUMNS);
                    if (amounts == null) {
                        logger.warn("Skipping chalan {}: unreadable amount in {}", chalanNo, row);
                        continue;
                    }
                    Long newId = insertInvoice(insertInvoice, chalanNo, row, amounts);
                    if (newId == null) {
                        logger.info("Skipping chalan {}: already saved", chalanNo);
                        continue;
                    }
                    imported++;
                    Long oldId = parseLong(row.get("id"));
                    if (oldId != null) {
                        newIdByOldId.put(oldId, newId);
                    } else {
                        logger.warn("Chalan {} has no readable id; its items cannot be attached", chalanNo);
                    }
                }

                int items = 0;
                for (Map<String, String> row : itemRows) {
                    Long oldInvoiceId = parseLong(row.get("invoice_id"));
                    if (oldInvoiceId == null) {
                        logger.warn("Skipping item row with unreadable invoice_id: {}", row);
                        continue;
                    }
                    Long invoiceId = newIdByOldId.get(oldInvoiceId);
                    if (invoiceId == null) {
                        logger.debug("Dropping item of skipped or unknown invoice {}: {}", oldInvoiceId, row);
                        continue;
                    }
                    BigDecimal[] values = decimals(row, ITEM_AMOUNT_COLUMNS);
                    if (values == null || values[0].signum() <= 0 || values[1].signum() < 0) {
                        logger.warn("Skipping item row with invalid qty, rate or amount: {}", row);
                        continue;
                    }
                    Integer sr = parseInt(row.get("sr"));
                    insertItem.setLong(1, invoiceId);
                    insertItem.setInt(2, sr == null ? 0 : sr);
                    insertItem.setString(3, text(row.get("item_name")));
                    insertItem.setDouble(4, values[0].doubleValue());
                    insertItem.setDouble(5, values[1].doubleValue());
                    insertItem.setDouble(6, values[2].doubleValue());
                    insertItem.executeUpdate();
                    items++;
                }
                connection.commit();
                logger.info("Imported {} invoice(s) with {} item(s) from {}", imported, items, invoicesFile);
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to import invoices from " + invoicesFile, "CSV_IMPORT_FAILED", e);
        }
        return imported;
    }

    /** @return the new row id, or null when the chalan number already exists */
    private Long insertInvoice(PreparedStatement ps, int chalanNo, Map<String, String> row,
                               BigDecimal[] amounts) throws SQLException {
        ps.setInt(1, chalanNo);
        ps.setString(2, text(row.get("party_name")));
        ps.setString(3, text(row.get("city")));
        ps.setString(4, text(row.get("lr_no")));
        ps.setString(5, text(row.get("dt")));
        for (int i = 0; i < amounts.length; i++) {
            ps.setDouble(6 + i, amounts[i].doubleValue());
        }
        try {
            ps.executeUpdate();
        } catch (SQLException e) {
            if (Database.isConstraintViolation(e)) {
                return null;
            }
            throw e;
        }
        try (ResultSet keys = ps.getGeneratedKeys()) {
            return keys.next() ? keys.getLong(1) : null;
        }
    }

    private List<InvoiceCsvRow> readInvoices(Connection connection) throws SQLException {
        List<InvoiceCsvRow> rows = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT id, chalan_no, party_name, city, lr_no, dt, tax_percent,"
                     + " pandf, subtotal, tax_amount, grand_total FROM invoices ORDER BY id")) {
            while (rs.next()) {
                InvoiceCsvRow row = new InvoiceCsvRow();
                row.setId(rs.getLong("id"));
                row.setChalanNo(rs.getInt("chalan_no"));
                row.setPartyName(rs.getString("party_name"));
                row.setCity(rs.getString("city"));
                row.setLrNo(rs.getString("lr_no"));
                row.setDate(rs.getString("dt"));
                row.setTaxPercent(Database.toDecimal(rs.getDouble("tax_percent")));
                row.setPackingForwarding(Database.toDecimal(rs.getDouble("pandf")));
                row.setSubtotal(Database.toDecimal(rs.getDouble("subtotal")));
                row.setTaxAmount(Database.toDecimal(rs.getDouble("tax_amount")));
                row.setGrandTotal(Database.toDecimal(rs.getDouble("grand_total")));
                rows.add(row);
            }
        }
        return rows;
    }

    private List<InvoiceItemCsvRow> readItems(Connection connection) throws SQLException {
        List<InvoiceItemCsvRow> rows = new ArrayList<>();
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT id, invoice_id, sr, item_name, qty, rate, amount"
                     + " FROM invoice_items ORDER BY id")) {
            while (rs.next()) {
                InvoiceItemCsvRow row = new InvoiceItemCsvRow();
                row.setId(rs.getLong("id"));
                row.setInvoiceId(rs.getLong("invoice_id"));
                row.setSr(rs.getInt("sr"));
                row.setItemName(rs.getString("item_name"));
                row.setQuantity(Database.toDecimal(rs.getDouble("qty")));
                row.setRate(Database.toDecimal(rs.getDouble("rate")));
                row.setAmount(Database.toDecimal(rs.getDouble("amount")));
                rows.add(row);
            }
        }
        return rows;
    }

    private <T> void write(Path file, Class<T> type, List<T> rows) throws IOException {
        CsvSchema schema = mapper.schemaFor(type).withHeader();
        try (SequenceWriter writer = mapper.writer(schema).writeValues(file.toFile())) {
            writer.writeAll(rows);
        }
    }

    private List<Map<String, String>> readRows(Path file) {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(file.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new StorageException("Failed to read " + file, "CSV_IMPORT_FAILED", e);
        }
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }

    /**
     * Reads the given columns of a row; a blank cell counts as zero.
     *
     * @return the values in column order, or null if any cell is not a number
     */
    private static BigDecimal[] decimals(Map<String, String> row, String[] columns) {
        BigDecimal[] values = new BigDecimal[columns.length];
        for (int i = 0; i < columns.length; i++) {
            String value = row.get(columns[i]);
            if (value == null || value.isBlank()) {
                values[i] = BigDecimal.ZERO;
                continue;
            }
            try {
                values[i] = new BigDecimal(value.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return values;
    }

    private static Integer parseInt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }

    private static Long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim()).longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            return null;
        }
    }
}
