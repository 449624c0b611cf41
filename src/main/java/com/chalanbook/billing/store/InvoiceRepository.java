package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.DuplicateChalanException;
import com.chalanbook.billing.exception.StorageException;
import com.chalanbook.billing.model.Invoice;
import com.chalanbook.billing.model.LineItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saved invoices and their line items.
 */
public class InvoiceRepository {

    private static final Logger logger = LoggerFactory.getLogger(InvoiceRepository.class);

    private static final String INSERT_INVOICE =
        "INSERT INTO invoices (chalan_no, party_name, city, lr_no, dt, tax_percent, pandf,"
            + " subtotal, tax_amount, grand_total) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String INSERT_ITEM =
        "INSERT INTO invoice_items (invoice_id, sr, item_name, qty, rate, amount) VALUES (?, ?, ?, ?, ?, ?)";

    private static final String SELECT_INVOICE =
        "SELECT id, chalan_no, party_name, city, lr_no, dt, tax_percent, pandf FROM invoices";

    private final Database database;

    public InvoiceRepository(Database database) {
        this.database = database;
    }

    /**
     * Saves the invoice header and its items in one transaction. Subtotal, tax
     * and grand total are stored as computed at save time.
     *
     * @return the generated invoice row id
     * @throws DuplicateChalanException if the chalan number is already saved
     */
    public long save(Invoice invoice) {
        try (Connection connection = database.connect()) {
            connection.setAutoCommit(false);
            try {
                long id = insertInvoice(connection, invoice);
                insertItems(connection, id, invoice.getItems());
                connection.commit();
                logger.info("Saved chalan {} as invoice #{} with {} item(s), grand total {}",
                        invoice.getChalanNo(), id, invoice.getItems().size(), invoice.getGrandTotal());
                return id;
            } catch (SQLException e) {
                connection.rollback();
                if (Database.isConstraintViolation(e)) {
                    throw new DuplicateChalanException(invoice.getChalanNo(), e);
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to save chalan " + invoice.getChalanNo(), e);
        }
    }

    public Optional<Invoice> findByChalanNo(int chalanNo) {
        try (Connection connection = database.connect();
             PreparedStatement ps = connection.prepareStatement(SELECT_INVOICE + " WHERE chalan_no = ?")) {
            ps.setInt(1, chalanNo);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                long id = rs.getLong("id");
                Invoice invoice = mapInvoice(rs);
                invoice.setItems(loadItems(connection, id));
                return Optional.of(invoice);
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to load chalan " + chalanNo, e);
        }
    }

    public boolean exists(int chalanNo) {
        try (Connection connection = database.connect();
             PreparedStatement ps = connection.prepareStatement("SELECT 1 FROM invoices WHERE chalan_no = ?")) {
            ps.setInt(1, chalanNo);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to look up chalan " + chalanNo, e);
        }
    }

    /**
     * All saved invoices with their items, ordered by chalan number.
     */
    public List<Invoice> findAll() {
        List<Invoice> invoices = new ArrayList<>();
        try (Connection connection = database.connect();
             Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery(SELECT_INVOICE + " ORDER BY chalan_no")) {
            List<Long> ids = new ArrayList<>();
            while (rs.next()) {
                ids.add(rs.getLong("id"));
                invoices.add(mapInvoice(rs));
            }
            for (int i = 0; i < invoices.size(); i++) {
                invoices.get(i).setItems(loadItems(connection, ids.get(i)));
            }
        } catch (SQLException e) {
            throw new StorageException("Failed to list invoices", e);
        }
        return invoices;
    }

    public int maxChalanNo() {
        try (Connection connection = database.connect();
             Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT MAX(chalan_no) FROM invoices")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new StorageException("Failed to read highest chalan number", e);
        }
    }

    private long insertInvoice(Connection connection, Invoice invoice) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(INSERT_INVOICE, Statement.RETURN_GENERATED_KEYS)) {
            ps.setInt(1, invoice.getChalanNo());
            ps.setString(2, invoice.getPartyName());
            ps.setString(3, invoice.getCity());
            ps.setString(4, invoice.getLrNo());
            ps.setString(5, invoice.getFormattedDate());
            ps.setDouble(6, invoice.getTaxPercent().doubleValue());
            ps.setDouble(7, invoice.getPackingForwarding().doubleValue());
            ps.setDouble(8, invoice.getSubtotal().doubleValue());
            ps.setDouble(9, invoice.getTaxAmount().doubleValue());
            ps.setDouble(10, invoice.getGrandTotal().doubleValue());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for chalan " + invoice.getChalanNo());
                }
                return keys.getLong(1);
            }
        }
    }

    private void insertItems(Connection connection, long invoiceId, List<LineItem> items) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(INSERT_ITEM)) {
            int sr = 1;
            for (LineItem item : items) {
                ps.setLong(1, invoiceId);
                ps.setInt(2, sr++);
                ps.setString(3, item.getItemName());
                ps.setDouble(4, item.getQuantity().doubleValue());
                ps.setDouble(5, item.getRate().doubleValue());
                ps.setDouble(6, item.getAmount().doubleValue());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private List<LineItem> loadItems(Connection connection, long invoiceId) throws SQLException {
        List<LineItem> items = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(
                "SELECT item_name, qty, rate FROM invoice_items WHERE invoice_id = ? ORDER BY sr")) {
            ps.setLong(1, invoiceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    items.add(new LineItem(
                            rs.getString("item_name"),
                            Database.toDecimal(rs.getDouble("qty")),
                            Database.toDecimal(rs.getDouble("rate"))));
                }
            }
        }
        return items;
    }

    private Invoice mapInvoice(ResultSet rs) throws SQLException {
        Invoice invoice = new Invoice(rs.getInt("chalan_no"), parseDate(rs.getString("dt")));
        invoice.setPartyName(nullToEmpty(rs.getString("party_name")));
        invoice.setCity(nullToEmpty(rs.getString("city")));
        invoice.setLrNo(nullToEmpty(rs.getString("lr_no")));
        invoice.setTaxPercent(Database.toDecimal(rs.getDouble("tax_percent")));
        invoice.setPackingForwarding(Database.toDecimal(rs.getDouble("pandf")));
        return invoice;
    }

    static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim(), Invoice.DATE_FORMAT);
        } catch (DateTimeParseException e) {
            logger.warn("Unreadable invoice date '{}'", text);
            return null;
        }
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
