package com.chalanbook.billing.store;

import com.chalanbook.billing.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Optional;

/**
 * Persistent chalan number sequence kept in the {@code meta} table.
 *
 * <p>The stored value is the last number handed out. When the row is missing
 * or unreadable the sequence continues from the highest saved chalan, so a
 * damaged counter never re-issues a number that is already on an invoice.
 */
public class ChalanCounter {

    private static final Logger logger = LoggerFactory.getLogger(ChalanCounter.class);

    static final String META_KEY = "chalan_no";

    private final Database database;

    public ChalanCounter(Database database) {
        this.database = database;
    }

    /**
     * Allocates and persists the next chalan number.
     */
    public int next() {
        try (Connection connection = database.connect()) {
            connection.setAutoCommit(false);
            Optional<String> stored = MetaStore.get(connection, META_KEY);
            int last;
            if (stored.isPresent() && isInteger(stored.get())) {
                last = Integer.parseInt(stored.get().trim());
            } else {
                last = maxSavedChalan(connection);
                logger.warn("Chalan counter {} is missing or invalid, continuing after saved chalan {}",
                        stored.orElse("<absent>"), last);
            }
            int next;
            try {
                next = Math.addExact(last, 1);
            } catch (ArithmeticException e) {
                throw new StorageException("Chalan numbers exhausted after " + last, "CHALAN_COUNTER_EXHAUSTED", e);
            }
            MetaStore.set(connection, META_KEY, String.valueOf(next));
            connection.commit();
            logger.debug("Allocated chalan {}", next);
            return next;
        } catch (SQLException e) {
            throw new StorageException("Failed to allocate chalan number", e);
        }
    }

    /**
     * Last number handed out, without allocating a new one.
     */
    public int peek() {
        try (Connection connection = database.connect()) {
            Optional<String> stored = MetaStore.get(connection, META_KEY);
            if (stored.isPresent() && isInteger(stored.get())) {
                return Integer.parseInt(stored.get().trim());
            }
            return maxSavedChalan(connection);
        } catch (SQLException e) {
            throw new StorageException("Failed to read chalan counter", e);
        }
    }

    /**
     * Sets the counter so that the next allocation returns {@code value + 1}.
     */
    public void reset(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Chalan counter cannot be negative: " + value);
        }
        try (Connection connection = database.connect()) {
            MetaStore.set(connection, META_KEY, String.valueOf(value));
        } catch (SQLException e) {
            throw new StorageException("Failed to reset chalan counter", e);
        }
        logger.info("Chalan counter reset to {}", value);
    }

    private static int maxSavedChalan(Connection connection) throws SQLException {
        try (Statement st = connection.createStatement();
             ResultSet rs = st.executeQuery("SELECT MAX(chalan_no) FROM invoices")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private static boolean isInteger(String value) {
        try {
            Integer.parseInt(value.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
